package br.ufmg.cs.systems.wfc.pattern;

/**
 * Offsets {@code (dx, dy)} with {@code |dx|, |dy| < N}, excluding
 * {@code (0, 0)}, in row-major order. Direction {@code i} and
 * {@code size() - 1 - i} are opposite.
 */
public class Directions {
   private final int tileSize;
   private final int[] dx;
   private final int[] dy;

   public Directions(int tileSize) {
      if (tileSize < 1) {
         throw new IllegalArgumentException("tile size must be positive, got " +
                 tileSize);
      }
      this.tileSize = tileSize;
      int span = 2 * tileSize - 1;
      int count = span * span - 1;
      this.dx = new int[count];
      this.dy = new int[count];

      int d = 0;
      for (int y = -(tileSize - 1); y < tileSize; ++y) {
         for (int x = -(tileSize - 1); x < tileSize; ++x) {
            if (x == 0 && y == 0) continue;
            dx[d] = x;
            dy[d] = y;
            ++d;
         }
      }
   }

   public int getTileSize() {
      return tileSize;
   }

   public int size() {
      return dx.length;
   }

   public int dx(int direction) {
      return dx[direction];
   }

   public int dy(int direction) {
      return dy[direction];
   }

   public int opposite(int direction) {
      return dx.length - 1 - direction;
   }

   /**
    * @return index of {@code (dx, dy)}, or -1 if it is not a direction
    */
   public int indexOf(int dx, int dy) {
      if (Math.abs(dx) >= tileSize || Math.abs(dy) >= tileSize ||
              (dx == 0 && dy == 0)) {
         return -1;
      }
      int span = 2 * tileSize - 1;
      int position = (dy + tileSize - 1) * span + (dx + tileSize - 1);
      int center = (span * span - 1) / 2;
      return position < center ? position : position - 1;
   }

   @Override
   public String toString() {
      return "Directions(tileSize=" + tileSize + ", count=" + size() + ")";
   }
}
