package br.ufmg.cs.systems.wfc.pattern;

import br.ufmg.cs.systems.wfc.io.PixelBuffer;

import java.util.Arrays;

/**
 * Square block of packed RGB colors. Two patterns are equal when their pixels
 * are; index and weight are assigned by the {@link PatternCatalogue} and do
 * not take part in equality.
 */
public class Pattern {
   public static final int NO_INDEX = -1;

   private final int size;
   private final int[] pixels;
   private final int hash;
   private final int index;
   private final int weight;

   /**
    * @param pixels row-major colors, copied
    */
   public Pattern(int size, int[] pixels) {
      this(size, pixels.clone(), NO_INDEX, 0);
   }

   Pattern(int size, int[] pixels, int index, int weight) {
      if (pixels.length != size * size) {
         throw new IllegalArgumentException("pattern of size " + size +
                 " needs " + size * size + " pixels, got " + pixels.length);
      }
      this.size = size;
      this.pixels = pixels;
      this.hash = Arrays.hashCode(pixels);
      this.index = index;
      this.weight = weight;
   }

   /**
    * Reads the {@code size}x{@code size} block whose top-left corner is
    * {@code (x, y)}. Coordinates past the right or bottom edge wrap.
    */
   public static Pattern extract(PixelBuffer buffer, int x, int y, int size) {
      int[] pixels = new int[size * size];
      for (int dy = 0; dy < size; ++dy) {
         for (int dx = 0; dx < size; ++dx) {
            pixels[dy * size + dx] = buffer.getWrapped(x + dx, y + dy);
         }
      }
      return new Pattern(size, pixels, NO_INDEX, 0);
   }

   Pattern indexed(int index, int weight) {
      return new Pattern(size, pixels, index, weight);
   }

   public int getSize() {
      return size;
   }

   public int get(int x, int y) {
      return pixels[y * size + x];
   }

   public int topLeft() {
      return pixels[0];
   }

   public int getIndex() {
      return index;
   }

   public int getWeight() {
      return weight;
   }

   /**
    * Quarter turn clockwise.
    */
   public Pattern rotate() {
      int[] rotated = new int[pixels.length];
      for (int y = 0; y < size; ++y) {
         for (int x = 0; x < size; ++x) {
            rotated[y * size + x] = get(y, size - 1 - x);
         }
      }
      return new Pattern(size, rotated, NO_INDEX, 0);
   }

   /**
    * Mirror across the vertical axis.
    */
   public Pattern reflect() {
      int[] reflected = new int[pixels.length];
      for (int y = 0; y < size; ++y) {
         for (int x = 0; x < size; ++x) {
            reflected[y * size + x] = get(size - 1 - x, y);
         }
      }
      return new Pattern(size, reflected, NO_INDEX, 0);
   }

   /**
    * Whether {@code other}, placed at offset {@code (dx, dy)} from this
    * pattern, shows the same colors on the region both cover.
    */
   public boolean agrees(Pattern other, int dx, int dy) {
      int xmin = Math.max(0, dx);
      int xmax = Math.min(size, size + dx);
      int ymin = Math.max(0, dy);
      int ymax = Math.min(size, size + dy);
      for (int y = ymin; y < ymax; ++y) {
         for (int x = xmin; x < xmax; ++x) {
            if (get(x, y) != other.get(x - dx, y - dy)) {
               return false;
            }
         }
      }
      return true;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      Pattern that = (Pattern) o;
      return size == that.size && hash == that.hash &&
              Arrays.equals(pixels, that.pixels);
   }

   @Override
   public int hashCode() {
      return hash;
   }

   @Override
   public String toString() {
      return "Pattern{" +
              "index=" + index +
              ",weight=" + weight +
              ",size=" + size +
              ",topLeft=" + String.format("#%06X", topLeft()) +
              '}';
   }

   public String toOutputString() {
      StringBuilder builder = new StringBuilder(toString());
      for (int y = 0; y < size; ++y) {
         builder.append('\n');
         for (int x = 0; x < size; ++x) {
            if (x > 0) builder.append(' ');
            builder.append(String.format("%06X", get(x, y)));
         }
      }
      return builder.toString();
   }
}
