package br.ufmg.cs.systems.wfc.visualization;

import java.awt.image.BufferedImage;

/**
 * Paints a snapshot as a square block of {@code tileSize} pixels per cell.
 * In debug mode collapsed cells get a red outline.
 */
public class FrameRenderer {
   static final int DEBUG_OUTLINE = 0xFF0000;

   private final int tileSize;
   private final boolean debug;

   public FrameRenderer(int tileSize, boolean debug) {
      if (tileSize < 1) {
         throw new IllegalArgumentException("tile size must be positive, got " +
                 tileSize);
      }
      this.tileSize = tileSize;
      this.debug = debug;
   }

   public BufferedImage render(WaveSnapshot snapshot) {
      BufferedImage frame = new BufferedImage(snapshot.getWidth() * tileSize,
              snapshot.getHeight() * tileSize, BufferedImage.TYPE_INT_RGB);

      for (int y = 0; y < snapshot.getHeight(); ++y) {
         for (int x = 0; x < snapshot.getWidth(); ++x) {
            boolean outline = debug && snapshot.isCollapsed(x, y);
            paintCell(frame, x, y, snapshot.color(x, y), outline);
         }
      }

      return frame;
   }

   private void paintCell(BufferedImage frame, int x, int y, int rgb,
                          boolean outline) {
      int x0 = x * tileSize;
      int y0 = y * tileSize;
      for (int py = 0; py < tileSize; ++py) {
         for (int px = 0; px < tileSize; ++px) {
            boolean border = px == 0 || py == 0 ||
                    px == tileSize - 1 || py == tileSize - 1;
            frame.setRGB(x0 + px, y0 + py, outline && border ? DEBUG_OUTLINE : rgb);
         }
      }
   }

   public int getTileSize() {
      return tileSize;
   }

   public boolean isDebug() {
      return debug;
   }
}
