package br.ufmg.cs.systems.wfc.visualization;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class FrameRendererTest {

   @Test
   void scalesEachCellToATile() {
      BufferedImage frame = new FrameRenderer(4, false)
              .render(WaveSnapshot.reset(3, 2, 1, 0x336699));

      assertEquals(12, frame.getWidth());
      assertEquals(8, frame.getHeight());
      assertEquals(0x336699, frame.getRGB(0, 0) & 0xFFFFFF);
      assertEquals(0x336699, frame.getRGB(11, 7) & 0xFFFFFF);
   }

   @Test
   void debugOutlinesCollapsedCellsOnly() {
      WaveSnapshot snapshot = RenderFixtures.halfCollapsed();
      BufferedImage frame = new FrameRenderer(4, true).render(snapshot);

      // cell (1, 0) is collapsed
      assertEquals(FrameRenderer.DEBUG_OUTLINE, frame.getRGB(4, 0) & 0xFFFFFF);
      assertEquals(FrameRenderer.DEBUG_OUTLINE, frame.getRGB(7, 3) & 0xFFFFFF);
      assertEquals(snapshot.color(1, 0), frame.getRGB(5, 1) & 0xFFFFFF);
      // cell (0, 0) is not
      assertEquals(snapshot.color(0, 0), frame.getRGB(0, 0) & 0xFFFFFF);
   }

   @Test
   void noOutlineWithoutDebug() {
      WaveSnapshot snapshot = RenderFixtures.halfCollapsed();
      BufferedImage frame = new FrameRenderer(4, false).render(snapshot);

      assertEquals(snapshot.color(1, 0), frame.getRGB(4, 0) & 0xFFFFFF);
   }

   @Test
   void rejectsNonPositiveTileSize() {
      assertThrows(IllegalArgumentException.class, () -> new FrameRenderer(0, false));
   }
}
