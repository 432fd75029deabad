package br.ufmg.cs.systems.wfc.pattern;

import br.ufmg.cs.systems.wfc.TestExemplars;
import br.ufmg.cs.systems.wfc.conf.Configuration;
import br.ufmg.cs.systems.wfc.exceptions.InvalidInputException;
import br.ufmg.cs.systems.wfc.io.PixelBuffer;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PatternExtractorTest {

   @Test
   void uniformExemplarYieldsOnePatternWeightedByWindows() {
      PixelBuffer exemplar = TestExemplars.uniform(5, 4, TestExemplars.RED);

      PatternCatalogue periodic = new PatternExtractor(2, 1, true).extract(exemplar);
      assertEquals(1, periodic.size());
      assertEquals(5 * 4, periodic.get(0).getWeight());

      PatternCatalogue bounded = new PatternExtractor(2, 1, false).extract(exemplar);
      assertEquals(1, bounded.size());
      assertEquals(4 * 3, bounded.get(0).getWeight());
   }

   @Test
   void symmetryMultipliesWeightOfUniformBlock() {
      PixelBuffer exemplar = TestExemplars.uniform(3, 3, TestExemplars.BLUE);

      PatternCatalogue catalogue = new PatternExtractor(2, 8, true).extract(exemplar);

      assertEquals(1, catalogue.size());
      assertEquals(9 * 8, catalogue.getTotalWeight());
   }

   @Test
   void totalWeightIsWindowsTimesVariants() {
      PixelBuffer exemplar = TestExemplars.of(
              new int[]{1, 2, 3, 4},
              new int[]{5, 6, 7, 8},
              new int[]{9, 1, 2, 3});

      for (int symmetry = 1; symmetry <= 8; ++symmetry) {
         PatternCatalogue catalogue = new PatternExtractor(2, symmetry, true)
                 .extract(exemplar);
         assertEquals(12L * symmetry, catalogue.getTotalWeight(),
                 "symmetry " + symmetry);
      }
   }

   @Test
   void checkerboardHasTwoPatterns() {
      PatternCatalogue catalogue = new PatternExtractor(2, 1, true)
              .extract(TestExemplars.checkerboard(4, 4));

      assertEquals(2, catalogue.size());
      assertEquals(8, catalogue.get(0).getWeight());
      assertEquals(8, catalogue.get(1).getWeight());
      assertEquals(TestExemplars.BLACK, catalogue.get(0).topLeft());
   }

   @Test
   void fullSizeTileOnBoundedExemplarIsOnePattern() {
      PixelBuffer exemplar = TestExemplars.of(
              new int[]{1, 2, 3},
              new int[]{4, 5, 6},
              new int[]{7, 8, 9});

      PatternCatalogue catalogue = new PatternExtractor(3, 1, false).extract(exemplar);

      assertEquals(1, catalogue.size());
      assertEquals(1, catalogue.get(0).getWeight());
      assertEquals(1, catalogue.get(0).topLeft());
   }

   @Test
   void firstSeenOrderIsRowMajor() {
      PatternCatalogue catalogue = new PatternExtractor(1, 1, true)
              .extract(TestExemplars.stripes(3, 2,
                      TestExemplars.GREEN, TestExemplars.RED, TestExemplars.BLUE));

      assertEquals(3, catalogue.size());
      assertEquals(TestExemplars.GREEN, catalogue.get(0).topLeft());
      assertEquals(TestExemplars.RED, catalogue.get(1).topLeft());
      assertEquals(TestExemplars.BLUE, catalogue.get(2).topLeft());
   }

   @Test
   void tileLargerThanExemplar() {
      PatternExtractor extractor = new PatternExtractor(3, 1, true);

      assertThrows(InvalidInputException.class,
              () -> extractor.extract(TestExemplars.uniform(2, 5, 0)));
      assertThrows(InvalidInputException.class,
              () -> extractor.extract(TestExemplars.uniform(5, 2, 0)));
      assertThrows(InvalidInputException.class, () -> extractor.extract(null));
   }

   @Test
   void rejectsBadParameters() {
      assertThrows(InvalidInputException.class, () -> new PatternExtractor(0, 1, true));
      assertThrows(InvalidInputException.class, () -> new PatternExtractor(2, 0, true));
      assertThrows(InvalidInputException.class, () -> new PatternExtractor(2, 9, true));
   }

   @Test
   void readsParametersFromConfiguration() {
      Configuration config = new Configuration(new Properties())
              .set(Configuration.CONF_TILE_SIZE, 3)
              .set(Configuration.CONF_SYMMETRY_ENABLED, true)
              .set(Configuration.CONF_INPUT_PERIODIC, false);

      PatternExtractor extractor = new PatternExtractor(config);

      assertEquals(3, extractor.getTileSize());
      assertEquals(8, extractor.getSymmetry());
      assertFalse(extractor.isPeriodicInput());
   }
}
