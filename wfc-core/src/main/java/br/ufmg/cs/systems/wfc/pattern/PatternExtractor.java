package br.ufmg.cs.systems.wfc.pattern;

import br.ufmg.cs.systems.wfc.conf.Configuration;
import br.ufmg.cs.systems.wfc.exceptions.InvalidInputException;
import br.ufmg.cs.systems.wfc.io.PixelBuffer;
import org.apache.log4j.Logger;

/**
 * Slides an N×N window over the exemplar and collects the blocks it sees,
 * optionally with their symmetry variants, into a {@link PatternCatalogue}.
 */
public class PatternExtractor {
   private static final Logger LOG = Logger.getLogger(PatternExtractor.class);

   private final int tileSize;
   private final int symmetry;
   private final boolean periodicInput;

   public PatternExtractor(Configuration config) {
      this(config.getTileSize(), config.getSymmetry(), config.isInputPeriodic());
   }

   /**
    * @param symmetry      variants per window, 1 to disable expansion
    * @param periodicInput wrap windows around the exemplar edges, so every
    *                      pixel is covered by N² windows
    */
   public PatternExtractor(int tileSize, int symmetry, boolean periodicInput) {
      if (tileSize < 1) {
         throw new InvalidInputException("tile size must be positive, got " +
                 tileSize);
      }
      if (symmetry < 1 || symmetry > Symmetry.MAX_VARIANTS) {
         throw new InvalidInputException("symmetry must be in [1, " +
                 Symmetry.MAX_VARIANTS + "], got " + symmetry);
      }
      this.tileSize = tileSize;
      this.symmetry = symmetry;
      this.periodicInput = periodicInput;
   }

   public PatternCatalogue extract(PixelBuffer exemplar) {
      if (exemplar == null) {
         throw new InvalidInputException("exemplar has no pixels");
      }
      if (tileSize > exemplar.getWidth() || tileSize > exemplar.getHeight()) {
         throw new InvalidInputException("tile size " + tileSize +
                 " exceeds exemplar " + exemplar.getWidth() + "x" +
                 exemplar.getHeight());
      }

      long start = 0;
      if (LOG.isInfoEnabled()) {
         start = System.currentTimeMillis();
         LOG.info("Extracting patterns," +
                 " exemplar=" + exemplar.getWidth() + "x" + exemplar.getHeight() +
                 " tileSize=" + tileSize +
                 " symmetry=" + symmetry +
                 " periodicInput=" + periodicInput);
      }

      int xmax = periodicInput ? exemplar.getWidth() :
              exemplar.getWidth() - tileSize + 1;
      int ymax = periodicInput ? exemplar.getHeight() :
              exemplar.getHeight() - tileSize + 1;

      PatternCatalogue.Builder builder = PatternCatalogue.builder(tileSize);
      for (int y = 0; y < ymax; ++y) {
         for (int x = 0; x < xmax; ++x) {
            Pattern block = Pattern.extract(exemplar, x, y, tileSize);
            for (Pattern variant : Symmetry.variants(block, symmetry)) {
               builder.insert(variant);
            }
         }
      }

      PatternCatalogue catalogue = builder.build();

      if (LOG.isInfoEnabled()) {
         LOG.info("Done extracting patterns," +
                 " windows=" + (xmax * ymax) +
                 " numPatterns=" + catalogue.size() +
                 " totalWeight=" + catalogue.getTotalWeight() +
                 " elapsed=" + (System.currentTimeMillis() - start) + " ms");
      }
      if (LOG.isDebugEnabled()) {
         LOG.debug(catalogue.toOutputString());
      }

      return catalogue;
   }

   public int getTileSize() {
      return tileSize;
   }

   public int getSymmetry() {
      return symmetry;
   }

   public boolean isPeriodicInput() {
      return periodicInput;
   }
}
