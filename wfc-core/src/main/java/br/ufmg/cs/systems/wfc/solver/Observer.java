package br.ufmg.cs.systems.wfc.solver;

import br.ufmg.cs.systems.wfc.pattern.PatternCatalogue;
import br.ufmg.cs.systems.wfc.util.collection.PatternBitSet;
import br.ufmg.cs.systems.wfc.wave.Wave;

import java.util.Random;

/**
 * Picks the next cell to collapse (minimum entropy among undecided cells) and
 * the pattern to collapse it to (weighted by pattern frequency).
 */
public class Observer {
   public static final int NO_CELL = -1;

   /** entropies closer than this are considered tied */
   static final double ENTROPY_EPSILON = 1e-9;

   private final TieBreak tieBreak;

   public Observer(TieBreak tieBreak) {
      this.tieBreak = tieBreak;
   }

   /**
    * @return the undecided cell of minimum entropy, or {@link #NO_CELL} if
    * every cell has at most one pattern left
    */
   public int selectCell(Wave wave, Random random) {
      double min = Double.POSITIVE_INFINITY;
      int argmin = NO_CELL;
      int ties = 0;

      for (int cell = 0; cell < wave.getNumCells(); ++cell) {
         if (wave.numPossible(cell) <= 1) continue;

         double entropy = wave.entropyOf(cell);
         if (entropy < min - ENTROPY_EPSILON) {
            min = entropy;
            argmin = cell;
            ties = 1;
         } else if (entropy <= min + ENTROPY_EPSILON) {
            ++ties;
            // reservoir sampling keeps each tied cell with probability 1/ties
            if (tieBreak == TieBreak.RANDOM && random.nextInt(ties) == 0) {
               argmin = cell;
            }
         }
      }

      return argmin;
   }

   /**
    * Samples one of the patterns still possible at {@code cell} with
    * probability proportional to its weight.
    */
   public int selectPattern(Wave wave, int cell, Random random) {
      PatternCatalogue catalogue = wave.getCatalogue();
      PatternBitSet candidates = wave.possiblePatterns(cell);

      double total = 0;
      for (int t = candidates.nextSetBit(0); t >= 0;
           t = candidates.nextSetBit(t + 1)) {
         total += catalogue.weight(t);
      }

      double r = random.nextDouble() * total;
      int last = -1;
      for (int t = candidates.nextSetBit(0); t >= 0;
           t = candidates.nextSetBit(t + 1)) {
         r -= catalogue.weight(t);
         if (r < 0) {
            return t;
         }
         last = t;
      }

      // rounding left r at or slightly above zero
      return last;
   }

   public TieBreak getTieBreak() {
      return tieBreak;
   }
}
