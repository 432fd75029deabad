package br.ufmg.cs.systems.wfc.solver;

import br.ufmg.cs.systems.wfc.pattern.CompatibilityTable;
import br.ufmg.cs.systems.wfc.pattern.Directions;
import br.ufmg.cs.systems.wfc.util.collection.PatternBitSet;
import br.ufmg.cs.systems.wfc.wave.Wave;

/**
 * Arc consistency over the compatibility table: drains the wave's queue,
 * removing from each neighbor of a dequeued cell every pattern no longer
 * supported by the cell, until nothing changes or a cell runs empty.
 */
public class Propagator {
   public static final int NO_CONTRADICTION = -1;

   private final CompatibilityTable table;
   private final Directions directions;

   private long eliminations;

   public Propagator(CompatibilityTable table) {
      this.table = table;
      this.directions = table.getDirections();
   }

   /**
    * Stops at the first contradiction, leaving the wave half propagated; the
    * caller is expected to reset it.
    *
    * @return the contradicted cell, or {@link #NO_CONTRADICTION} once the
    * queue is empty
    */
   public int propagate(Wave wave) {
      while (wave.hasPending()) {
         int cell = wave.poll();
         if (wave.isContradicted(cell)) {
            return cell;
         }
         PatternBitSet source = wave.possiblePatterns(cell);

         for (int d = 0; d < directions.size(); ++d) {
            int neighbor = wave.neighbor(cell, d);
            if (neighbor < 0) continue;

            // b at cell + d needs some a at cell with compatible(d, a, b),
            // that is compatible(-d, b, a)
            int opposite = directions.opposite(d);
            PatternBitSet targets = wave.possiblePatterns(neighbor);
            for (int b = targets.nextSetBit(0); b >= 0;
                 b = targets.nextSetBit(b + 1)) {
               if (!source.intersects(table.compatibleWith(opposite, b))) {
                  wave.eliminate(neighbor, b);
                  ++eliminations;
                  if (wave.isContradicted(neighbor)) {
                     return neighbor;
                  }
               }
            }
         }
      }

      return NO_CONTRADICTION;
   }

   public long getEliminations() {
      return eliminations;
   }
}
