package br.ufmg.cs.systems.wfc.pattern;

import br.ufmg.cs.systems.wfc.util.collection.PatternBitSet;
import org.apache.log4j.Logger;

import java.util.stream.IntStream;

/**
 * For every direction {@code d} and pattern {@code A}, the set of patterns
 * {@code B} that may occupy the cell at offset {@code d} from a cell holding
 * {@code A}. Read-only once built.
 */
public class CompatibilityTable {
   private static final Logger LOG = Logger.getLogger(CompatibilityTable.class);

   private final Directions directions;
   private final int numPatterns;
   private final PatternBitSet[][] compatible;

   private CompatibilityTable(Directions directions, int numPatterns) {
      this.directions = directions;
      this.numPatterns = numPatterns;
      this.compatible = new PatternBitSet[directions.size()][numPatterns];
      for (int d = 0; d < directions.size(); ++d) {
         for (int a = 0; a < numPatterns; ++a) {
            compatible[d][a] = new PatternBitSet(numPatterns);
         }
      }
   }

   /**
    * Compares overlaps for half of the directions only; the opposite
    * direction is the transpose.
    *
    * @param parallel fan out over patterns, the result is the same
    */
   public static CompatibilityTable build(PatternCatalogue catalogue,
                                          boolean parallel) {
      Directions directions = new Directions(catalogue.getTileSize());
      int numPatterns = catalogue.size();
      CompatibilityTable table = new CompatibilityTable(directions, numPatterns);

      long start = 0;
      if (LOG.isInfoEnabled()) {
         start = System.currentTimeMillis();
         LOG.info("Building compatibility table," +
                 " numPatterns=" + numPatterns +
                 " numDirections=" + directions.size() +
                 " parallel=" + parallel);
      }

      IntStream rows = IntStream.range(0, numPatterns);
      if (parallel) {
         rows = rows.parallel();
      }
      rows.forEach(a -> table.computeRow(catalogue, a));

      table.fillOppositeDirections();

      if (LOG.isInfoEnabled()) {
         LOG.info("Done building compatibility table," +
                 " numPatterns=" + numPatterns +
                 " compatiblePairs=" + table.countCompatiblePairs() +
                 " elapsed=" + (System.currentTimeMillis() - start) + " ms");
      }

      return table;
   }

   // row a of every direction before the midpoint, rows are disjoint
   private void computeRow(PatternCatalogue catalogue, int a) {
      Pattern pa = catalogue.get(a);
      for (int d = 0; d < directions.size() / 2; ++d) {
         int dx = directions.dx(d);
         int dy = directions.dy(d);
         PatternBitSet row = compatible[d][a];
         for (int b = 0; b < numPatterns; ++b) {
            if (pa.agrees(catalogue.get(b), dx, dy)) {
               row.insert(b);
            }
         }
      }
   }

   private void fillOppositeDirections() {
      for (int d = 0; d < directions.size() / 2; ++d) {
         int opposite = directions.opposite(d);
         for (int a = 0; a < numPatterns; ++a) {
            PatternBitSet row = compatible[d][a];
            for (int b = row.nextSetBit(0); b >= 0; b = row.nextSetBit(b + 1)) {
               compatible[opposite][b].insert(a);
            }
         }
      }
   }

   public Directions getDirections() {
      return directions;
   }

   public int getNumPatterns() {
      return numPatterns;
   }

   public boolean isCompatible(int direction, int a, int b) {
      return compatible[direction][a].contains(b);
   }

   /**
    * Patterns allowed at offset {@code direction} from {@code pattern}. The
    * returned set must not be modified.
    */
   public PatternBitSet compatibleWith(int direction, int pattern) {
      return compatible[direction][pattern];
   }

   /**
    * Whether every pattern has at least one compatible pattern in every
    * direction. Always true for periodic extraction; when false, a fresh wave
    * is not arc consistent until propagated from every cell.
    */
   public boolean isFullySupported() {
      for (PatternBitSet[] byPattern : compatible) {
         for (PatternBitSet row : byPattern) {
            if (row.nextSetBit(0) < 0) {
               return false;
            }
         }
      }
      return true;
   }

   public long countCompatiblePairs() {
      long count = 0;
      for (PatternBitSet[] byPattern : compatible) {
         for (PatternBitSet row : byPattern) {
            count += row.cardinality();
         }
      }
      return count;
   }

   @Override
   public String toString() {
      return "CompatibilityTable{" +
              "numPatterns=" + numPatterns +
              ",numDirections=" + directions.size() +
              '}';
   }
}
