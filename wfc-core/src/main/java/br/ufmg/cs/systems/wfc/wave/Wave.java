package br.ufmg.cs.systems.wfc.wave;

import br.ufmg.cs.systems.wfc.pattern.Directions;
import br.ufmg.cs.systems.wfc.pattern.PatternCatalogue;
import br.ufmg.cs.systems.wfc.util.collection.IntArrayList;
import br.ufmg.cs.systems.wfc.util.collection.PatternBitSet;

/**
 * Possibility sets of every output cell, plus the queue of cells whose sets
 * shrank since they were last propagated. Cells are addressed by
 * {@code y * width + x}.
 *
 * <p>Owned by a single solver thread.</p>
 */
public class Wave {
   private final PatternCatalogue catalogue;
   private final Directions directions;
   private final int width;
   private final int height;
   private final boolean periodic;
   private final int numCells;
   private final int numPatterns;

   private final PatternBitSet[] possible;
   private final int[] numPossible;
   private final double[] sumsOfWeights;
   private final double[] sumsOfWeightLogWeights;
   private final double[] entropies;

   private final IntArrayList queue;
   private final boolean[] queued;

   private int numCollapsed;
   private int numContradicted;

   /**
    * @param periodic whether neighbors wrap around the output edges; when
    *                 false, border cells are only constrained by in-bounds
    *                 neighbors
    */
   public Wave(PatternCatalogue catalogue, int width, int height,
               boolean periodic) {
      if (width < 1 || height < 1) {
         throw new IllegalArgumentException("wave dimensions must be positive, got " +
                 width + "x" + height);
      }
      this.catalogue = catalogue;
      this.directions = new Directions(catalogue.getTileSize());
      this.width = width;
      this.height = height;
      this.periodic = periodic;
      this.numCells = Math.multiplyExact(width, height);
      this.numPatterns = catalogue.size();

      this.possible = new PatternBitSet[numCells];
      this.numPossible = new int[numCells];
      this.sumsOfWeights = new double[numCells];
      this.sumsOfWeightLogWeights = new double[numCells];
      this.entropies = new double[numCells];
      this.queue = new IntArrayList(numCells);
      this.queued = new boolean[numCells];

      reset();
   }

   /**
    * Makes every pattern possible everywhere and empties the queue.
    */
   public void reset() {
      double startingEntropy = catalogue.getStartingEntropy();
      for (int cell = 0; cell < numCells; ++cell) {
         possible[cell] = new PatternBitSet(numPatterns);
         possible[cell].enableAll();
         numPossible[cell] = numPatterns;
         sumsOfWeights[cell] = catalogue.getSumOfWeights();
         sumsOfWeightLogWeights[cell] = catalogue.getSumOfWeightLogWeights();
         entropies[cell] = startingEntropy;
         queued[cell] = false;
      }
      queue.clear();
      numCollapsed = numPatterns == 1 ? numCells : 0;
      numContradicted = 0;
   }

   /**
    * {@code log(W) - (sum of w log w) / W} over the patterns still possible
    * at {@code cell}, W being their total weight. Zero once collapsed or
    * contradicted.
    */
   public double entropyOf(int cell) {
      return entropies[cell];
   }

   public boolean isCollapsed(int cell) {
      return numPossible[cell] == 1;
   }

   public boolean isContradicted(int cell) {
      return numPossible[cell] == 0;
   }

   public boolean isFullyCollapsed() {
      return numCollapsed == numCells;
   }

   public boolean hasContradiction() {
      return numContradicted > 0;
   }

   public int numPossible(int cell) {
      return numPossible[cell];
   }

   public boolean isPossible(int cell, int pattern) {
      return possible[cell].contains(pattern);
   }

   /**
    * Live view of the patterns possible at {@code cell}; must not be modified.
    */
   public PatternBitSet possiblePatterns(int cell) {
      return possible[cell];
   }

   /**
    * @return the only pattern left at {@code cell}, or -1 if it is not
    * collapsed
    */
   public int singlePattern(int cell) {
      return numPossible[cell] == 1 ? possible[cell].nextSetBit(0) : -1;
   }

   /**
    * Removes {@code pattern} from {@code cell}. A no-op if it was already
    * gone; otherwise the cell is queued for propagation unless already queued.
    *
    * @return true if the pattern was possible before the call
    */
   public boolean eliminate(int cell, int pattern) {
      if (!possible[cell].remove(pattern)) {
         return false;
      }

      int remaining = --numPossible[cell];
      sumsOfWeights[cell] -= catalogue.weight(pattern);
      sumsOfWeightLogWeights[cell] -= catalogue.weightLogWeight(pattern);

      if (remaining > 1) {
         double sum = sumsOfWeights[cell];
         entropies[cell] = Math.log(sum) - sumsOfWeightLogWeights[cell] / sum;
      } else {
         entropies[cell] = 0;
         if (remaining == 1) {
            ++numCollapsed;
         } else {
            --numCollapsed;
            ++numContradicted;
         }
      }

      if (!queued[cell]) {
         queued[cell] = true;
         queue.add(cell);
      }

      return true;
   }

   /**
    * Eliminates every pattern other than {@code pattern} at {@code cell}.
    */
   public void collapseTo(int cell, int pattern) {
      PatternBitSet set = possible[cell];
      for (int t = set.nextSetBit(0); t >= 0; t = set.nextSetBit(t + 1)) {
         if (t != pattern) {
            eliminate(cell, t);
         }
      }
   }

   /**
    * Queues {@code cell} for propagation without eliminating anything.
    */
   public void enqueue(int cell) {
      if (!queued[cell]) {
         queued[cell] = true;
         queue.add(cell);
      }
   }

   public boolean hasPending() {
      return !queue.isEmpty();
   }

   /**
    * @return next cell to propagate from; it may be queued again afterwards
    */
   public int poll() {
      int cell = queue.pop();
      queued[cell] = false;
      return cell;
   }

   public int pendingSize() {
      return queue.size();
   }

   /**
    * @return the cell at offset {@code direction} from {@code cell}, or -1
    * when it falls outside a non-periodic grid
    */
   public int neighbor(int cell, int direction) {
      int x = cell % width + directions.dx(direction);
      int y = cell / width + directions.dy(direction);
      if (periodic) {
         x = Math.floorMod(x, width);
         y = Math.floorMod(y, height);
      } else if (x < 0 || x >= width || y < 0 || y >= height) {
         return -1;
      }
      return y * width + x;
   }

   public PatternCatalogue getCatalogue() {
      return catalogue;
   }

   public Directions getDirections() {
      return directions;
   }

   public int getWidth() {
      return width;
   }

   public int getHeight() {
      return height;
   }

   public int getNumCells() {
      return numCells;
   }

   public int getNumCollapsed() {
      return numCollapsed;
   }

   public boolean isPeriodic() {
      return periodic;
   }

   @Override
   public String toString() {
      return "Wave{" +
              "width=" + width +
              ",height=" + height +
              ",periodic=" + periodic +
              ",numPatterns=" + numPatterns +
              ",numCollapsed=" + numCollapsed +
              ",pending=" + queue.size() +
              '}';
   }
}
