package br.ufmg.cs.systems.wfc.visualization;

import br.ufmg.cs.systems.wfc.pattern.PatternCatalogue;
import br.ufmg.cs.systems.wfc.util.collection.PatternBitSet;
import br.ufmg.cs.systems.wfc.wave.Wave;

import java.util.Arrays;

/**
 * Read-only copy of the per-cell state of a wave at the end of a round. A
 * collapsed cell carries the top-left pixel of its pattern; an undetermined
 * one its entropy and the mean top-left pixel of the patterns it may still
 * take. A reset snapshot is a flat fill.
 */
public class WaveSnapshot {
   private final int width;
   private final int height;
   private final int attempt;
   private final int round;
   private final boolean reset;
   private final int[] numPossible;
   private final double[] entropies;
   private final int[] colors;

   private WaveSnapshot(int width, int height, int attempt, int round,
                        boolean reset, int[] numPossible, double[] entropies,
                        int[] colors) {
      this.width = width;
      this.height = height;
      this.attempt = attempt;
      this.round = round;
      this.reset = reset;
      this.numPossible = numPossible;
      this.entropies = entropies;
      this.colors = colors;
   }

   public static WaveSnapshot of(Wave wave, int attempt, int round) {
      PatternCatalogue catalogue = wave.getCatalogue();
      int numCells = wave.getNumCells();
      int[] numPossible = new int[numCells];
      double[] entropies = new double[numCells];
      int[] colors = new int[numCells];

      for (int cell = 0; cell < numCells; ++cell) {
         numPossible[cell] = wave.numPossible(cell);
         entropies[cell] = wave.entropyOf(cell);
         colors[cell] = meanTopLeft(catalogue, wave.possiblePatterns(cell));
      }

      return new WaveSnapshot(wave.getWidth(), wave.getHeight(), attempt,
              round, false, numPossible, entropies, colors);
   }

   public static WaveSnapshot reset(int width, int height, int attempt,
                                    int fillColor) {
      int numCells = width * height;
      int[] colors = new int[numCells];
      Arrays.fill(colors, fillColor);
      return new WaveSnapshot(width, height, attempt, 0, true,
              new int[numCells], new double[numCells], colors);
   }

   private static int meanTopLeft(PatternCatalogue catalogue,
                                  PatternBitSet patterns) {
      long r = 0, g = 0, b = 0;
      int n = 0;
      for (int t = patterns.nextSetBit(0); t >= 0; t = patterns.nextSetBit(t + 1)) {
         int rgb = catalogue.get(t).topLeft();
         r += (rgb >> 16) & 0xFF;
         g += (rgb >> 8) & 0xFF;
         b += rgb & 0xFF;
         ++n;
      }
      if (n == 0) {
         return 0;
      }
      return (int) (r / n) << 16 | (int) (g / n) << 8 | (int) (b / n);
   }

   public int getWidth() {
      return width;
   }

   public int getHeight() {
      return height;
   }

   public int getAttempt() {
      return attempt;
   }

   public int getRound() {
      return round;
   }

   public boolean isReset() {
      return reset;
   }

   public boolean isCollapsed(int x, int y) {
      return !reset && numPossible[y * width + x] == 1;
   }

   public boolean isContradicted(int x, int y) {
      return !reset && numPossible[y * width + x] == 0;
   }

   public int numPossible(int x, int y) {
      return numPossible[y * width + x];
   }

   public double entropy(int x, int y) {
      return entropies[y * width + x];
   }

   /**
    * Collapsed color, aggregate color of an undetermined cell, or the fill
    * color of a reset.
    */
   public int color(int x, int y) {
      return colors[y * width + x];
   }

   public int countCollapsed() {
      if (reset) return 0;
      int count = 0;
      for (int n : numPossible) {
         if (n == 1) ++count;
      }
      return count;
   }

   @Override
   public String toString() {
      return "WaveSnapshot{" +
              "width=" + width +
              ",height=" + height +
              ",attempt=" + attempt +
              ",round=" + round +
              ",reset=" + reset +
              ",collapsed=" + countCollapsed() +
              '}';
   }
}
