package br.ufmg.cs.systems.wfc.pattern;

import br.ufmg.cs.systems.wfc.util.collection.IntArrayList;
import com.koloboke.collect.map.hash.HashObjIntMap;
import com.koloboke.collect.map.hash.HashObjIntMaps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deduplicated patterns indexed in order of first insertion, each weighted by
 * how many times it was inserted. Immutable once built.
 */
public class PatternCatalogue {
   private final int tileSize;
   private final List<Pattern> patterns;
   private final double[] weights;
   private final double[] weightLogWeights;
   private final double sumOfWeights;
   private final double sumOfWeightLogWeights;
   private final long totalWeight;

   private PatternCatalogue(int tileSize, List<Pattern> patterns) {
      this.tileSize = tileSize;
      this.patterns = Collections.unmodifiableList(patterns);
      this.weights = new double[patterns.size()];
      this.weightLogWeights = new double[patterns.size()];

      double sumW = 0;
      double sumWLogW = 0;
      long total = 0;
      for (int i = 0; i < patterns.size(); ++i) {
         int weight = patterns.get(i).getWeight();
         weights[i] = weight;
         weightLogWeights[i] = weight * Math.log(weight);
         sumW += weights[i];
         sumWLogW += weightLogWeights[i];
         total += weight;
      }
      this.sumOfWeights = sumW;
      this.sumOfWeightLogWeights = sumWLogW;
      this.totalWeight = total;
   }

   public static Builder builder(int tileSize) {
      return new Builder(tileSize);
   }

   public int getTileSize() {
      return tileSize;
   }

   public int size() {
      return patterns.size();
   }

   public Pattern get(int index) {
      return patterns.get(index);
   }

   public List<Pattern> getPatterns() {
      return patterns;
   }

   public double weight(int index) {
      return weights[index];
   }

   public double weightLogWeight(int index) {
      return weightLogWeights[index];
   }

   public double getSumOfWeights() {
      return sumOfWeights;
   }

   public double getSumOfWeightLogWeights() {
      return sumOfWeightLogWeights;
   }

   public long getTotalWeight() {
      return totalWeight;
   }

   /**
    * Entropy of a cell where every pattern is still possible.
    */
   public double getStartingEntropy() {
      return Math.log(sumOfWeights) - sumOfWeightLogWeights / sumOfWeights;
   }

   /**
    * Per-channel mean of the top-left pixels of every pattern, unweighted.
    */
   public int averageColor() {
      long r = 0, g = 0, b = 0;
      for (Pattern pattern : patterns) {
         int rgb = pattern.topLeft();
         r += (rgb >> 16) & 0xFF;
         g += (rgb >> 8) & 0xFF;
         b += rgb & 0xFF;
      }
      int n = patterns.size();
      return (int) (r / n) << 16 | (int) (g / n) << 8 | (int) (b / n);
   }

   @Override
   public String toString() {
      return "PatternCatalogue{" +
              "tileSize=" + tileSize +
              ",numPatterns=" + patterns.size() +
              ",totalWeight=" + totalWeight +
              '}';
   }

   public String toOutputString() {
      StringBuilder builder = new StringBuilder(toString());
      for (Pattern pattern : patterns) {
         builder.append('\n');
         builder.append(pattern.toOutputString());
      }
      return builder.toString();
   }

   public static class Builder {
      private final int tileSize;
      private final HashObjIntMap<Pattern> patternIndexes;
      private final List<Pattern> blocks;
      private final IntArrayList counts;

      private Builder(int tileSize) {
         this.tileSize = tileSize;
         this.patternIndexes = HashObjIntMaps.<Pattern>getDefaultFactory()
                 .withDefaultValue(-1).newMutableMap();
         this.blocks = new ArrayList<>();
         this.counts = new IntArrayList();
      }

      /**
       * @return index of the pattern equal to {@code block}
       */
      public int insert(Pattern block) {
         if (block.getSize() != tileSize) {
            throw new IllegalArgumentException("expected a " + tileSize +
                    "x" + tileSize + " block, got size " + block.getSize());
         }

         int index = patternIndexes.getInt(block);
         if (index == -1) {
            index = blocks.size();
            patternIndexes.put(block, index);
            blocks.add(block);
            counts.add(1);
         } else {
            counts.increment(index, 1);
         }
         return index;
      }

      public int size() {
         return blocks.size();
      }

      public PatternCatalogue build() {
         if (blocks.isEmpty()) {
            throw new IllegalStateException("catalogue has no patterns");
         }
         List<Pattern> patterns = new ArrayList<>(blocks.size());
         for (int i = 0; i < blocks.size(); ++i) {
            patterns.add(blocks.get(i).indexed(i, counts.getu(i)));
         }
         return new PatternCatalogue(tileSize, patterns);
      }
   }
}
