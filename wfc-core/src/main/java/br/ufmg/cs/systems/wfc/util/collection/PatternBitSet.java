package br.ufmg.cs.systems.wfc.util.collection;

import java.util.Arrays;

/**
 * Fixed-size bit set over pattern indexes. Not thread-safe; the compatibility
 * table fills disjoint instances from several threads, the wave mutates its
 * own instances from the solver thread only.
 */
public class PatternBitSet {
   private static final int WORD_BITS = 64;

   private final long[] words;
   private final int size;

   public PatternBitSet(int size) {
      this.size = size;
      this.words = new long[(size + WORD_BITS - 1) / WORD_BITS];
   }

   private PatternBitSet(PatternBitSet other) {
      this.size = other.size;
      this.words = Arrays.copyOf(other.words, other.words.length);
   }

   public int size() {
      return size;
   }

   public void enableAll() {
      if (words.length == 0) return;
      Arrays.fill(words, 0xFFFFFFFFFFFFFFFFL);
      int tailBits = size % WORD_BITS;
      if (tailBits != 0) {
         words[words.length - 1] = (1L << tailBits) - 1;
      }
   }

   public void clear() {
      Arrays.fill(words, 0L);
   }

   public void insert(int position) {
      words[position / WORD_BITS] |= 1L << (position % WORD_BITS);
   }

   /**
    * @return true if the bit was set before this call
    */
   public boolean remove(int position) {
      int wordIdx = position / WORD_BITS;
      long mask = 1L << (position % WORD_BITS);
      long word = words[wordIdx];
      if ((word & mask) == 0L) {
         return false;
      }
      words[wordIdx] = word & ~mask;
      return true;
   }

   public boolean contains(int position) {
      return (words[position / WORD_BITS] & (1L << (position % WORD_BITS))) != 0L;
   }

   public boolean intersects(PatternBitSet other) {
      int minSize = Math.min(words.length, other.words.length);
      for (int i = 0; i < minSize; ++i) {
         if ((words[i] & other.words[i]) != 0L) {
            return true;
         }
      }
      return false;
   }

   public int cardinality() {
      int count = 0;
      for (long word : words) {
         count += Long.bitCount(word);
      }
      return count;
   }

   /**
    * @return first set bit at or after {@code from}, or -1 if none
    */
   public int nextSetBit(int from) {
      if (from >= size) return -1;
      int wordIdx = from / WORD_BITS;
      long word = words[wordIdx] & (0xFFFFFFFFFFFFFFFFL << (from % WORD_BITS));
      while (true) {
         if (word != 0L) {
            return wordIdx * WORD_BITS + Long.numberOfTrailingZeros(word);
         }
         if (++wordIdx == words.length) {
            return -1;
         }
         word = words[wordIdx];
      }
   }

   public PatternBitSet copy() {
      return new PatternBitSet(this);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      PatternBitSet that = (PatternBitSet) o;
      return size == that.size && Arrays.equals(words, that.words);
   }

   @Override
   public int hashCode() {
      return 31 * size + Arrays.hashCode(words);
   }

   @Override
   public String toString() {
      int numEnabledBits = cardinality();
      return "PatternBitSet(size=" + size +
         ", numEnabledBits=" + numEnabledBits +
         ", numDisabledBits=" + (size - numEnabledBits) +
         ")";
   }

   public String toDebugString() {
      StringBuilder builder = new StringBuilder();
      builder.append(toString());
      builder.append("[");
      for (int i = 0; i < size; ++i) {
         builder.append(contains(i) ? '1' : '0');
      }
      builder.append("]");
      return builder.toString();
   }
}
