package br.ufmg.cs.systems.wfc.util.collection;

import java.util.Arrays;
import java.util.function.IntConsumer;

/**
 * Growable list of primitive ints. Doubles as a LIFO stack through
 * {@link #add(int)} and {@link #pop()}.
 */
public class IntArrayList {
   private static final int INITIAL_SIZE = 16;

   protected int[] backingArray;
   protected int numElements;

   public IntArrayList() {
      this(INITIAL_SIZE);
   }

   public IntArrayList(int capacity) {
      ensureCapacity(capacity);
      this.numElements = 0;
   }

   public int size() {
      return numElements;
   }

   public int getCapacity() {
      return backingArray.length;
   }

   public boolean isEmpty() {
      return numElements == 0;
   }

   public boolean ensureCapacity(int minimumSize) {
      if (backingArray == null) {
         backingArray = new int[Math.max(minimumSize, 1)];
      }
      else if (minimumSize > backingArray.length) {
         int targetLength = Math.max(backingArray.length, 1);

         while (targetLength < minimumSize) {
            targetLength = targetLength << 1;

            if (targetLength < 0) {
               targetLength = minimumSize;
               break;
            }
         }

         backingArray = Arrays.copyOf(backingArray, targetLength);
      }
      else {
         return false;
      }

      return true;
   }

   public void add(int element) {
      ensureCapacity(numElements + 1);
      backingArray[numElements++] = element;
   }

   public int get(int index) {
      checkIndex(index);
      return backingArray[index];
   }

   /**
    * Unchecked read, the caller guarantees {@code index < size()}.
    */
   public int getu(int index) {
      return backingArray[index];
   }

   public void set(int index, int element) {
      checkIndex(index);
      backingArray[index] = element;
   }

   public void increment(int index, int delta) {
      checkIndex(index);
      backingArray[index] += delta;
   }

   public int pop() {
      if (numElements == 0) {
         throw new IllegalStateException("pop on empty list");
      }
      return backingArray[--numElements];
   }

   public void clear() {
      numElements = 0;
   }

   public void forEach(IntConsumer consumer) {
      for (int i = 0; i < numElements; ++i) {
         consumer.accept(backingArray[i]);
      }
   }

   public int[] toIntArray() {
      return Arrays.copyOf(backingArray, numElements);
   }

   private void checkIndex(int index) {
      if (index < 0 || index >= numElements) {
         throw new ArrayIndexOutOfBoundsException(
                 "index " + index + " out of bounds for size " + numElements);
      }
   }

   @Override
   public String toString() {
      StringBuilder builder = new StringBuilder("IntArrayList(");
      builder.append(numElements);
      builder.append(")[");
      for (int i = 0; i < numElements; ++i) {
         if (i > 0) {
            builder.append(',');
         }
         builder.append(backingArray[i]);
      }
      builder.append(']');
      return builder.toString();
   }
}
