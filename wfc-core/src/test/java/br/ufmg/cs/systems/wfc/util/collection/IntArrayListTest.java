package br.ufmg.cs.systems.wfc.util.collection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IntArrayListTest {

   @Test
   void growsPastInitialCapacity() {
      IntArrayList list = new IntArrayList(2);
      for (int i = 0; i < 100; ++i) {
         list.add(i);
      }

      assertEquals(100, list.size());
      assertTrue(list.getCapacity() >= 100);
      for (int i = 0; i < 100; ++i) {
         assertEquals(i, list.get(i));
      }
   }

   @Test
   void popIsLastInFirstOut() {
      IntArrayList list = new IntArrayList();
      list.add(3);
      list.add(7);
      list.add(11);

      assertEquals(11, list.pop());
      assertEquals(7, list.pop());
      assertEquals(1, list.size());
      assertEquals(3, list.pop());
      assertTrue(list.isEmpty());
      assertThrows(IllegalStateException.class, list::pop);
   }

   @Test
   void incrementAndSetRespectBounds() {
      IntArrayList list = new IntArrayList();
      list.add(1);
      list.increment(0, 4);
      assertEquals(5, list.get(0));

      list.set(0, 9);
      assertEquals(9, list.getu(0));

      assertThrows(ArrayIndexOutOfBoundsException.class, () -> list.get(1));
      assertThrows(ArrayIndexOutOfBoundsException.class, () -> list.increment(-1, 1));
   }

   @Test
   void clearKeepsCapacity() {
      IntArrayList list = new IntArrayList();
      for (int i = 0; i < 40; ++i) {
         list.add(i);
      }
      int capacity = list.getCapacity();

      list.clear();

      assertTrue(list.isEmpty());
      assertEquals(capacity, list.getCapacity());
      assertArrayEquals(new int[0], list.toIntArray());
   }

   @Test
   void forEachVisitsInsertionOrder() {
      IntArrayList list = new IntArrayList();
      list.add(4);
      list.add(2);
      list.add(8);

      IntArrayList visited = new IntArrayList();
      list.forEach(visited::add);

      assertArrayEquals(new int[]{4, 2, 8}, visited.toIntArray());
      assertEquals("IntArrayList(3)[4,2,8]", list.toString());
   }
}
