package br.ufmg.cs.systems.wfc.pattern;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DirectionsTest {

   @Test
   void countIsSquareOfSpanMinusCenter() {
      assertEquals(0, new Directions(1).size());
      assertEquals(8, new Directions(2).size());
      assertEquals(24, new Directions(3).size());
   }

   @Test
   void oppositeNegatesOffset() {
      Directions directions = new Directions(3);
      for (int d = 0; d < directions.size(); ++d) {
         int o = directions.opposite(d);
         assertEquals(-directions.dx(d), directions.dx(o), "direction " + d);
         assertEquals(-directions.dy(d), directions.dy(o), "direction " + d);
         assertEquals(d, directions.opposite(o));
      }
   }

   @Test
   void indexOfInvertsOffsets() {
      Directions directions = new Directions(3);
      for (int d = 0; d < directions.size(); ++d) {
         assertEquals(d, directions.indexOf(directions.dx(d), directions.dy(d)));
      }
      assertEquals(-1, directions.indexOf(0, 0));
      assertEquals(-1, directions.indexOf(3, 0));
      assertEquals(-1, directions.indexOf(0, -3));
   }

   @Test
   void rowMajorOrder() {
      Directions directions = new Directions(2);
      assertEquals(-1, directions.dx(0));
      assertEquals(-1, directions.dy(0));
      assertEquals(1, directions.dx(7));
      assertEquals(1, directions.dy(7));
      assertEquals(3, directions.indexOf(-1, 0));
      assertEquals(4, directions.indexOf(1, 0));
   }

   @Test
   void rejectsNonPositiveTileSize() {
      assertThrows(IllegalArgumentException.class, () -> new Directions(0));
   }
}
