package br.ufmg.cs.systems.wfc.visualization;

import br.ufmg.cs.systems.wfc.pattern.Pattern;
import br.ufmg.cs.systems.wfc.pattern.PatternCatalogue;
import br.ufmg.cs.systems.wfc.wave.Wave;

final class RenderFixtures {
   private RenderFixtures() {
   }

   /**
    * 2x1 snapshot: cell (0, 0) undecided between two colors, cell (1, 0)
    * collapsed to green.
    */
   static WaveSnapshot halfCollapsed() {
      PatternCatalogue.Builder builder = PatternCatalogue.builder(1);
      builder.insert(new Pattern(1, new int[]{0x0000FF}));
      builder.insert(new Pattern(1, new int[]{0x00FF00}));
      Wave wave = new Wave(builder.build(), 2, 1, false);
      wave.collapseTo(1, 1);
      return WaveSnapshot.of(wave, 1, 1);
   }
}
