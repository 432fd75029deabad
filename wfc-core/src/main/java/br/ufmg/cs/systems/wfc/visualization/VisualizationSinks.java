package br.ufmg.cs.systems.wfc.visualization;

import br.ufmg.cs.systems.wfc.conf.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class VisualizationSinks {
   private VisualizationSinks() {
   }

   public static VisualizationSink create(Configuration config) {
      VisualizationMode mode = config.getVisualizationMode();
      if (mode == VisualizationMode.OFF) {
         return NoOpVisualizationSink.INSTANCE;
      }

      FrameRenderer renderer = new FrameRenderer(config.getVisualTileSize(),
              config.isVisualDebug());
      String dir = config.getVisualFramesDir();
      Path framesDir = dir == null ? null : Paths.get(dir);

      switch (mode) {
         case AUTO:
            return new AutoVisualizationSink(renderer, framesDir,
                    config.getVisualDelayMs());
         case MANUAL:
            return new ManualVisualizationSink(renderer, framesDir);
         default:
            throw new IllegalStateException("unhandled mode " + mode);
      }
   }
}
