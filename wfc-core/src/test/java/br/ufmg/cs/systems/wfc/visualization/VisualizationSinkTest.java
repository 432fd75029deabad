package br.ufmg.cs.systems.wfc.visualization;

import br.ufmg.cs.systems.wfc.conf.Configuration;
import br.ufmg.cs.systems.wfc.exceptions.EncodingFailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class VisualizationSinkTest {

   @TempDir
   Path tempDir;

   @Test
   void factoryFollowsMode() {
      Configuration config = new Configuration(new Properties());
      assertSame(NoOpVisualizationSink.INSTANCE, VisualizationSinks.create(config));
      assertFalse(VisualizationSinks.create(config).isEnabled());

      config.set(Configuration.CONF_VISUAL_MODE, "auto");
      VisualizationSink auto = VisualizationSinks.create(config);
      assertTrue(auto instanceof AutoVisualizationSink);
      assertTrue(auto.isEnabled());

      config.set(Configuration.CONF_VISUAL_MODE, "manual");
      assertTrue(VisualizationSinks.create(config) instanceof ManualVisualizationSink);
   }

   @Test
   void autoSinkWritesNumberedFrames() throws Exception {
      AutoVisualizationSink sink = new AutoVisualizationSink(
              new FrameRenderer(2, false), tempDir, 0);

      sink.onRound(RenderFixtures.halfCollapsed());
      sink.onReset(WaveSnapshot.reset(2, 1, 1, 0));
      sink.onRound(RenderFixtures.halfCollapsed());

      assertEquals(3, sink.getNumFrames());
      assertEquals(1, sink.getNumResets());
      assertEquals(4, sink.getLastFrame().getWidth());
      assertTrue(Files.exists(tempDir.resolve("frame-000001.png")));
      assertTrue(Files.exists(tempDir.resolve("frame-000003.png")));
      try (Stream<Path> files = Files.list(tempDir)) {
         assertEquals(3, files.count());
      }
   }

   @Test
   void autoSinkNeedsExistingFramesDirectory() {
      assertThrows(EncodingFailureException.class, () -> new AutoVisualizationSink(
              new FrameRenderer(2, false), tempDir.resolve("missing"), 0));
   }

   @Test
   @Timeout(value = 10, unit = TimeUnit.SECONDS)
   void manualSinkWaitsForAcknowledgement() throws Exception {
      ManualVisualizationSink sink = new ManualVisualizationSink(
              new FrameRenderer(1, false), null);
      AtomicBoolean returned = new AtomicBoolean(false);

      Thread solver = new Thread(() -> {
         sink.onRound(RenderFixtures.halfCollapsed());
         returned.set(true);
      });
      solver.start();

      Thread.sleep(200);
      assertFalse(returned.get());
      assertEquals(1, sink.getNumFrames());

      sink.acknowledge();
      solver.join();
      assertTrue(returned.get());
   }

   @Test
   @Timeout(value = 10, unit = TimeUnit.SECONDS)
   void interruptedManualSinkStopsTheRun() throws Exception {
      ManualVisualizationSink sink = new ManualVisualizationSink(
              new FrameRenderer(1, false), null);
      AtomicReference<RuntimeException> thrown = new AtomicReference<>();
      AtomicBoolean interrupted = new AtomicBoolean(false);

      Thread solver = new Thread(() -> {
         try {
            sink.onRound(RenderFixtures.halfCollapsed());
         } catch (CancellationException e) {
            thrown.set(e);
         }
         interrupted.set(Thread.currentThread().isInterrupted());
      });
      solver.start();
      Thread.sleep(100);
      solver.interrupt();
      solver.join();

      assertNotNull(thrown.get());
      assertTrue(interrupted.get());
      assertEquals(1, sink.getNumFrames());
   }

   @Test
   void manualSinkKeepsEarlyAcknowledgement() {
      ManualVisualizationSink sink = new ManualVisualizationSink(
              new FrameRenderer(1, false), null);

      sink.acknowledge();
      sink.onReset(WaveSnapshot.reset(1, 1, 2, 0));

      assertEquals(1, sink.getNumResets());
   }

   @Test
   void noOpIgnoresEverything() {
      NoOpVisualizationSink.INSTANCE.onRound(RenderFixtures.halfCollapsed());
      NoOpVisualizationSink.INSTANCE.onReset(WaveSnapshot.reset(1, 1, 1, 0));
      assertFalse(NoOpVisualizationSink.INSTANCE.isEnabled());
   }
}
