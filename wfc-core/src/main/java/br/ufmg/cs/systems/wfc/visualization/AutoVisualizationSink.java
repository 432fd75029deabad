package br.ufmg.cs.systems.wfc.visualization;

import br.ufmg.cs.systems.wfc.exceptions.EncodingFailureException;
import org.apache.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a frame after every round and reset, keeps the latest one, and
 * optionally writes each frame to a directory and pauses between rounds.
 */
public class AutoVisualizationSink implements VisualizationSink {
   private static final Logger LOG = Logger.getLogger(AutoVisualizationSink.class);

   private final FrameRenderer renderer;
   private final Path framesDir;
   private final long delayMs;

   private BufferedImage lastFrame;
   private int numFrames;
   private int numResets;

   /**
    * @param framesDir existing directory receiving {@code frame-NNNNNN.png}
    *                  files, or null to keep frames in memory only
    */
   public AutoVisualizationSink(FrameRenderer renderer, Path framesDir,
                                long delayMs) {
      if (framesDir != null && !Files.isDirectory(framesDir)) {
         throw new EncodingFailureException("frames directory does not exist: " +
                 framesDir);
      }
      this.renderer = renderer;
      this.framesDir = framesDir;
      this.delayMs = delayMs;
   }

   @Override
   public void onRound(WaveSnapshot snapshot) {
      show(snapshot);
      pause();
   }

   @Override
   public void onReset(WaveSnapshot snapshot) {
      ++numResets;
      if (LOG.isDebugEnabled()) {
         LOG.debug("Reset frame, attempt=" + snapshot.getAttempt());
      }
      show(snapshot);
      pause();
   }

   protected void show(WaveSnapshot snapshot) {
      lastFrame = renderer.render(snapshot);
      ++numFrames;
      if (framesDir != null) {
         writeFrame(lastFrame, framesDir.resolve(
                 String.format("frame-%06d.png", numFrames)));
      }
   }

   private void writeFrame(BufferedImage frame, Path path) {
      try {
         ImageIO.write(frame, "png", path.toFile());
      } catch (IOException e) {
         throw new EncodingFailureException("cannot write frame " + path, e);
      }
   }

   private void pause() {
      if (delayMs <= 0) return;
      try {
         Thread.sleep(delayMs);
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
      }
   }

   public BufferedImage getLastFrame() {
      return lastFrame;
   }

   public int getNumFrames() {
      return numFrames;
   }

   public int getNumResets() {
      return numResets;
   }
}
