package br.ufmg.cs.systems.wfc.visualization;

import br.ufmg.cs.systems.wfc.util.AcknowledgementSignal;
import org.apache.log4j.Logger;

import java.nio.file.Path;
import java.util.concurrent.CancellationException;

/**
 * Renders like {@link AutoVisualizationSink}, then holds the solver until
 * {@link #acknowledge()} is called from another thread.
 *
 * <p>Interrupting the solver thread while it waits ends the run: the wait
 * throws {@link CancellationException} and the interrupt flag stays set.</p>
 */
public class ManualVisualizationSink extends AutoVisualizationSink {
   private static final Logger LOG = Logger.getLogger(ManualVisualizationSink.class);

   private final AcknowledgementSignal signal = new AcknowledgementSignal();

   public ManualVisualizationSink(FrameRenderer renderer, Path framesDir) {
      super(renderer, framesDir, 0);
   }

   @Override
   public void onRound(WaveSnapshot snapshot) {
      show(snapshot);
      await(snapshot);
   }

   @Override
   public void onReset(WaveSnapshot snapshot) {
      super.onReset(snapshot);
      await(snapshot);
   }

   private void await(WaveSnapshot snapshot) {
      if (LOG.isDebugEnabled()) {
         LOG.debug("Waiting for acknowledgement, " + snapshot);
      }
      if (!signal.awaitAcknowledgement()) {
         LOG.warn("Interrupted while waiting for acknowledgement, " + snapshot);
         throw new CancellationException(
                 "interrupted while waiting for acknowledgement");
      }
   }

   public void acknowledge() {
      signal.acknowledge();
   }
}
