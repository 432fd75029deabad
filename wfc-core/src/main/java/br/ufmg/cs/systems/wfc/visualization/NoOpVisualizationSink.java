package br.ufmg.cs.systems.wfc.visualization;

public class NoOpVisualizationSink implements VisualizationSink {
   public static final NoOpVisualizationSink INSTANCE =
           new NoOpVisualizationSink();

   private NoOpVisualizationSink() {
   }

   @Override
   public void onRound(WaveSnapshot snapshot) {
   }

   @Override
   public void onReset(WaveSnapshot snapshot) {
   }

   @Override
   public boolean isEnabled() {
      return false;
   }
}
