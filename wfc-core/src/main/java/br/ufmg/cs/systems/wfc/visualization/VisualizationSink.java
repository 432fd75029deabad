package br.ufmg.cs.systems.wfc.visualization;

/**
 * Receives the progress of a solve. Called from the solver thread, which
 * does not resume until the call returns.
 */
public interface VisualizationSink {
   /**
    * Once per observation/propagation round that ended without contradiction.
    */
   void onRound(WaveSnapshot snapshot);

   /**
    * Once per contradiction, before the wave is rebuilt.
    */
   void onReset(WaveSnapshot snapshot);

   /**
    * When false the solver skips building snapshots altogether.
    */
   default boolean isEnabled() {
      return true;
   }
}
