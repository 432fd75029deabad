package br.ufmg.cs.systems.wfc.solver;

import br.ufmg.cs.systems.wfc.conf.Configuration;
import br.ufmg.cs.systems.wfc.exceptions.ContradictionException;
import br.ufmg.cs.systems.wfc.exceptions.InvalidInputException;
import br.ufmg.cs.systems.wfc.io.PixelBuffer;
import br.ufmg.cs.systems.wfc.pattern.CompatibilityTable;
import br.ufmg.cs.systems.wfc.pattern.PatternCatalogue;
import br.ufmg.cs.systems.wfc.util.EventTimer;
import br.ufmg.cs.systems.wfc.util.WfcAppLogLevel;
import br.ufmg.cs.systems.wfc.visualization.VisualizationSink;
import br.ufmg.cs.systems.wfc.visualization.WaveSnapshot;
import br.ufmg.cs.systems.wfc.wave.Wave;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import javax.annotation.Nonnull;
import java.util.Random;

/**
 * Observe/propagate loop over one wave. A contradiction throws the whole
 * attempt away and starts over from a fresh wave; the catalogue and the
 * compatibility table are kept.
 *
 * <p>{@link #solve()} runs to completion. Embedding applications that need a
 * deadline call {@link #step()} and check it between rounds.</p>
 */
public class WaveSolver {
   private static final Logger LOG = Logger.getLogger(WaveSolver.class);

   private final PatternCatalogue catalogue;
   private final CompatibilityTable table;
   private final Wave wave;
   private final Propagator propagator;
   private final Observer observer;
   private final Random random;
   private final VisualizationSink sink;
   private final int maxAttempts;

   private final EventTimer timer;
   private final SolveStatistics statistics;

   private SolverState state;
   private int lastContradiction = Propagator.NO_CONTRADICTION;
   private PixelBuffer output;

   /**
    * @param random      source of every random choice of the solver
    * @param maxAttempts 0 for unbounded restarts
    * @throws InvalidInputException if the patterns contradict each other
    *                               before any observation
    */
   public WaveSolver(@Nonnull PatternCatalogue catalogue,
                     @Nonnull CompatibilityTable table,
                     int width, int height, boolean periodic,
                     @Nonnull TieBreak tieBreak, @Nonnull Random random,
                     @Nonnull VisualizationSink sink, int maxAttempts) {
      if (table.getNumPatterns() != catalogue.size()) {
         throw new IllegalArgumentException("table built for " +
                 table.getNumPatterns() + " patterns, catalogue has " +
                 catalogue.size());
      }
      if (maxAttempts < 0) {
         throw new IllegalArgumentException("maxAttempts must not be negative, got " +
                 maxAttempts);
      }
      this.catalogue = catalogue;
      this.table = table;
      this.wave = new Wave(catalogue, width, height, periodic);
      this.propagator = new Propagator(table);
      this.observer = new Observer(tieBreak);
      this.random = random;
      this.sink = sink;
      this.maxAttempts = maxAttempts;
      this.timer = new EventTimer("WaveSolver");
      this.statistics = new SolveStatistics();

      start();
   }

   public static WaveSolver create(PatternCatalogue catalogue,
                                   CompatibilityTable table,
                                   Configuration config, Random random,
                                   VisualizationSink sink) {
      return new WaveSolver(catalogue, table,
              config.getOutputWidth(), config.getOutputHeight(),
              config.isOutputPeriodic(), config.getTieBreak(), random, sink,
              config.getMaxAttempts());
   }

   /**
    * Steps until success.
    *
    * @throws ContradictionException if {@code maxAttempts} is set and every
    *                                attempt ended in a contradiction
    */
   public PixelBuffer solve() {
      while (state != SolverState.SUCCESS) {
         step();
      }
      return output;
   }

   /**
    * Performs one transition of the solver.
    *
    * @return the state reached
    */
   public SolverState step() {
      switch (state) {
         case OBSERVING:
            observe();
            break;
         case PROPAGATING:
            propagate();
            break;
         case CONTRADICTION_RESET:
            restart();
            break;
         case SUCCESS:
            break;
         default:
            throw new IllegalStateException("unknown state " + state);
      }
      return state;
   }

   private void start() {
      wave.reset();
      statistics.startAttempt();
      lastContradiction = Propagator.NO_CONTRADICTION;

      // some patterns cannot sit next to anything in some direction; a
      // single-pattern wave is the answer as is
      if (!wave.isFullyCollapsed() && !table.isFullySupported()) {
         for (int cell = 0; cell < wave.getNumCells(); ++cell) {
            wave.enqueue(cell);
         }
      }

      timer.start(EventTimer.PROPAGATION);
      int contradiction = propagator.propagate(wave);
      timer.finish(EventTimer.PROPAGATION);

      // nothing random happened yet, every restart would fail the same way
      if (contradiction != Propagator.NO_CONTRADICTION) {
         throw new InvalidInputException("the " + catalogue.size() +
                 " patterns of the exemplar cannot tile a " + wave.getWidth() +
                 "x" + wave.getHeight() + " output, first conflict at x=" +
                 (contradiction % wave.getWidth()) + " y=" +
                 (contradiction / wave.getWidth()));
      }
      state = SolverState.OBSERVING;
   }

   private void observe() {
      if (wave.isFullyCollapsed()) {
         succeed();
         return;
      }

      timer.start(EventTimer.OBSERVATION);
      int cell = observer.selectCell(wave, random);
      if (cell == Observer.NO_CELL) {
         timer.finish(EventTimer.OBSERVATION);
         if (!wave.hasContradiction()) {
            throw new IllegalStateException("no undecided cell in a wave " +
                    "that is not fully collapsed: " + wave);
         }
         contradict(firstContradictedCell());
         return;
      }
      int pattern = observer.selectPattern(wave, cell, random);
      wave.collapseTo(cell, pattern);
      timer.finish(EventTimer.OBSERVATION);

      statistics.addRound();
      if (LOG.isTraceEnabled()) {
         LOG.trace("Observed cell=" + cell + " pattern=" + pattern +
                 " round=" + statistics.getRounds());
      }

      state = SolverState.PROPAGATING;
   }

   private void propagate() {
      timer.start(EventTimer.PROPAGATION);
      int contradiction = propagator.propagate(wave);
      timer.finish(EventTimer.PROPAGATION);

      if (contradiction != Propagator.NO_CONTRADICTION) {
         contradict(contradiction);
         return;
      }

      if (sink.isEnabled()) {
         sink.onRound(WaveSnapshot.of(wave, statistics.getAttempts(),
                 (int) statistics.getRounds()));
      }
      state = SolverState.OBSERVING;
   }

   private void contradict(int cell) {
      lastContradiction = cell;
      statistics.addContradiction();
      if (LOG.isInfoEnabled()) {
         LOG.info("Contradiction," +
                 " attempt=" + statistics.getAttempts() +
                 " cell=" + cell +
                 " x=" + (cell % wave.getWidth()) +
                 " y=" + (cell / wave.getWidth()) +
                 " rounds=" + statistics.getRounds() +
                 " collapsed=" + wave.getNumCollapsed() + "/" + wave.getNumCells());
      }
      state = SolverState.CONTRADICTION_RESET;
   }

   private int firstContradictedCell() {
      for (int cell = 0; cell < wave.getNumCells(); ++cell) {
         if (wave.isContradicted(cell)) {
            return cell;
         }
      }
      return Propagator.NO_CONTRADICTION;
   }

   private void restart() {
      if (maxAttempts > 0 && statistics.getAttempts() >= maxAttempts) {
         statistics.setEliminations(propagator.getEliminations());
         throw new ContradictionException(lastContradiction,
                 statistics.getAttempts());
      }

      if (sink.isEnabled()) {
         sink.onReset(WaveSnapshot.reset(wave.getWidth(), wave.getHeight(),
                 statistics.getAttempts(), catalogue.averageColor()));
      }
      start();
   }

   private void succeed() {
      PixelBuffer buffer = new PixelBuffer(wave.getWidth(), wave.getHeight());
      for (int cell = 0; cell < wave.getNumCells(); ++cell) {
         int pattern = wave.singlePattern(cell);
         buffer.set(cell % wave.getWidth(), cell / wave.getWidth(),
                 catalogue.get(pattern).topLeft());
      }

      output = buffer;
      state = SolverState.SUCCESS;
      statistics.setEliminations(propagator.getEliminations());

      LOG.log(WfcAppLogLevel.APP, "Solved " + wave.getWidth() + "x" +
              wave.getHeight() + " " + statistics);
      timer.log(LOG, Level.INFO);
   }

   public SolverState getState() {
      return state;
   }

   /**
    * @return the output image once {@link SolverState#SUCCESS} is reached,
    * null before
    */
   public PixelBuffer getOutput() {
      return output;
   }

   public SolveStatistics getStatistics() {
      return statistics;
   }

   public Wave getWave() {
      return wave;
   }

   public EventTimer getTimer() {
      return timer;
   }
}
