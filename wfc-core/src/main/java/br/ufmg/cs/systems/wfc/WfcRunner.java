package br.ufmg.cs.systems.wfc;

import br.ufmg.cs.systems.wfc.conf.Configuration;
import br.ufmg.cs.systems.wfc.exceptions.InvalidInputException;
import br.ufmg.cs.systems.wfc.io.ExemplarReader;
import br.ufmg.cs.systems.wfc.io.ImageEncoder;
import br.ufmg.cs.systems.wfc.io.PixelBuffer;
import br.ufmg.cs.systems.wfc.pattern.CompatibilityTable;
import br.ufmg.cs.systems.wfc.pattern.PatternCatalogue;
import br.ufmg.cs.systems.wfc.pattern.PatternExtractor;
import br.ufmg.cs.systems.wfc.solver.WaveSolver;
import br.ufmg.cs.systems.wfc.util.EventTimer;
import br.ufmg.cs.systems.wfc.util.WfcAppLogLevel;
import br.ufmg.cs.systems.wfc.visualization.ManualVisualizationSink;
import br.ufmg.cs.systems.wfc.visualization.VisualizationSink;
import br.ufmg.cs.systems.wfc.visualization.VisualizationSinks;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Random;

/**
 * Command line entry point. Every argument is a {@code key=value} pair
 * overriding {@code wfc.properties}, e.g.
 * <pre>
 * wfc.input.path=flowers.png wfc.output.path=out.png wfc.tile.size=3
 * </pre>
 */
public class WfcRunner {
   private static final Logger LOG = Logger.getLogger(WfcRunner.class);

   private static final String BASE_LOGGER = "br.ufmg.cs.systems.wfc";

   private final Configuration config;
   private final EventTimer timer;

   public WfcRunner(Configuration config) {
      config.validate();
      this.config = config;
      this.timer = new EventTimer("WfcRunner");
   }

   /**
    * Reads the exemplar, generates the output and writes it.
    *
    * @return the generated image
    */
   public PixelBuffer run() {
      Path inputPath = requiredPath(Configuration.CONF_INPUT_PATH,
              config.getInputPath());
      Path outputPath = requiredPath(Configuration.CONF_OUTPUT_PATH,
              config.getOutputPath());

      LOG.log(WfcAppLogLevel.APP, "Running with " + config);

      timer.start(EventTimer.EXTRACTION);
      PixelBuffer exemplar = new ExemplarReader().read(inputPath);
      PatternCatalogue catalogue = new PatternExtractor(config).extract(exemplar);
      timer.finish(EventTimer.EXTRACTION);

      timer.start(EventTimer.COMPATIBILITY);
      CompatibilityTable table = CompatibilityTable.build(catalogue,
              config.isCompatibilityParallel());
      timer.finish(EventTimer.COMPATIBILITY);

      VisualizationSink sink = VisualizationSinks.create(config);
      if (sink instanceof ManualVisualizationSink) {
         startAcknowledger((ManualVisualizationSink) sink);
      }

      WaveSolver solver = WaveSolver.create(catalogue, table, config,
              new Random(resolveSeed()), sink);
      PixelBuffer output = solver.solve();

      new ImageEncoder(config.getOutputFormat()).write(output, outputPath);

      timer.log(LOG, Level.INFO);
      return output;
   }

   private long resolveSeed() {
      Long seed = config.getSeed();
      if (seed == null) {
         seed = System.nanoTime();
         LOG.log(WfcAppLogLevel.APP, "No " + Configuration.CONF_SEED +
                 " given, using " + Configuration.CONF_SEED + "=" + seed);
      }
      return seed;
   }

   private static Path requiredPath(String key, String value) {
      if (value == null) {
         throw new InvalidInputException(key + " is required");
      }
      return Paths.get(value);
   }

   // one acknowledgement per line typed on stdin
   private static void startAcknowledger(ManualVisualizationSink sink) {
      Thread reader = new Thread(() -> {
         BufferedReader in = new BufferedReader(
                 new InputStreamReader(System.in, StandardCharsets.UTF_8));
         try {
            while (in.readLine() != null) {
               sink.acknowledge();
            }
            LOG.warn("Standard input closed, no more acknowledgements");
         } catch (IOException e) {
            LOG.error("Failed reading acknowledgements from standard input", e);
         }
      }, "wfc-acknowledger");
      reader.setDaemon(true);
      reader.start();
      LOG.info("Manual visualization: press enter to advance each round");
   }

   public static void main(String[] args) {
      Configuration config = null;

      try {
         config = Configuration.fromArgs(args);
         config.validate();
      } catch (InvalidInputException e) {
         System.out.println(e.getMessage());
         System.out.println(
                 "Usage: java br.ufmg.cs.systems.wfc.WfcRunner " +
                         "wfc.input.path=<exemplar> wfc.output.path=<output> [key=value ...]");
         System.exit(1);
      }

      Logger.getLogger(BASE_LOGGER).setLevel(
              WfcAppLogLevel.parse(config.getLogLevel(), Level.INFO));

      new WfcRunner(config).run();
   }
}
