package br.ufmg.cs.systems.wfc.conf;

import br.ufmg.cs.systems.wfc.exceptions.InvalidInputException;
import br.ufmg.cs.systems.wfc.solver.TieBreak;
import br.ufmg.cs.systems.wfc.visualization.VisualizationMode;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Run parameters. Every key has a default constant next to it; values come from
 * {@code wfc.properties} on the classpath and may be overridden one by one,
 * typically from {@code key=value} launcher arguments.
 */
public class Configuration {
   private static final Logger LOG = Logger.getLogger(Configuration.class);

   public static final String CONF_RESOURCE = "wfc.properties";

   public static final String CONF_LOG_LEVEL = "wfc.log.level";
   public static final String CONF_LOG_LEVEL_DEFAULT = "info";
   public static final String CONF_INPUT_PATH = "wfc.input.path";
   public static final String CONF_INPUT_PATH_DEFAULT = null;
   public static final String CONF_INPUT_PERIODIC = "wfc.input.periodic";
   public static final boolean CONF_INPUT_PERIODIC_DEFAULT = true;
   public static final String CONF_OUTPUT_PATH = "wfc.output.path";
   public static final String CONF_OUTPUT_PATH_DEFAULT = null;
   public static final String CONF_OUTPUT_FORMAT = "wfc.output.format";
   public static final String CONF_OUTPUT_FORMAT_DEFAULT = "png";
   public static final String CONF_OUTPUT_WIDTH = "wfc.output.width";
   public static final int CONF_OUTPUT_WIDTH_DEFAULT = 30;
   public static final String CONF_OUTPUT_HEIGHT = "wfc.output.height";
   public static final int CONF_OUTPUT_HEIGHT_DEFAULT = 30;
   public static final String CONF_OUTPUT_PERIODIC = "wfc.output.periodic";
   public static final boolean CONF_OUTPUT_PERIODIC_DEFAULT = false;
   public static final String CONF_TILE_SIZE = "wfc.tile.size";
   public static final int CONF_TILE_SIZE_DEFAULT = 2;
   public static final String CONF_SYMMETRY = "wfc.symmetry";
   public static final int CONF_SYMMETRY_DEFAULT = 1;
   public static final String CONF_SYMMETRY_ENABLED = "wfc.symmetry.enabled";
   public static final String CONF_COMPATIBILITY_PARALLEL =
           "wfc.compatibility.parallel";
   public static final boolean CONF_COMPATIBILITY_PARALLEL_DEFAULT = false;
   public static final String CONF_TIEBREAK = "wfc.tiebreak";
   public static final String CONF_TIEBREAK_DEFAULT = "random";
   public static final String CONF_SEED = "wfc.seed";
   public static final Long CONF_SEED_DEFAULT = null;
   public static final String CONF_MAX_ATTEMPTS = "wfc.max.attempts";
   public static final int CONF_MAX_ATTEMPTS_DEFAULT = 0;
   public static final String CONF_VISUAL_MODE = "wfc.visual.mode";
   public static final String CONF_VISUAL_MODE_DEFAULT = "off";
   public static final String CONF_VISUAL_TILE_SIZE = "wfc.visual.tile.size";
   public static final int CONF_VISUAL_TILE_SIZE_DEFAULT = 8;
   public static final String CONF_VISUAL_DEBUG = "wfc.visual.debug";
   public static final boolean CONF_VISUAL_DEBUG_DEFAULT = false;
   public static final String CONF_VISUAL_DELAY_MS = "wfc.visual.delay.ms";
   public static final long CONF_VISUAL_DELAY_MS_DEFAULT = 0;
   public static final String CONF_VISUAL_FRAMES_DIR = "wfc.visual.frames.dir";
   public static final String CONF_VISUAL_FRAMES_DIR_DEFAULT = null;

   private static final int MAX_SYMMETRY = 8;

   private final Properties properties;

   public Configuration() {
      this(loadDefaults());
   }

   public Configuration(Properties properties) {
      this.properties = new Properties();
      this.properties.putAll(properties);
   }

   /**
    * Classpath defaults overridden by {@code key=value} arguments.
    */
   public static Configuration fromArgs(String... args) {
      Configuration config = new Configuration();
      for (String arg : args) {
         String key = StringUtils.trimToNull(StringUtils.substringBefore(arg, "="));
         if (key == null || !arg.contains("=")) {
            throw new InvalidInputException("expected key=value, got '" +
                    arg + "'");
         }
         config.set(key, StringUtils.substringAfter(arg, "="));
      }
      return config;
   }

   private static Properties loadDefaults() {
      Properties defaults = new Properties();
      InputStream is = Configuration.class.getClassLoader()
              .getResourceAsStream(CONF_RESOURCE);
      if (is == null) {
         LOG.info("No " + CONF_RESOURCE + " on classpath, using built-in defaults");
         return defaults;
      }

      try (Reader reader = new InputStreamReader(
              new BOMInputStream(is), StandardCharsets.UTF_8)) {
         defaults.load(reader);
      } catch (IOException e) {
         throw new InvalidInputException("cannot read " + CONF_RESOURCE, e);
      }

      return defaults;
   }

   public Configuration set(String key, Object value) {
      if (value == null) {
         properties.remove(key);
      } else {
         properties.setProperty(key, value.toString());
      }
      return this;
   }

   public String getString(String key, String defaultValue) {
      String value = StringUtils.trimToNull(properties.getProperty(key));
      return value == null ? defaultValue : value;
   }

   public Integer getInteger(String key, Integer defaultValue) {
      String value = getString(key, null);
      if (value == null) {
         return defaultValue;
      }
      try {
         return Integer.parseInt(value);
      } catch (NumberFormatException e) {
         throw new InvalidInputException(key + " is not an integer: " + value, e);
      }
   }

   public Long getLong(String key, Long defaultValue) {
      String value = getString(key, null);
      if (value == null) {
         return defaultValue;
      }
      try {
         return Long.parseLong(value);
      } catch (NumberFormatException e) {
         throw new InvalidInputException(key + " is not a long: " + value, e);
      }
   }

   public Boolean getBoolean(String key, Boolean defaultValue) {
      String value = getString(key, null);
      if (value == null) {
         return defaultValue;
      }
      if ("true".equalsIgnoreCase(value)) {
         return true;
      } else if ("false".equalsIgnoreCase(value)) {
         return false;
      }
      throw new InvalidInputException(key + " is not a boolean: " + value);
   }

   public String getLogLevel() {
      return getString(CONF_LOG_LEVEL, CONF_LOG_LEVEL_DEFAULT);
   }

   public String getInputPath() {
      return getString(CONF_INPUT_PATH, CONF_INPUT_PATH_DEFAULT);
   }

   public boolean isInputPeriodic() {
      return getBoolean(CONF_INPUT_PERIODIC, CONF_INPUT_PERIODIC_DEFAULT);
   }

   public String getOutputPath() {
      return getString(CONF_OUTPUT_PATH, CONF_OUTPUT_PATH_DEFAULT);
   }

   public String getOutputFormat() {
      return getString(CONF_OUTPUT_FORMAT, CONF_OUTPUT_FORMAT_DEFAULT);
   }

   public int getOutputWidth() {
      return getInteger(CONF_OUTPUT_WIDTH, CONF_OUTPUT_WIDTH_DEFAULT);
   }

   public int getOutputHeight() {
      return getInteger(CONF_OUTPUT_HEIGHT, CONF_OUTPUT_HEIGHT_DEFAULT);
   }

   public boolean isOutputPeriodic() {
      return getBoolean(CONF_OUTPUT_PERIODIC, CONF_OUTPUT_PERIODIC_DEFAULT);
   }

   public int getTileSize() {
      return getInteger(CONF_TILE_SIZE, CONF_TILE_SIZE_DEFAULT);
   }

   /**
    * Number of symmetry variants generated per extracted block, 1 meaning the
    * block alone. The boolean toggle, when present, wins over the count.
    */
   public int getSymmetry() {
      Boolean enabled = getBoolean(CONF_SYMMETRY_ENABLED, null);
      if (enabled != null) {
         return enabled ? MAX_SYMMETRY : 1;
      }
      return getInteger(CONF_SYMMETRY, CONF_SYMMETRY_DEFAULT);
   }

   public boolean isSymmetryEnabled() {
      return getSymmetry() > 1;
   }

   public boolean isCompatibilityParallel() {
      return getBoolean(CONF_COMPATIBILITY_PARALLEL,
              CONF_COMPATIBILITY_PARALLEL_DEFAULT);
   }

   public TieBreak getTieBreak() {
      return TieBreak.fromString(getString(CONF_TIEBREAK, CONF_TIEBREAK_DEFAULT));
   }

   public Long getSeed() {
      return getLong(CONF_SEED, CONF_SEED_DEFAULT);
   }

   public int getMaxAttempts() {
      return getInteger(CONF_MAX_ATTEMPTS, CONF_MAX_ATTEMPTS_DEFAULT);
   }

   public VisualizationMode getVisualizationMode() {
      return VisualizationMode.fromString(
              getString(CONF_VISUAL_MODE, CONF_VISUAL_MODE_DEFAULT));
   }

   public int getVisualTileSize() {
      return getInteger(CONF_VISUAL_TILE_SIZE, CONF_VISUAL_TILE_SIZE_DEFAULT);
   }

   public boolean isVisualDebug() {
      return getBoolean(CONF_VISUAL_DEBUG, CONF_VISUAL_DEBUG_DEFAULT);
   }

   public long getVisualDelayMs() {
      return getLong(CONF_VISUAL_DELAY_MS, CONF_VISUAL_DELAY_MS_DEFAULT);
   }

   public String getVisualFramesDir() {
      return getString(CONF_VISUAL_FRAMES_DIR, CONF_VISUAL_FRAMES_DIR_DEFAULT);
   }

   /**
    * Checks the parameters the solver depends on. Exemplar dependent checks
    * (tile size against the exemplar) happen at extraction.
    */
   public void validate() {
      if (getTileSize() < 1) {
         throw new InvalidInputException(CONF_TILE_SIZE + " must be positive, got " +
                 getTileSize());
      }
      if (getOutputWidth() < 1 || getOutputHeight() < 1) {
         throw new InvalidInputException("output dimensions must be positive, got " +
                 getOutputWidth() + "x" + getOutputHeight());
      }
      int symmetry = getSymmetry();
      if (symmetry < 1 || symmetry > MAX_SYMMETRY) {
         throw new InvalidInputException(CONF_SYMMETRY + " must be in [1, " +
                 MAX_SYMMETRY + "], got " + symmetry);
      }
      if (getMaxAttempts() < 0) {
         throw new InvalidInputException(CONF_MAX_ATTEMPTS +
                 " must be zero (unbounded) or positive, got " + getMaxAttempts());
      }
      if (getVisualTileSize() < 1) {
         throw new InvalidInputException(CONF_VISUAL_TILE_SIZE +
                 " must be positive, got " + getVisualTileSize());
      }
      if (getVisualDelayMs() < 0) {
         throw new InvalidInputException(CONF_VISUAL_DELAY_MS +
                 " must not be negative, got " + getVisualDelayMs());
      }

      // parse errors surface here rather than mid-run
      getTieBreak();
      getVisualizationMode();
      getSeed();
      isInputPeriodic();
      isOutputPeriodic();
      isCompatibilityParallel();
      isVisualDebug();
   }

   @Override
   public String toString() {
      return "Configuration{" +
              "tileSize=" + getTileSize() +
              ",output=" + getOutputWidth() + "x" + getOutputHeight() +
              ",symmetry=" + getSymmetry() +
              ",inputPeriodic=" + isInputPeriodic() +
              ",outputPeriodic=" + isOutputPeriodic() +
              ",tieBreak=" + getTieBreak() +
              ",seed=" + getSeed() +
              ",maxAttempts=" + getMaxAttempts() +
              ",visualMode=" + getVisualizationMode() +
              '}';
   }
}
