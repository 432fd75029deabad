package br.ufmg.cs.systems.wfc.conf;

import br.ufmg.cs.systems.wfc.exceptions.InvalidInputException;
import br.ufmg.cs.systems.wfc.solver.TieBreak;
import br.ufmg.cs.systems.wfc.visualization.VisualizationMode;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationTest {

   @Test
   void classpathDefaults() {
      Configuration config = new Configuration();

      assertEquals(2, config.getTileSize());
      assertEquals(30, config.getOutputWidth());
      assertEquals(30, config.getOutputHeight());
      assertEquals(1, config.getSymmetry());
      assertFalse(config.isSymmetryEnabled());
      assertTrue(config.isInputPeriodic());
      assertFalse(config.isOutputPeriodic());
      assertEquals(TieBreak.RANDOM, config.getTieBreak());
      assertEquals(VisualizationMode.OFF, config.getVisualizationMode());
      assertEquals(8, config.getVisualTileSize());
      assertEquals("png", config.getOutputFormat());
      assertNull(config.getSeed());
      assertNull(config.getInputPath());
      assertEquals(0, config.getMaxAttempts());
      config.validate();
   }

   @Test
   void builtInDefaultsWithoutProperties() {
      Configuration config = new Configuration(new Properties());

      assertEquals(Configuration.CONF_TILE_SIZE_DEFAULT, config.getTileSize());
      assertEquals(Configuration.CONF_OUTPUT_WIDTH_DEFAULT, config.getOutputWidth());
      assertEquals(Configuration.CONF_SYMMETRY_DEFAULT, config.getSymmetry());
   }

   @Test
   void argumentsOverrideDefaults() {
      Configuration config = Configuration.fromArgs(
              "wfc.tile.size=3",
              "wfc.output.width=48",
              "wfc.seed=42",
              "wfc.visual.mode=AUTO",
              "wfc.tiebreak=first",
              "wfc.input.path=in/flowers.png");

      assertEquals(3, config.getTileSize());
      assertEquals(48, config.getOutputWidth());
      assertEquals(30, config.getOutputHeight());
      assertEquals(Long.valueOf(42), config.getSeed());
      assertEquals(VisualizationMode.AUTO, config.getVisualizationMode());
      assertEquals(TieBreak.FIRST, config.getTieBreak());
      assertEquals("in/flowers.png", config.getInputPath());
   }

   @Test
   void symmetryToggleWinsOverCount() {
      Configuration config = new Configuration(new Properties())
              .set(Configuration.CONF_SYMMETRY, 4);
      assertEquals(4, config.getSymmetry());

      config.set(Configuration.CONF_SYMMETRY_ENABLED, true);
      assertEquals(8, config.getSymmetry());
      assertTrue(config.isSymmetryEnabled());

      config.set(Configuration.CONF_SYMMETRY_ENABLED, false);
      assertEquals(1, config.getSymmetry());

      config.set(Configuration.CONF_SYMMETRY_ENABLED, null);
      assertEquals(4, config.getSymmetry());
   }

   @Test
   void malformedArgument() {
      assertThrows(InvalidInputException.class,
              () -> Configuration.fromArgs("wfc.tile.size"));
      assertThrows(InvalidInputException.class,
              () -> Configuration.fromArgs("=3"));
   }

   @Test
   void unparsableValues() {
      Configuration config = new Configuration(new Properties());

      config.set(Configuration.CONF_TILE_SIZE, "two");
      InvalidInputException e = assertThrows(InvalidInputException.class,
              config::getTileSize);
      assertTrue(e.getMessage().startsWith("Invalid input: "));
      assertTrue(e.getMessage().contains(Configuration.CONF_TILE_SIZE));

      config.set(Configuration.CONF_TILE_SIZE, 2);
      config.set(Configuration.CONF_INPUT_PERIODIC, "yes");
      assertThrows(InvalidInputException.class, config::isInputPeriodic);
   }

   @Test
   void validateRejectsBadParameters() {
      assertThrows(InvalidInputException.class, () -> new Configuration(new Properties())
              .set(Configuration.CONF_TILE_SIZE, 0).validate());
      assertThrows(InvalidInputException.class, () -> new Configuration(new Properties())
              .set(Configuration.CONF_OUTPUT_HEIGHT, -1).validate());
      assertThrows(InvalidInputException.class, () -> new Configuration(new Properties())
              .set(Configuration.CONF_SYMMETRY, 9).validate());
      assertThrows(InvalidInputException.class, () -> new Configuration(new Properties())
              .set(Configuration.CONF_VISUAL_MODE, "sometimes").validate());
      assertThrows(InvalidInputException.class, () -> new Configuration(new Properties())
              .set(Configuration.CONF_TIEBREAK, "last").validate());
      assertThrows(InvalidInputException.class, () -> new Configuration(new Properties())
              .set(Configuration.CONF_MAX_ATTEMPTS, -2).validate());
   }
}
