package br.ufmg.cs.systems.wfc.visualization;

import br.ufmg.cs.systems.wfc.exceptions.InvalidInputException;

public enum VisualizationMode {
   /** re-render after every round */
   AUTO,
   /** re-render, then block for an acknowledgment after every round */
   MANUAL,
   /** no notification */
   OFF;

   public static VisualizationMode fromString(String value) {
      for (VisualizationMode mode : values()) {
         if (mode.name().equalsIgnoreCase(value)) {
            return mode;
         }
      }
      throw new InvalidInputException("unknown visualization mode '" +
              value + "', expected one of auto, manual, off");
   }
}
