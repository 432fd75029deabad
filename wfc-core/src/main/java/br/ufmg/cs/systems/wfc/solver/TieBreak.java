package br.ufmg.cs.systems.wfc.solver;

import br.ufmg.cs.systems.wfc.exceptions.InvalidInputException;

/**
 * How the observer picks among cells sharing the minimum entropy.
 */
public enum TieBreak {
   /** Uniformly at random among the minimal cells. */
   RANDOM,
   /**
    * Lowest cell index among the minimal cells. Deterministic but biased
    * towards the top-left of the output.
    */
   FIRST;

   public static TieBreak fromString(String value) {
      for (TieBreak tieBreak : values()) {
         if (tieBreak.name().equalsIgnoreCase(value)) {
            return tieBreak;
         }
      }
      throw new InvalidInputException("unknown tie-break '" + value + "'");
   }
}
