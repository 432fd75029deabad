package br.ufmg.cs.systems.wfc.exceptions;

/**
 * Raised only when an attempt cap was configured and every attempt ended in a
 * contradiction. Without a cap the solver restarts indefinitely.
 */
public class ContradictionException extends RuntimeException {
   private final int cell;
   private final int attempts;

   public ContradictionException(int cell, int attempts) {
      super("Contradiction at cell " + cell + " after " + attempts +
              " attempt(s), no attempts left");
      this.cell = cell;
      this.attempts = attempts;
   }

   public int getCell() {
      return cell;
   }

   public int getAttempts() {
      return attempts;
   }
}
