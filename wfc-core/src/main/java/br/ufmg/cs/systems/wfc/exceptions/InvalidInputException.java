package br.ufmg.cs.systems.wfc.exceptions;

public class InvalidInputException extends RuntimeException {
   public InvalidInputException(String message) {
      super("Invalid input: " + message);
   }

   public InvalidInputException(String message, Throwable cause) {
      super("Invalid input: " + message, cause);
   }
}
