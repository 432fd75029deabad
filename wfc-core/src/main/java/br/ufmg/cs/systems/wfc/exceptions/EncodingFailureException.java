package br.ufmg.cs.systems.wfc.exceptions;

public class EncodingFailureException extends RuntimeException {
   public EncodingFailureException(String message) {
      super("Encoding failure: " + message);
   }

   public EncodingFailureException(String message, Throwable cause) {
      super("Encoding failure: " + message, cause);
   }
}
