package br.ufmg.cs.systems.wfc.util;

/**
 * One-shot handshake between a waiting thread and an acknowledging one.
 * An acknowledgment given before anyone waits is kept for the next wait.
 */
public class AcknowledgementSignal {
   private final Object monitor = new Object();
   private boolean acknowledged = false;

   // called by the acknowledging thread
   public void acknowledge() {
      synchronized (monitor) {
         acknowledged = true;
         monitor.notify();
      }
   }

   /**
    * Blocks until acknowledged, then consumes the acknowledgment.
    *
    * @return false if the waiting thread was interrupted; its interrupt flag
    * is restored
    */
   public boolean awaitAcknowledgement() {
      synchronized (monitor) {
         while (!acknowledged) {
            try {
               monitor.wait();
            } catch (InterruptedException e) {
               Thread.currentThread().interrupt();
               return false;
            }
         }

         acknowledged = false;
         return true;
      }
   }

   public boolean isPending() {
      synchronized (monitor) {
         return acknowledged;
      }
   }
}
