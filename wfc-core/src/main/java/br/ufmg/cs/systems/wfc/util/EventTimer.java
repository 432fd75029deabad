package br.ufmg.cs.systems.wfc.util;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

/**
 * Accumulates elapsed time of the phases of a run. Events may not overlap
 * themselves; time outside any event is accounted as 'none'.
 */
public class EventTimer {

   /**
    * Events to be timed
    */
   public static final int EXTRACTION = 0;
   public static final int COMPATIBILITY = 1;
   public static final int OBSERVATION = 2;
   public static final int PROPAGATION = 3;
   private static final int NONE = 4;
   private static final String[] EVENT_NAMES = {
           "extraction",
           "compatibility",
           "observation",
           "propagation",
           "none"
   };

   private final String name;
   private final long creationTime;
   private int ongoingEvents;

   /**
    * let it fail: indicates whether this timer is being used correctly
    */
   private boolean inconsistent;

   /**
    * Time vector for each event (elapsed time)
    */
   private final long[] eventElapsedTimes;
   private final long[] eventLastTimes;

   public EventTimer(String name) {
      this.name = name;
      int numEvents = EVENT_NAMES.length;
      this.eventElapsedTimes = new long[numEvents];
      this.eventLastTimes = new long[numEvents];
      this.ongoingEvents = 0;
      this.creationTime = System.nanoTime();
      this.inconsistent = false;

      startNoneEvent();
   }

   private void startNoneEvent() {
      inconsistent = inconsistent || eventLastTimes[NONE] != 0;
      eventLastTimes[NONE] = System.nanoTime();
   }

   private void finishNoneEvent() {
      long lastEventTime = eventLastTimes[NONE];
      inconsistent = inconsistent || lastEventTime == 0;
      eventElapsedTimes[NONE] += System.nanoTime() - lastEventTime;
      eventLastTimes[NONE] = 0;
   }

   /**
    * Marks the start of an event (see static fields in this class)
    * @param event event unique index
    */
   public void start(int event) {
      if (ongoingEvents == 0) {
         finishNoneEvent();
      }

      inconsistent = inconsistent || eventLastTimes[event] != 0;
      eventLastTimes[event] = System.nanoTime();

      ++ongoingEvents;
   }

   /**
    * Marks the end of an event (see static fields in this class)
    * @param event event unique index
    */
   public void finish(int event) {
      long lastEventTime = eventLastTimes[event];
      inconsistent = inconsistent || lastEventTime == 0;
      eventElapsedTimes[event] += System.nanoTime() - lastEventTime;
      eventLastTimes[event] = 0;

      if (--ongoingEvents == 0) {
         startNoneEvent();
      }
   }

   /**
    * Accumulated time of finished occurrences of an event, in milliseconds
    */
   public long elapsedMs(int event) {
      return (long) (eventElapsedTimes[event] * 1e-6);
   }

   public boolean isInconsistent() {
      return inconsistent || ongoingEvents != 0;
   }

   public void log(Logger logger, Level level) {
      if (!logger.isEnabledFor(level)) return;

      String timerName = isInconsistent() ? "Inconsistent" + name : name;
      long totalFromEvents = 0;
      for (int event = 0; event < NONE; ++event) {
         long timeNano = eventElapsedTimes[event];
         if (timeNano == 0) continue;
         totalFromEvents += timeNano;
         logger.log(level, timerName + " " + EVENT_NAMES[event] + " " +
                 elapsedMs(event) + " (ms)");
      }

      long total = (long) ((System.nanoTime() - creationTime) * 1e-6);
      logger.log(level, timerName + " total " + total + " " +
              (long) (totalFromEvents * 1e-6) + " (ms)");
   }
}
