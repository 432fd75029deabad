package br.ufmg.cs.systems.wfc.util;

import org.apache.log4j.Level;

/**
 * Level above every standard one but OFF, for run summaries that should show
 * even when the rest of the logging is silenced.
 */
public class WfcAppLogLevel extends Level {
   private static final int APP_INT = OFF_INT - 1;

   public static final Level APP = new WfcAppLogLevel(APP_INT, "APP", 10);

   protected WfcAppLogLevel(int level, String levelStr,
                            int syslogEquivalent) {
      super(level, levelStr, syslogEquivalent);
   }

   /**
    * Like {@link Level#toLevel(String, Level)}, also knowing "app".
    */
   public static Level parse(String name, Level defaultLevel) {
      if ("app".equalsIgnoreCase(name)) {
         return APP;
      }
      return Level.toLevel(name, defaultLevel);
   }
}
