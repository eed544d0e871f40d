package io.github.panghy.pcg.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging helpers over JUL (java.util.logging). Each method checks the level before building a
 * record and attributes the record to the real caller rather than to this class.
 */
public final class LoggingUtil {

  private LoggingUtil() {
    // Utility class should not be instantiated
  }

  /**
   * Finds the first stack frame outside this class.
   */
  private static StackTraceElement getCaller() {
    StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    // Skip: 0=getStackTrace, 1=getCaller, 2=the logging method
    for (int i = 3; i < stack.length; i++) {
      StackTraceElement element = stack[i];
      if (!element.getClassName().equals(LoggingUtil.class.getName())) {
        return element;
      }
    }
    return stack[stack.length - 1];
  }

  private static void log(Logger logger, Level level, String message) {
    if (logger.isLoggable(level)) {
      StackTraceElement caller = getCaller();
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message);
    }
  }

  /**
   * Logs a message at {@link Level#FINE}.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void debug(Logger logger, String message) {
    log(logger, Level.FINE, message);
  }

  /**
   * Logs a message at {@link Level#INFO}.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void info(Logger logger, String message) {
    log(logger, Level.INFO, message);
  }
}
