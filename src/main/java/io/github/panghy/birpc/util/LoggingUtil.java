package io.github.panghy.birpc.util;

import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging helpers for the birpc core.
 * Every call goes through JUL (java.util.logging) and is attributed to the
 * class and method that called into this helper rather than to the helper itself.
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
    // 0=getStackTrace, 1=getCaller, 2=log, 3=debug/info/warn/error
    for (int i = 3; i < stack.length; i++) {
      StackTraceElement element = stack[i];
      if (!element.getClassName().equals(LoggingUtil.class.getName())) {
        return element;
      }
    }
    return stack[stack.length - 1];
  }

  private static void log(Logger logger, Level level, String message, Throwable throwable) {
    if (!logger.isLoggable(level)) {
      return;
    }
    StackTraceElement caller = getCaller();
    if (throwable == null) {
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message);
    } else {
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message, throwable);
    }
  }

  /**
   * Logs a debug (FINE) message.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void debug(Logger logger, String message) {
    log(logger, Level.FINE, message, null);
  }

  /**
   * Logs a debug (FINE) message built lazily, so per-call tracing costs nothing
   * when FINE is disabled.
   *
   * @param logger  The logger to use
   * @param message Supplier of the message to log
   */
  public static void debug(Logger logger, Supplier<String> message) {
    if (logger.isLoggable(Level.FINE)) {
      log(logger, Level.FINE, message.get(), null);
    }
  }

  /**
   * Logs a debug (FINE) message with a stack trace.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void debug(Logger logger, String message, Throwable throwable) {
    log(logger, Level.FINE, message, throwable);
  }

  /**
   * Logs an info message.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void info(Logger logger, String message) {
    log(logger, Level.INFO, message, null);
  }

  /**
   * Logs a warning.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void warn(Logger logger, String message) {
    log(logger, Level.WARNING, message, null);
  }

  /**
   * Logs a warning with a stack trace.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void warn(Logger logger, String message, Throwable throwable) {
    log(logger, Level.WARNING, message, throwable);
  }

  /**
   * Logs an error (SEVERE).
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void error(Logger logger, String message) {
    log(logger, Level.SEVERE, message, null);
  }

  /**
   * Logs an error (SEVERE) with a stack trace.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void error(Logger logger, String message, Throwable throwable) {
    log(logger, Level.SEVERE, message, throwable);
  }
}
