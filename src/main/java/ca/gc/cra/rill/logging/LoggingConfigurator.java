package ca.gc.cra.rill.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the Logback backend that RILL's own diagnostics and the SLF4J sink write to.
 * <p><strong>Role:</strong> Called once by {@code CompositionRoot} when a pipeline asks for verbose diagnostics
 * or a specific sink logger level.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup.</p>
 *
 * @implNote Other SLF4J bindings are left untouched and a warning names the backend.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the {@code ca.gc.cra.rill} logger to DEBUG so queue, drop, and failure diagnostics are visible.
   */
  public static void enableVerboseLogging() {
    setLevel("ca.gc.cra.rill", "DEBUG");
  }

  /**
   * Sets the Logback level of a named logger.
   *
   * @param loggerName logger to adjust; {@code ROOT} for the root logger
   * @param level Logback level name such as {@code INFO}; unknown names map to DEBUG
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setLevel(String loggerName, String level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger target = context.getLogger(loggerName);
      Level desired = Level.toLevel(level, Level.DEBUG);
      if (!desired.equals(target.getLevel())) {
        target.setLevel(desired);
      }
      return true;
    }
    log.warn("Logger level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
    return false;
  }
}
