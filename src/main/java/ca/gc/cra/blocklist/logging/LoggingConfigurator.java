package ca.gc.cra.blocklist.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Switches the block list loggers to DEBUG for {@code --verbose} runs.
 * <p><strong>Why:</strong> Per-line rejections, per-attempt fetch retries and NXDOMAIN drops are only logged at
 * DEBUG. Raising the {@value #APPLICATION_LOGGER} logger exposes them without also opening up the HTTP client and
 * OpenTelemetry exporter internals configured in {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their levels.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  /** Base logger of every class in the application. */
  public static final String APPLICATION_LOGGER = "ca.gc.cra.blocklist";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the application logger to DEBUG.
   *
   * @return level configured before the call, {@code null} when it was inherited or the backend is not Logback
   */
  public static Level enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger app = context.getLogger(APPLICATION_LOGGER);
      Level previous = app.getLevel();
      app.setLevel(Level.DEBUG);
      return previous;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return null;
  }

  /**
   * Puts the application logger back to an earlier level; {@code null} makes it inherit from the root again.
   *
   * @param level level returned by {@link #enableVerboseLogging()}
   */
  public static void restore(Level level) {
    if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
      context.getLogger(APPLICATION_LOGGER).setLevel(level);
    }
  }
}
