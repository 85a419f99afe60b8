package ca.gc.cra.testreport.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Raises log levels for the {@code --verbose} and {@code --trace} CLI flags.
 * <p>{@code --verbose} shows the parser's flush and discard decisions (DEBUG on {@value #PROJECT_LOGGER});
 * {@code --trace} additionally shows every line the parser drops (TRACE on {@value #PARSE_LOGGER}).
 * Third-party loggers keep the level from {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Levels are only ever lowered, so a more detailed level from {@code logback.xml} is kept. Other
 * SLF4J bindings get a warning and keep their own configuration.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Logger hierarchy covering every class in this project. */
  public static final String PROJECT_LOGGER = "ca.gc.cra.testreport";
  /** Logger hierarchy of the line classifier. */
  public static final String PARSE_LOGGER = "ca.gc.cra.testreport.domain.parse";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Logs this project's diagnostics at DEBUG.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    return lowerThreshold(PROJECT_LOGGER, Level.DEBUG);
  }

  /**
   * Logs every line the parser drops, at TRACE.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableLineTracing() {
    return lowerThreshold(PARSE_LOGGER, Level.TRACE);
  }

  private static boolean lowerThreshold(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Cannot raise {} to {}: backend {} does not support dynamic level updates",
          loggerName, level, factory.getClass().getName());
      return false;
    }
    Logger logger = context.getLogger(loggerName);
    if (!level.isGreaterOrEqual(logger.getEffectiveLevel())) {
      logger.setLevel(level);
    }
    return true;
  }
}
