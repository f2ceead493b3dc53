package ca.gc.cra.dnstap.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Aligns Logback logger levels with the configured error reporting level.
 * <p><strong>Why:</strong> The handler reports failures by an explicit threshold; process logging should show the
 * same verbosity so reports drained by the error logger are not filtered out a second time.</p>
 * <p><strong>Role:</strong> Adapter-side utility called once during composition.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup.</p>
 * <p><strong>Observability:</strong> Emits an SLF4J warning when the backend does not support dynamic levels.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the root logger level.
   *
   * @param level SLF4J level to apply
   * @return {@code true} when the backend accepted the change
   */
  public static boolean applyLevel(org.slf4j.event.Level level) {
    return applyLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, level);
  }

  /**
   * Sets the level of one named logger, leaving the rest of the hierarchy untouched.
   *
   * @param loggerName logger to adjust
   * @param level SLF4J level to apply
   * @return {@code true} when the backend accepted the change
   */
  public static boolean applyLevel(String loggerName, org.slf4j.event.Level level) {
    Objects.requireNonNull(loggerName, "loggerName");
    Objects.requireNonNull(level, "level");
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      Level target = Level.toLevel(level.name());
      if (!target.equals(logger.getLevel())) {
        logger.setLevel(target);
      }
      return true;
    }
    log.warn("Log level {} for {} requested but backend {} does not support dynamic level updates",
        level, loggerName, factory.getClass().getName());
    return false;
  }
}
