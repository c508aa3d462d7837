package ca.gc.cra.taskwerk.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the Logback root level at runtime.
 * <p><strong>Why:</strong> The effective configuration carries {@code developer.logLevel}; applying it after a
 * load lets operators change verbosity through any configuration layer, including the environment.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded bootstrap; Logback synchronizes level updates.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    applyLevel("debug");
  }

  /**
   * Sets the root logger level from a schema level name ({@code error}, {@code warn}, {@code info},
   * {@code debug}, {@code trace}).
   *
   * @param levelName level name, case-insensitive
   * @return {@code true} when the backend accepted the level
   */
  public static boolean applyLevel(String levelName) {
    Optional<Level> level = toLevel(levelName);
    if (level.isEmpty()) {
      log.warn("Ignoring unknown log level '{}'", levelName);
      return false;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.get().equals(root.getLevel())) {
        root.setLevel(level.get());
      }
      return true;
    }
    log.warn("Log level change requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }

  /**
   * Returns the current root level name, lower-cased.
   *
   * @return level name when the backend is Logback
   */
  public static Optional<String> currentLevel() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Level level = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
      return Optional.ofNullable(level).map(value -> value.toString().toLowerCase(Locale.ROOT));
    }
    return Optional.empty();
  }

  private static Optional<Level> toLevel(String levelName) {
    if (levelName == null || levelName.isBlank()) {
      return Optional.empty();
    }
    return switch (levelName.trim().toLowerCase(Locale.ROOT)) {
      case "error" -> Optional.of(Level.ERROR);
      case "warn" -> Optional.of(Level.WARN);
      case "info" -> Optional.of(Level.INFO);
      case "debug" -> Optional.of(Level.DEBUG);
      case "trace" -> Optional.of(Level.TRACE);
      default -> Optional.empty();
    };
  }
}
