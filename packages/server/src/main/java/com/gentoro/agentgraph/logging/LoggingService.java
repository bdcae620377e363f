package com.gentoro.agentgraph.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger lookup for the whole application, plus log levels taken from the {@code logging.level}
 * section of the configuration:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com..gentoro..agentgraph: DEBUG
 * </pre>
 *
 * Logger names containing dots must double them in YAML keys, as Commons Configuration reads a
 * single dot as a path separator.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);
  private static final String PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /** Levels that do not parse are skipped with a WARN; logback.xml stays in charge otherwise. */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.debug("Logging backend is not Logback, ignoring {} settings", PREFIX);
      return;
    }
    Configuration levels = cfg.subset(PREFIX);
    for (Iterator<String> keys = levels.getKeys(); keys.hasNext(); ) {
      String name = keys.next();
      String loggerName =
          "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name.replace("..", ".");
      apply(context.getLogger(loggerName), levels.getString(name, null));
    }
  }

  private static void apply(ch.qos.logback.classic.Logger logger, String value) {
    if (value == null || value.isBlank()) return;
    Level level = Level.toLevel(value.trim(), null);
    if (level == null) {
      log.warn("Ignoring unknown log level '{}' for logger {}", value, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Logger {} set to {}", logger.getName(), level);
  }
}
