package com.gentoro.rtmcp.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger lookup for the whole server, plus the {@code logging.level.*} overrides read from the
 * YAML configuration. {@code logging.level.root} targets the root logger; every other key is a
 * logger name such as {@code okhttp3} or {@code com.gentoro.rtmcp.client}.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);
  private static final String PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply level overrides. Unknown level names are skipped with a warning and logback.xml keeps
   * its setting for that logger.
   *
   * @return number of loggers whose level was changed
   */
  public static int applyConfiguration(Configuration cfg) {
    if (cfg == null) {
      return 0;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("SLF4J is not bound to Logback; ignoring {}.* settings", PREFIX);
      return 0;
    }

    Configuration levels = cfg.subset(PREFIX);
    int applied = 0;
    for (Iterator<String> keys = levels.getKeys(); keys.hasNext(); ) {
      String key = keys.next();
      String name = "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key;
      if (setLevel(context.getLogger(name), levels.getString(key, null))) {
        applied++;
      }
    }
    return applied;
  }

  private static boolean setLevel(ch.qos.logback.classic.Logger logger, String value) {
    if (value == null || value.isBlank() || value.startsWith("${")) {
      return false;
    }
    Level level = Level.toLevel(value.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}' for logger {}", value, logger.getName());
      return false;
    }
    logger.setLevel(level);
    log.debug("Logger {} set to {}", logger.getName(), level);
    return true;
  }
}
