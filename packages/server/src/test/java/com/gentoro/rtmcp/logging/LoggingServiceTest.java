package com.gentoro.rtmcp.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {
  private static final String NAME = "com.gentoro.rtmcp.logging.probe";

  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

  @AfterEach
  void reset() {
    context.getLogger(NAME).setLevel(null);
  }

  @Test
  void appliesNamedLevels() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.level." + NAME, "TRACE");

    assertEquals(1, LoggingService.applyConfiguration(cfg));
    assertEquals(Level.TRACE, context.getLogger(NAME).getLevel());
  }

  @Test
  void skipsUnknownAndUnresolvedLevels() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.level." + NAME, "LOUD");
    cfg.addProperty("logging.level.okhttp3", "${env:OKHTTP_LEVEL}");

    assertEquals(0, LoggingService.applyConfiguration(cfg));
    assertNull(context.getLogger(NAME).getLevel());
  }

  @Test
  void nullConfigurationIsIgnored() {
    assertEquals(0, LoggingService.applyConfiguration(null));
  }
}
