package com.gentoro.agentgraph.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LoggingServiceTest {
  private final Logger demo = (Logger) LoggingService.getLogger(LoggingServiceTest.class);

  @AfterEach
  void reset() {
    demo.setLevel(null);
  }

  @Test
  void appliesNamedLevels() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.level." + LoggingServiceTest.class.getName(), "debug");
    cfg.addProperty("logging.level.some.other.logger", "LOUD");

    LoggingService.applyConfiguration(cfg);

    assertEquals(Level.DEBUG, demo.getLevel());
  }

  @Test
  void ignoresMissingSection() {
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(new BaseConfiguration()));
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(null));
    assertNull(demo.getLevel());
  }
}
