package com.gentoro.knowledge.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  @Test
  void appliesLevelsFromConfiguration() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.level.com.gentoro.knowledge.sample", "ERROR");
    cfg.addProperty("logging.level.com.gentoro.knowledge.other", "not-a-level");

    LoggingService.applyConfiguration(cfg);

    LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
    assertEquals(Level.ERROR, ctx.getLogger("com.gentoro.knowledge.sample").getLevel());
    assertNull(ctx.getLogger("com.gentoro.knowledge.other").getLevel());
  }
}
