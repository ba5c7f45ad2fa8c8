package org.fpbase.client.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger root;
  private Logger client;
  private Level rootLevel;
  private Level clientLevel;

  @BeforeEach
  void capture() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    client = (Logger) LoggerFactory.getLogger("org.fpbase.client");
    rootLevel = root.getLevel();
    clientLevel = client.getLevel();
  }

  @AfterEach
  void restore() {
    root.setLevel(rootLevel);
    client.setLevel(clientLevel);
  }

  @Test
  void verboseLoggingRaisesRootAndClientLoggers() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    assertEquals(Level.DEBUG, root.getLevel());
    assertEquals(Level.DEBUG, client.getLevel());
  }
}
