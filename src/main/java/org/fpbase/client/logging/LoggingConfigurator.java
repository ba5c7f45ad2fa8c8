package org.fpbase.client.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Raises FPbase client logging to DEBUG at runtime.
 * <p><strong>Role:</strong> Bridges the CLI {@code --verbose} flag to the Logback backend.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Other SLF4J bindings keep their configured levels and receive a warning.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String CLIENT_LOGGER = "org.fpbase.client";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the root logger and the {@code org.fpbase.client} logger to DEBUG.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      raise(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME));
      raise(context.getLogger(CLIENT_LOGGER));
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }

  private static void raise(Logger logger) {
    if (!Level.DEBUG.equals(logger.getLevel())) {
      logger.setLevel(Level.DEBUG);
    }
  }
}
