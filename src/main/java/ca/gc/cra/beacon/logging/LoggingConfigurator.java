package ca.gc.cra.beacon.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime switches for BEACON's own log output, used by the {@code --verbose} CLI flag.
 *
 * @implNote Only Logback supports the switch; with another SLF4J binding the request is logged and ignored.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String BEACON_LOGGER = "ca.gc.cra.beacon";

  private LoggingConfigurator() {}

  /**
   * Lowers the BEACON and root loggers to DEBUG so connection attempts, bursts and handshakes are visible.
   * OpenTelemetry's logger keeps its configured level.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext)) {
      log.warn("Cannot enable verbose logging on SLF4J backend {}", factory.getClass().getName());
      return;
    }
    LoggerContext context = (LoggerContext) factory;
    for (String name : new String[] {Logger.ROOT_LOGGER_NAME, BEACON_LOGGER}) {
      context.getLogger(name).setLevel(Level.DEBUG);
    }
    log.debug("Verbose logging enabled");
  }
}
