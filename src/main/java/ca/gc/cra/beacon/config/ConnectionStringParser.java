package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.domain.packet.Level;
import ca.gc.cra.beacon.logging.Logs;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Parses {@code tcp(key=value,...)} connection descriptors into {@link ConnectionSettings}.
 * <p><strong>Why:</strong> Descriptors are the single textual configuration surface shared by code, config files,
 * and the CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expand {@code ${key}} and {@code %key%} placeholders from the client's {@link VariableStore}.</li>
 *   <li>Interpret booleans, timespans, sizes, and level names.</li>
 *   <li>Ignore unknown keys with a warning; reject malformed values.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable apart from the shared variable store; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionStringParser {
  private static final Logger log = LoggerFactory.getLogger(ConnectionStringParser.class);
  private static final Pattern TCP = Pattern.compile("^\\s*tcp\\s*\\((.*)\\)\\s*$", Pattern.CASE_INSENSITIVE);
  private static final long KB = 1024L;

  private final VariableStore variables;

  /**
   * Creates a parser expanding placeholders from {@code variables}.
   *
   * @param variables client-owned variable store
   */
  public ConnectionStringParser(VariableStore variables) {
    this.variables = Objects.requireNonNull(variables, "variables");
  }

  /**
   * Parses a descriptor.
   *
   * @param descriptor connection descriptor such as {@code tcp(host=console,port=4228)}
   * @return parsed settings; omitted keys take their defaults
   * @throws ConfigurationException when the protocol is unsupported, a placeholder is unresolved, or a value is
   *         malformed
   */
  public ConnectionSettings parse(String descriptor) throws ConfigurationException {
    if (descriptor == null || descriptor.isBlank()) {
      throw new ConfigurationException("connection descriptor must not be blank");
    }
    String expanded = variables.expand(descriptor);
    Matcher matcher = TCP.matcher(expanded);
    if (!matcher.matches()) {
      throw new ConfigurationException("Unsupported connection descriptor (expected tcp(...)): " + expanded);
    }
    Builder builder = new Builder();
    String body = matcher.group(1);
    for (String pair : body.split(",")) {
      String trimmed = pair.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int eq = trimmed.indexOf('=');
      if (eq <= 0) {
        throw new ConfigurationException("connection option must be key=value (was '" + trimmed + "')");
      }
      String key = trimmed.substring(0, eq).trim().toLowerCase(Locale.ROOT);
      String value = trimmed.substring(eq + 1).trim();
      apply(builder, key, value);
    }
    try {
      return builder.build();
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("Invalid connection descriptor: " + ex.getMessage(), ex);
    }
  }

  private static void apply(Builder b, String key, String value) throws ConfigurationException {
    switch (key) {
      case "host" -> b.host = value.isEmpty() ? null : value;
      case "port" -> b.port = parseInteger(key, value);
      case "timeout" -> b.timeout = parseTimespan(key, value);
      case "room" -> b.room = value;
      case "reconnect" -> b.reconnect = parseBoolean(value);
      case "reconnect.interval" -> b.reconnectInterval = parseTimespan(key, value);
      case "backlog.enabled" -> b.backlogEnabled = parseBoolean(value);
      case "backlog.queue" -> b.backlogBytes = parseSize(key, value);
      case "backlog.keepopen", "keepopen" -> b.keepOpen = parseBoolean(value);
      case "backlog.flushon", "flushon" -> b.flushOn = parseLevel(key, value);
      case "backlog" -> {
        long size = parseSize(key, value);
        b.backlogEnabled = size > 0;
        if (size > 0) {
          b.backlogBytes = size;
        }
      }
      case "async.enabled" -> b.asyncEnabled = parseBoolean(value);
      case "async.queue" -> b.asyncQueueBytes = parseSize(key, value);
      case "async.throttle" -> b.asyncThrottle = parseBoolean(value);
      case "async.clearondisconnect" -> b.asyncClearOnDisconnect = parseBoolean(value);
      default -> log.warn("Ignoring unknown connection option '{}'", Logs.truncate(key, 64));
    }
  }

  /**
   * Interprets {@code true}, {@code 1}, and {@code yes} (any case) as true; everything else is false.
   *
   * @param value raw value
   * @return parsed flag
   */
  static boolean parseBoolean(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    return normalized.equals("true") || normalized.equals("1") || normalized.equals("yes");
  }

  /**
   * Parses a timespan: a bare integer is milliseconds; {@code ms}, {@code s}, and {@code m} suffixes are accepted.
   */
  static Duration parseTimespan(String key, String value) throws ConfigurationException {
    String text = value.trim().toLowerCase(Locale.ROOT);
    try {
      if (text.endsWith("ms")) {
        return Duration.ofMillis(Math.round(Double.parseDouble(text.substring(0, text.length() - 2).trim())));
      }
      if (text.endsWith("s")) {
        return Duration.ofMillis(Math.round(Double.parseDouble(text.substring(0, text.length() - 1).trim()) * 1_000d));
      }
      if (text.endsWith("m")) {
        return Duration.ofMillis(Math.round(Double.parseDouble(text.substring(0, text.length() - 1).trim()) * 60_000d));
      }
      return Duration.ofMillis(Long.parseLong(text));
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(key + " must be a timespan such as 3000, 500ms, or 3s (was '" + value + "')", ex);
    }
  }

  /**
   * Parses a size in bytes: a bare number is kilobytes; {@code kb}, {@code mb}, and {@code gb} suffixes are accepted.
   */
  static long parseSize(String key, String value) throws ConfigurationException {
    String text = value.trim().toLowerCase(Locale.ROOT);
    long multiplier = KB;
    if (text.endsWith("kb")) {
      text = text.substring(0, text.length() - 2);
    } else if (text.endsWith("mb")) {
      multiplier = KB * KB;
      text = text.substring(0, text.length() - 2);
    } else if (text.endsWith("gb")) {
      multiplier = KB * KB * KB;
      text = text.substring(0, text.length() - 2);
    }
    try {
      double amount = Double.parseDouble(text.trim());
      if (amount < 0 || Double.isNaN(amount) || Double.isInfinite(amount)) {
        throw new ConfigurationException(key + " must not be negative (was '" + value + "')");
      }
      return (long) (amount * multiplier);
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(key + " must be a size such as 2048, 512kb, or 4mb (was '" + value + "')", ex);
    }
  }

  static Level parseLevel(String key, String value) throws ConfigurationException {
    Level level = Level.parse(value, null);
    if (level == null || level == Level.CONTROL) {
      throw new ConfigurationException(key + " must be one of debug, verbose, message, warning, error, fatal (was '"
          + value + "')");
    }
    return level;
  }

  private static int parseInteger(String key, String value) throws ConfigurationException {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(key + " must be an integer (was '" + value + "')", ex);
    }
  }

  private static final class Builder {
    private final ConnectionSettings defaults = ConnectionSettings.defaults();
    private String host = defaults.host();
    private int port = defaults.port();
    private Duration timeout = defaults.timeout();
    private String room = defaults.room();
    private boolean reconnect = defaults.reconnect();
    private Duration reconnectInterval = defaults.reconnectInterval();
    private boolean backlogEnabled = defaults.backlogEnabled();
    private long backlogBytes = defaults.backlogBytes();
    private Level flushOn = defaults.flushOn();
    private boolean keepOpen = defaults.keepOpen();
    private boolean asyncEnabled = defaults.asyncEnabled();
    private long asyncQueueBytes = defaults.asyncQueueBytes();
    private boolean asyncThrottle = defaults.asyncThrottle();
    private boolean asyncClearOnDisconnect = defaults.asyncClearOnDisconnect();

    private ConnectionSettings build() {
      return new ConnectionSettings(
          host, port, timeout, room, reconnect, reconnectInterval, backlogEnabled, backlogBytes, flushOn,
          keepOpen, asyncEnabled, asyncQueueBytes, asyncThrottle, asyncClearOnDisconnect);
    }
  }
}
