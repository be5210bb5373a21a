package ca.gc.cra.beacon.domain.packet;

import java.util.Locale;

/**
 * <strong>What:</strong> Ordered severity attached to every packet.
 * <p><strong>Why:</strong> Drives admission filtering, backlog flush triggering, and console colouring.</p>
 * <p><strong>Role:</strong> Domain value shared by sessions, the sender, and the wire codec.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 * <p><strong>Observability:</strong> Wire values are stable; {@link #CONTROL} is reserved for control commands.</p>
 *
 * @since 0.1.0
 */
public enum Level {
  /** Developer diagnostics. */
  DEBUG(0),
  /** Detailed tracing. */
  VERBOSE(1),
  /** Regular informational output. */
  MESSAGE(2),
  /** Recoverable anomalies. */
  WARNING(3),
  /** Failures. */
  ERROR(4),
  /** Unrecoverable failures. */
  FATAL(5),
  /** Reserved for control commands; rejected by caller-facing APIs. */
  CONTROL(6);

  private static final Level[] BY_WIRE = values();

  private final int wireValue;

  Level(int wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * Returns the integer transmitted on the wire.
   *
   * @return stable wire value
   */
  public int wireValue() {
    return wireValue;
  }

  /**
   * Tests whether this level is at least as severe as {@code other}.
   *
   * @param other threshold level; must not be {@code null}
   * @return {@code true} when {@code this >= other}
   */
  public boolean isAtLeast(Level other) {
    return wireValue >= other.wireValue;
  }

  /**
   * Resolves a level from its wire value.
   *
   * @param wireValue encoded value
   * @return matching level
   * @throws IllegalArgumentException when the value is unknown
   */
  public static Level fromWire(int wireValue) {
    if (wireValue < 0 || wireValue >= BY_WIRE.length) {
      throw new IllegalArgumentException("unknown level value " + wireValue);
    }
    return BY_WIRE[wireValue];
  }

  /**
   * Parses a level name case-insensitively.
   *
   * @param raw candidate name; {@code null} or blank yields {@code fallback}
   * @param fallback level returned when {@code raw} is not a known name
   * @return parsed level or {@code fallback}
   */
  public static Level parse(String raw, Level fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Level.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return fallback;
    }
  }

  /**
   * Rejects {@link #CONTROL} for caller-facing APIs.
   *
   * @param level candidate level
   * @return {@code level} when it is a caller level
   * @throws IllegalArgumentException when {@code level} is {@link #CONTROL}
   * @throws NullPointerException when {@code level} is {@code null}
   */
  public static Level requireCallerLevel(Level level) {
    if (level == null) {
      throw new NullPointerException("level");
    }
    if (level == CONTROL) {
      throw new IllegalArgumentException("CONTROL level is reserved for control commands");
    }
    return level;
  }
}
