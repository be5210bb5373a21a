package ca.gc.cra.beacon.infrastructure.time;

import ca.gc.cra.beacon.application.port.ClockPort;
import java.time.Clock;
import java.time.Instant;

/**
 * {@link ClockPort} implementation backed by the system UTC clock with microsecond timestamps.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock = Clock.systemUTC();

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   */
  @Override
  public long nowMillis() {
    return clock.millis();
  }

  /**
   * Returns the current epoch microseconds.
   *
   * @return current epoch microseconds
   * @implNote Precision depends on the platform clock; most JDK 17 platforms resolve microseconds.
   */
  @Override
  public long nowMicros() {
    Instant now = clock.instant();
    return now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000L;
  }
}
