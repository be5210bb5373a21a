package ca.gc.cra.beacon.application.port;

/**
 * <strong>What:</strong> Domain port supplying wall-clock time to sessions and the connection manager.
 * <p><strong>Why:</strong> Packet timestamps and reconnect gating both read time; tests inject a controllable
 * clock to exercise the gate deterministically.</p>
 * <p><strong>Role:</strong> Domain port consumed by application services.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; reads happen on caller threads and the
 * sender thread.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.beacon.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current epoch time in microseconds. Adapters with a finer clock override this.
   *
   * @return microseconds since 1970-01-01T00:00:00Z
   */
  default long nowMicros() {
    return nowMillis() * 1_000L;
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
