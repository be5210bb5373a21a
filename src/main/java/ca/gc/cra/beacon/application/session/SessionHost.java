package ca.gc.cra.beacon.application.session;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.domain.context.ContextPropagator;
import ca.gc.cra.beacon.domain.packet.Level;
import ca.gc.cra.beacon.domain.packet.Packet;

/**
 * <strong>What:</strong> The client services a {@link Session} needs to build and hand off packets.
 * <p><strong>Why:</strong> Keeps sessions independent of how the client encodes and delivers packets, so they can
 * be exercised against an in-memory host.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread.</p>
 *
 * @since 0.1.0
 */
public interface SessionHost {
  /**
   * Returns whether the client currently emits anything.
   *
   * @return {@code false} while logging is disabled
   */
  boolean isEnabled();

  /**
   * Returns the client-wide threshold applied on top of each session's level.
   *
   * @return client level
   */
  Level level();

  /**
   * Returns the level used by calls that take none (watches, counters, method tracking, streams).
   *
   * @return default level
   */
  Level defaultLevel();

  String appName();

  String hostName();

  int processId();

  ClockPort clock();

  ContextPropagator context();

  /**
   * Encodes and enqueues a packet. Never throws for delivery or encoding problems.
   *
   * @param packet packet built by a session
   */
  void submit(Packet packet);
}
