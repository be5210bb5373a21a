package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.domain.packet.Level;
import ca.gc.cra.beacon.validation.Numbers;
import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable connection and buffering settings parsed from a connection descriptor.
 * <p><strong>Why:</strong> Gives the sender, backlog, queue, and connection manager one validated source of policy.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param host console host; {@code null} means auto-detect (loopback or gateway)
 * @param port console TCP port
 * @param timeout connect and read timeout
 * @param room console room announced in the log header
 * @param reconnect whether lost or failed connections are retried
 * @param reconnectInterval minimum time between the starts of two connection attempts
 * @param backlogEnabled whether packets are buffered while disconnected
 * @param backlogBytes backlog capacity in bytes
 * @param flushOn level at or above which the backlog is flushed
 * @param keepOpen whether the connection stays open between flushes
 * @param asyncEnabled whether a background sender thread is used
 * @param asyncQueueBytes dispatch queue capacity in bytes
 * @param asyncThrottle whether producers block instead of evicting when the queue is full
 * @param asyncClearOnDisconnect whether the queue is discarded when the connection drops
 * @since 0.1.0
 */
public record ConnectionSettings(
    String host,
    int port,
    Duration timeout,
    String room,
    boolean reconnect,
    Duration reconnectInterval,
    boolean backlogEnabled,
    long backlogBytes,
    Level flushOn,
    boolean keepOpen,
    boolean asyncEnabled,
    long asyncQueueBytes,
    boolean asyncThrottle,
    boolean asyncClearOnDisconnect) {

  /** Default console port. */
  public static final int DEFAULT_PORT = 4228;
  /** Default backlog and queue capacity (2048 KB). */
  public static final long DEFAULT_BUFFER_BYTES = 2048L * 1024L;
  private static final long MAX_BUFFER_BYTES = Integer.MAX_VALUE;

  public ConnectionSettings {
    Numbers.requireRange("port", port, 1, 65_535);
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(reconnectInterval, "reconnectInterval");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative");
    }
    if (reconnectInterval.isNegative()) {
      throw new IllegalArgumentException("reconnectInterval must not be negative");
    }
    room = room == null || room.isBlank() ? "default" : room;
    Numbers.requireRange("backlogBytes", backlogBytes, 0, MAX_BUFFER_BYTES);
    Numbers.requireRange("asyncQueueBytes", asyncQueueBytes, 1, MAX_BUFFER_BYTES);
    if (backlogEnabled && backlogBytes == 0) {
      backlogEnabled = false;
    }
    flushOn = Objects.requireNonNullElse(flushOn, Level.ERROR);
  }

  /**
   * Returns settings matching a descriptor with no keys.
   *
   * @return default settings
   */
  public static ConnectionSettings defaults() {
    return new ConnectionSettings(
        null,
        DEFAULT_PORT,
        Duration.ofSeconds(30),
        "default",
        true,
        Duration.ofSeconds(3),
        true,
        DEFAULT_BUFFER_BYTES,
        Level.ERROR,
        true,
        true,
        DEFAULT_BUFFER_BYTES,
        false,
        false);
  }
}
