package ca.gc.cra.beacon.application.port;

/**
 * Checked exception thrown when a transport cannot connect, handshake, or write.
 *
 * @since 0.1.0
 */
public final class ConnectionException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public ConnectionException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause, typically an {@link java.io.IOException}
   */
  public ConnectionException(String msg, Throwable cause) { super(msg, cause); }
}
