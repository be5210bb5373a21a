package ca.gc.cra.beacon.application.port;

/**
 * Checked exception thrown when a packet cannot be encoded or a frame cannot be decoded.
 *
 * @since 0.1.0
 */
public final class ProtocolException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public ProtocolException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause from serialization
   */
  public ProtocolException(String msg, Throwable cause) { super(msg, cause); }
}
