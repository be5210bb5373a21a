package ca.gc.cra.beacon.config;

/**
 * Checked exception thrown when a connection descriptor or configuration file is malformed.
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error naming the offending key or value
   */
  public ConfigurationException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause parsing or I/O failure
   */
  public ConfigurationException(String msg, Throwable cause) { super(msg, cause); }
}
