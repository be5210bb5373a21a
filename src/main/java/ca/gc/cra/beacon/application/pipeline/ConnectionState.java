package ca.gc.cra.beacon.application.pipeline;

/**
 * States of the console connection. Only {@link ConnectionManager} moves between them.
 *
 * @since 0.1.0
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED
}
