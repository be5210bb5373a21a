package ca.gc.cra.beacon.application.port;

/**
 * <strong>What:</strong> Caller-supplied observer of connection lifecycle and asynchronous failures.
 * <p><strong>Why:</strong> Send and connect failures are absorbed by the pipeline; this is the only channel through
 * which they become visible to the application.</p>
 * <p><strong>Thread-safety:</strong> Callbacks run on the sender thread in asynchronous mode and on the
 * {@code beacon-notifier} thread in synchronous mode, never on a logging caller's thread. Implementations must not
 * block for long and must not call back into the client's shutdown.</p>
 *
 * @since 0.1.0
 */
public interface ConnectionListener {
  /**
   * Invoked after a connection is established.
   *
   * @param reconnect {@code true} when an earlier connection existed
   */
  void onConnect(boolean reconnect);

  /** Invoked after an established connection was lost. */
  void onDisconnect();

  /**
   * Invoked for connection, send, buffering, and encoding failures.
   *
   * @param error failure description
   */
  void onError(Exception error);

  /** Listener that ignores every callback. */
  ConnectionListener NO_OP = new ConnectionListener() {
    @Override public void onConnect(boolean reconnect) {}

    @Override public void onDisconnect() {}

    @Override public void onError(Exception error) {}
  };
}
