package ca.gc.cra.beacon.application.pipeline;

/**
 * Thrown by a non-blocking enqueue against a full throttled queue.
 *
 * @since 0.1.0
 */
public final class QueueOverflowException extends RuntimeException {
  /**
   * Creates an exception describing the rejected frame.
   *
   * @param msg human-readable error
   */
  public QueueOverflowException(String msg) {
    super(msg);
  }
}
