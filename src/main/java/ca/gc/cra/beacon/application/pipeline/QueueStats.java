package ca.gc.cra.beacon.application.pipeline;

/**
 * Point-in-time view of the buffered packets. The two halves are read separately and are not a single atomic
 * snapshot.
 *
 * @param backlogCount frames held in the backlog
 * @param backlogBytes bytes held in the backlog
 * @param asyncCount frames waiting in the dispatch queue
 * @param asyncBytes bytes waiting in the dispatch queue
 * @since 0.1.0
 */
public record QueueStats(int backlogCount, long backlogBytes, int asyncCount, long asyncBytes) {
  /** Stats for a client with nothing buffered. */
  public static final QueueStats EMPTY = new QueueStats(0, 0, 0, 0);
}
