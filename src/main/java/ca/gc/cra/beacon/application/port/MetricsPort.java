package ca.gc.cra.beacon.application.port;

/**
 * <strong>What:</strong> Domain port abstracting BEACON metrics emission.
 * <p><strong>Why:</strong> Lets the dispatch pipeline count evictions, reconnects, and sends without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like queue evictions or failed connection attempts.</li>
 *   <li>Record numeric observations for burst sizes or resident queue bytes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from caller threads and the
 * sender thread.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1); they run on logging hot paths.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code queue.evicted}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code connection.failure}); must not be {@code null}
   *
   * <p><strong>Concurrency:</strong> Safe to call from any thread.</p>
   * <p><strong>Performance:</strong> Expected O(1); adapters may buffer increments.</p>
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., bytes, packets); semantics defined by the caller
   *
   * <p><strong>Concurrency:</strong> Safe for concurrent invocation.</p>
   * <p><strong>Performance:</strong> Expected O(1); avoid blocking operations.</p>
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   *
   * <p><strong>Observability:</strong> Drops all metrics; default when no adapter is configured.</p>
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
