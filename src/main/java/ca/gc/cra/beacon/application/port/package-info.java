/**
 * Application ports decoupling the dispatch pipeline from sockets, clocks, metrics, and encoding.
 * <p><strong>Role:</strong> Hexagonal boundary; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Each port documents its threading contract.</p>
 * <p><strong>Metrics:</strong> {@link ca.gc.cra.beacon.application.port.MetricsPort} defines the metric names.</p>
 */
package ca.gc.cra.beacon.application.port;
