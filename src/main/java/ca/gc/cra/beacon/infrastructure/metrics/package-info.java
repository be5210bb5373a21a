/**
 * Metrics adapter bridging {@link ca.gc.cra.beacon.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for concurrent updates.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code queue.*}, {@code backlog.*}, {@code connection.*}, and
 * {@code sender.*} namespaces.</p>
 * <p><strong>Security:</strong> Exports counts only; packet contents never leave the pipeline through metrics.</p>
 */
package ca.gc.cra.beacon.infrastructure.metrics;
