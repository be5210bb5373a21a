/**
 * Executor factories producing named, daemon worker threads with uncaught-exception handlers.
 * <p><strong>Concurrency:</strong> Each client owns its sender and notifier threads.</p>
 */
package ca.gc.cra.beacon.infrastructure.exec;
