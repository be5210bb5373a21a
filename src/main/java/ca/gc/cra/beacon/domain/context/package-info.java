/**
 * Scoped diagnostic context and correlation tracking.
 * <p><strong>Role:</strong> Domain services stamping packets with the context active at creation.</p>
 * <p><strong>Concurrency:</strong> State is immutable and per thread; carriers move it across threads.</p>
 * <p><strong>Performance:</strong> Merging happens when a scope opens, not per packet.</p>
 */
package ca.gc.cra.beacon.domain.context;
