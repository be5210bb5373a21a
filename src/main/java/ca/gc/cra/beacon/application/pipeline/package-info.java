/**
 * Delivery pipeline between logging callers and the console: dispatch queue, backlog, connection state
 * machine, and the sender that coordinates them.
 * <p><strong>Role:</strong> Application layer; depends only on ports and the packet model.</p>
 * <p><strong>Concurrency:</strong> Producers enqueue from any thread; one sender thread (or the send lock in
 * synchronous mode) performs delivery.</p>
 */
package ca.gc.cra.beacon.application.pipeline;
