/**
 * Packet model transmitted to the logging console.
 * <p><strong>Role:</strong> Domain layer values produced by sessions and serialized by the codec.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe across threads.</p>
 * <p><strong>Performance:</strong> Byte payloads are copied once at construction.</p>
 * <p><strong>Security:</strong> Payloads are caller supplied diagnostics; treat as potentially sensitive.</p>
 */
package ca.gc.cra.beacon.domain.packet;
