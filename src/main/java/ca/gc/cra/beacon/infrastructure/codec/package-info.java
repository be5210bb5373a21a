/**
 * Wire codec turning packets into length-prefixed little-endian frames.
 * <p><strong>Role:</strong> Infrastructure adapter behind {@link ca.gc.cra.beacon.application.port.PacketEncoder}.</p>
 * <p><strong>Concurrency:</strong> Codec instances are stateless and thread-safe.</p>
 * <p><strong>Metrics:</strong> Encoding failures are counted by callers under {@code codec.error}.</p>
 */
package ca.gc.cra.beacon.infrastructure.codec;
