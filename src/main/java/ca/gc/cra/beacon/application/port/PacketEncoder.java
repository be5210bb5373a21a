package ca.gc.cra.beacon.application.port;

import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import ca.gc.cra.beacon.domain.packet.Packet;

/**
 * <strong>What:</strong> Port serializing packets into wire frames.
 * <p><strong>Why:</strong> Encoding happens on the caller thread so the queue and backlog can budget in bytes.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use by many caller threads.</p>
 *
 * @since 0.1.0
 */
public interface PacketEncoder {
  /**
   * Encodes a packet into a complete frame.
   *
   * @param packet packet to encode; must not be {@code null}
   * @return encoded frame tagged with the packet's level and kind
   * @throws ProtocolException when the packet cannot be serialized
   */
  EncodedPacket encode(Packet packet) throws ProtocolException;
}
