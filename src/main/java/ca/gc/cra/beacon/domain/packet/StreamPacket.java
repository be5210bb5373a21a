package ca.gc.cra.beacon.domain.packet;

import java.util.Objects;

/**
 * Free-form data appended to a named console channel.
 *
 * @param header shared header
 * @param channel channel name
 * @param data channel payload
 * @param streamType optional content type hint; may be {@code null}
 * @param group optional grouping key; may be {@code null}
 * @since 0.1.0
 */
public record StreamPacket(
    PacketHeader header, String channel, String data, String streamType, String group)
    implements Packet {

  public StreamPacket {
    Objects.requireNonNull(header, "header");
    Objects.requireNonNull(channel, "channel");
  }

  @Override
  public PacketKind kind() {
    return PacketKind.STREAM;
  }
}
