package ca.gc.cra.beacon.domain.packet;

/**
 * <strong>What:</strong> Unit of transmission produced by sessions and consumed by the codec.
 * <p><strong>Why:</strong> A closed set of kinds lets the codec switch exhaustively and keeps the wire format stable.</p>
 * <p><strong>Role:</strong> Domain value flowing session -> codec -> queue/backlog -> transport.</p>
 * <p><strong>Thread-safety:</strong> All implementations are immutable and safe to hand across threads.</p>
 *
 * @since 0.1.0
 */
public sealed interface Packet
    permits LogEntry, Watch, ProcessFlow, ControlCommand, StreamPacket, LogHeader {

  /**
   * Returns the shared header fields.
   *
   * @return header; never {@code null}
   */
  PacketHeader header();

  /**
   * Returns the wire kind of this packet.
   *
   * @return packet kind
   */
  PacketKind kind();

  /**
   * Convenience accessor for {@code header().level()}.
   *
   * @return packet level
   */
  default Level level() {
    return header().level();
  }
}
