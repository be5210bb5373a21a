package ca.gc.cra.beacon.domain.packet;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * <strong>What:</strong> Serialized frame ready for transmission, tagged with the metadata buffering needs.
 * <p><strong>Why:</strong> The queue and backlog budget in bytes and decide flushing by level without decoding.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; the frame array is owned by this instance and
 * never exposed for mutation.</p>
 *
 * @since 0.1.0
 */
public final class EncodedPacket {
  private final byte[] frame;
  private final Level level;
  private final PacketKind kind;

  /**
   * Wraps an encoded frame. The array is not copied; callers hand over ownership.
   *
   * @param frame complete frame bytes including the 6 byte frame header
   * @param level packet level
   * @param kind packet kind
   */
  public EncodedPacket(byte[] frame, Level level, PacketKind kind) {
    this.frame = Objects.requireNonNull(frame, "frame");
    this.level = Objects.requireNonNull(level, "level");
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the frame length, which is the budget unit for buffering.
   *
   * @return size in bytes
   */
  public int size() {
    return frame.length;
  }

  public Level level() {
    return level;
  }

  public PacketKind kind() {
    return kind;
  }

  /**
   * Returns a copy of the frame bytes.
   *
   * @return frame copy
   */
  public byte[] frame() {
    return frame.clone();
  }

  /**
   * Copies the frame into {@code target}.
   *
   * @param target destination array
   * @param offset destination offset
   */
  public void copyTo(byte[] target, int offset) {
    System.arraycopy(frame, 0, target, offset, frame.length);
  }

  /**
   * Writes the frame to {@code out} without copying.
   *
   * @param out destination stream
   * @throws IOException when the stream write fails
   */
  public void writeTo(OutputStream out) throws IOException {
    out.write(frame);
  }

  @Override
  public String toString() {
    return "EncodedPacket{kind=" + kind + ", level=" + level + ", size=" + frame.length + '}';
  }
}
