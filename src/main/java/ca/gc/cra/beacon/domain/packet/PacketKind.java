package ca.gc.cra.beacon.domain.packet;

/**
 * Wire type tags written in the first two bytes of every frame.
 *
 * @since 0.1.0
 */
public enum PacketKind {
  CONTROL_COMMAND(1),
  LOG_ENTRY(4),
  WATCH(5),
  PROCESS_FLOW(6),
  LOG_HEADER(7),
  STREAM(8);

  private final int tag;

  PacketKind(int tag) {
    this.tag = tag;
  }

  /**
   * Returns the frame tag.
   *
   * @return tag value
   */
  public int tag() {
    return tag;
  }

  /**
   * Resolves a kind from a frame tag.
   *
   * @param tag frame tag
   * @return matching kind
   * @throws IllegalArgumentException when the tag is unknown
   */
  public static PacketKind fromTag(int tag) {
    for (PacketKind kind : values()) {
      if (kind.tag == tag) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unknown packet tag " + tag);
  }
}
