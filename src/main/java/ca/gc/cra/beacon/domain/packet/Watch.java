package ca.gc.cra.beacon.domain.packet;

import java.util.Map;
import java.util.Objects;

/**
 * Named variable value displayed in the console's watch table, optionally grouped and labelled.
 *
 * @param header shared header
 * @param name variable name
 * @param value rendered value
 * @param watchType value type hint
 * @param group optional grouping key; may be {@code null}
 * @param labels metric style labels; never {@code null}, entries with a {@code null} key or value are dropped
 * @since 0.1.0
 */
public record Watch(
    PacketHeader header,
    String name,
    String value,
    WatchType watchType,
    String group,
    Map<String, String> labels) implements Packet {

  public Watch {
    Objects.requireNonNull(header, "header");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(watchType, "watchType");
    labels = PacketHeader.copyTags(labels);
  }

  @Override
  public PacketKind kind() {
    return PacketKind.WATCH;
  }
}
