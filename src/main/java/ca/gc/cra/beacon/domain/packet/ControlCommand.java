package ca.gc.cra.beacon.domain.packet;

import java.util.Arrays;
import java.util.Objects;

/**
 * Instruction to the console itself, for example clearing views. Always carries {@link Level#CONTROL}.
 *
 * @param header shared header; level must be {@link Level#CONTROL}
 * @param commandType requested action
 * @param data optional argument bytes; may be {@code null}
 * @since 0.1.0
 */
public record ControlCommand(PacketHeader header, ControlCommandType commandType, byte[] data)
    implements Packet {

  public ControlCommand {
    Objects.requireNonNull(header, "header");
    Objects.requireNonNull(commandType, "commandType");
    if (header.level() != Level.CONTROL) {
      throw new IllegalArgumentException("control commands must use CONTROL level");
    }
    data = data != null ? data.clone() : null;
  }

  @Override
  public PacketKind kind() {
    return PacketKind.CONTROL_COMMAND;
  }

  @Override
  public byte[] data() {
    return data != null ? data.clone() : null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ControlCommand other)) {
      return false;
    }
    return header.equals(other.header)
        && commandType == other.commandType
        && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(header, commandType) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "ControlCommand{commandType=" + commandType
        + ", dataLength=" + (data == null ? -1 : data.length) + '}';
  }
}
