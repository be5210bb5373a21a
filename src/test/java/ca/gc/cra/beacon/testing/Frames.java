package ca.gc.cra.beacon.testing;

import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import ca.gc.cra.beacon.domain.packet.Level;
import ca.gc.cra.beacon.domain.packet.PacketKind;
import java.util.Arrays;
import java.util.List;

/**
 * Builds opaque frames whose bytes all carry a marker, so ordering survives buffering without decoding.
 */
public final class Frames {
  private Frames() {}

  public static EncodedPacket frame(int size, int marker) {
    return frame(size, marker, Level.MESSAGE);
  }

  public static EncodedPacket frame(int size, int marker, Level level) {
    byte[] bytes = new byte[size];
    Arrays.fill(bytes, (byte) marker);
    return new EncodedPacket(bytes, level, PacketKind.LOG_ENTRY);
  }

  public static int marker(EncodedPacket packet) {
    return packet.frame()[0];
  }

  public static List<Integer> markers(List<EncodedPacket> packets) {
    return packets.stream().map(Frames::marker).toList();
  }
}
