package ca.gc.cra.beacon.infrastructure.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.beacon.application.port.ProtocolException;
import ca.gc.cra.beacon.domain.packet.Color;
import ca.gc.cra.beacon.domain.packet.ControlCommand;
import ca.gc.cra.beacon.domain.packet.ControlCommandType;
import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import ca.gc.cra.beacon.domain.packet.Level;
import ca.gc.cra.beacon.domain.packet.LogEntry;
import ca.gc.cra.beacon.domain.packet.LogEntryType;
import ca.gc.cra.beacon.domain.packet.LogHeader;
import ca.gc.cra.beacon.domain.packet.Packet;
import ca.gc.cra.beacon.domain.packet.PacketHeader;
import ca.gc.cra.beacon.domain.packet.PacketKind;
import ca.gc.cra.beacon.domain.packet.ProcessFlow;
import ca.gc.cra.beacon.domain.packet.ProcessFlowType;
import ca.gc.cra.beacon.domain.packet.StreamPacket;
import ca.gc.cra.beacon.domain.packet.ViewerId;
import ca.gc.cra.beacon.domain.packet.Watch;
import ca.gc.cra.beacon.domain.packet.WatchType;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PacketCodecTest {
  private static final long TIMESTAMP = 1_700_000_000_123_456L;

  private final PacketCodec codec = new PacketCodec();

  @Test
  void controlCommandHasExactLayout() throws Exception {
    ControlCommand command = new ControlCommand(
        PacketHeader.of(Level.CONTROL, 5L, "S"), ControlCommandType.CLEAR_ALL, null);

    EncodedPacket encoded = codec.encode(command);

    byte[] expected = {
        1, 0,
        37, 0, 0, 0,
        6, 0, 0, 0,
        5, 0, 0, 0, 0, 0, 0, 0,
        1, 0, 0, 0, 'S',
        -1, -1, -1, -1,
        -1, -1, -1, -1,
        -1, -1, -1, -1,
        3, 0, 0, 0,
        -1, -1, -1, -1};
    assertArrayEquals(expected, encoded.frame());
    assertEquals(Level.CONTROL, encoded.level());
    assertEquals(PacketKind.CONTROL_COMMAND, encoded.kind());
  }

  @Test
  void logEntrySurvivesDecode() throws Exception {
    Map<String, String> context = new LinkedHashMap<>();
    context.put("tenant", "acme");
    context.put("note", "quote \" and é");
    PacketHeader header = new PacketHeader(Level.WARNING, TIMESTAMP, "Orders", context, "abc", "checkout");
    LogEntry entry = new LogEntry(header, LogEntryType.TEXT, ViewerId.DATA, "title ✓", "App", "host", 42, 7,
        Color.of(1, 2, 3), 2, new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'x'});

    EncodedPacket encoded = codec.encode(entry);
    Packet decoded = codec.decode(encoded.frame());

    assertEquals(entry, decoded);
    assertEquals(PacketKind.LOG_ENTRY, encoded.kind());
    assertEquals(encoded.size() - PacketCodec.FRAME_HEADER_BYTES, bodySize(encoded.frame()));
  }

  @Test
  void watchKeepsLabelsAndType() throws Exception {
    Watch watch = new Watch(PacketHeader.of(Level.MESSAGE, TIMESTAMP, "Main"), "queue", "12", WatchType.INTEGER,
        "pipeline", Map.of("instance", "a"));

    assertEquals(watch, codec.decode(codec.encode(watch).frame()));
  }

  @Test
  void remainingKindsDecodeToEqualPackets() throws Exception {
    PacketHeader header = PacketHeader.of(Level.DEBUG, TIMESTAMP, "Main");
    Packet[] packets = {
        new ProcessFlow(header, ProcessFlowType.ENTER_THREAD, "Main Thread", "host", 1, 2),
        new StreamPacket(header, "metrics", "{\"a\":1}", "json", null),
        LogHeader.of(header, "host", "App", "blue"),
        new ControlCommand(PacketHeader.of(Level.CONTROL, TIMESTAMP, "Main"), ControlCommandType.CLEAR_LOG,
            new byte[] {9})};

    for (Packet packet : packets) {
      assertEquals(packet, codec.decode(codec.encode(packet).frame()), packet.kind().name());
    }
  }

  @Test
  void emptyContextIsWrittenAsAbsent() throws Exception {
    Watch watch = new Watch(PacketHeader.of(Level.MESSAGE, 0L, "Main"), "n", null, WatchType.STRING, null, null);

    Watch decoded = (Watch) codec.decode(codec.encode(watch).frame());

    assertEquals(Map.of(), decoded.header().context());
    assertEquals(Map.of(), decoded.labels());
    assertEquals(null, decoded.value());
  }

  @Test
  void nullTagEntriesAreLeftOut() throws Exception {
    Map<String, String> context = new HashMap<>();
    context.put(null, "orphan");
    context.put("tenant", "acme");
    Map<String, String> labels = new HashMap<>();
    labels.put("instance", null);
    labels.put("zone", "east");

    Watch watch = new Watch(new PacketHeader(Level.MESSAGE, TIMESTAMP, "Main", context, null, null), "queue", "3",
        WatchType.INTEGER, null, labels);
    Watch expected = new Watch(new PacketHeader(Level.MESSAGE, TIMESTAMP, "Main", Map.of("tenant", "acme"), null,
        null), "queue", "3", WatchType.INTEGER, null, Map.of("zone", "east"));

    assertEquals(expected, watch);
    assertEquals(expected, codec.decode(codec.encode(watch).frame()));
  }

  @Test
  void mapWriterRejectsNullEntries() {
    Map<String, String> map = new HashMap<>();
    map.put("k", null);

    assertThrows(ProtocolException.class, () -> new StringMapJson().write(map));
  }

  @Test
  void truncatedFrameIsRejected() throws Exception {
    byte[] frame = codec.encode(sampleWatch()).frame();

    assertThrows(ProtocolException.class, () -> codec.decode(Arrays.copyOf(frame, frame.length - 3)));
    assertThrows(ProtocolException.class, () -> codec.decode(new byte[] {4, 0, 1}));
  }

  @Test
  void bodySizeMismatchIsRejected() throws Exception {
    byte[] frame = codec.encode(sampleWatch()).frame();
    frame[2] = (byte) (frame[2] + 1);

    assertThrows(ProtocolException.class, () -> codec.decode(frame));
  }

  @Test
  void unknownKindIsRejected() throws Exception {
    byte[] frame = codec.encode(sampleWatch()).frame();
    frame[0] = 99;

    assertThrows(ProtocolException.class, () -> codec.decode(frame));
  }

  @Test
  void malformedContextJsonIsRejected() throws Exception {
    Watch watch = new Watch(new PacketHeader(Level.MESSAGE, 0L, "Main", Map.of("k", "v"), null, null), "n", "v",
        WatchType.STRING, null, null);
    byte[] frame = codec.encode(watch).frame();
    int jsonStart = indexOf(frame, (byte) '{');
    frame[jsonStart] = '[';

    assertThrows(ProtocolException.class, () -> codec.decode(frame));
  }

  private static Watch sampleWatch() {
    return new Watch(PacketHeader.of(Level.MESSAGE, TIMESTAMP, "Main"), "n", "v", WatchType.STRING, null, null);
  }

  private static int bodySize(byte[] frame) {
    return (frame[2] & 0xFF) | (frame[3] & 0xFF) << 8 | (frame[4] & 0xFF) << 16 | (frame[5] & 0xFF) << 24;
  }

  private static int indexOf(byte[] data, byte value) {
    for (int i = 0; i < data.length; i++) {
      if (data[i] == value) {
        return i;
      }
    }
    throw new AssertionError("byte not found");
  }
}
