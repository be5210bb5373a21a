package ca.gc.cra.beacon.infrastructure.codec;

import ca.gc.cra.beacon.application.port.PacketEncoder;
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
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Binary codec for the console wire protocol.
 * <p><strong>Why:</strong> Packets are serialized once on the caller thread; the resulting frame size is the
 * budget unit for the dispatch queue and the backlog.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link PacketEncoder}; {@link #decode(byte[])}
 * serves diagnostics and tests.</p>
 * <p><strong>Frame layout:</strong> {@code int16 kind, int32 bodySize, body}. The body starts with the common
 * block {@code int32 level, int64 timestampMicros, sessionName, correlationId, operationId, context} followed by
 * the kind specific block. Strings and byte blocks are an {@code int32} length plus raw bytes, with {@code -1}
 * meaning absent; maps are JSON objects in a byte block. All integers are little-endian.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from a thread-safe {@code JsonFactory}; safe for concurrent
 * use.</p>
 * <p><strong>Performance:</strong> One growable buffer per call, sized for typical log entries.</p>
 *
 * @since 0.1.0
 */
public final class PacketCodec implements PacketEncoder {
  /** Bytes preceding the body: kind tag and body size. */
  public static final int FRAME_HEADER_BYTES = 6;
  private static final int INITIAL_FRAME_CAPACITY = 256;

  private final StringMapJson json = new StringMapJson();

  @Override
  public EncodedPacket encode(Packet packet) throws ProtocolException {
    Objects.requireNonNull(packet, "packet");
    FrameBuffer buffer = new FrameBuffer(INITIAL_FRAME_CAPACITY);
    buffer.writeShort(packet.kind().tag());
    int sizeOffset = buffer.position();
    buffer.writeInt(0);
    try {
      writeHeader(buffer, packet.header());
      switch (packet.kind()) {
        case LOG_ENTRY -> writeLogEntry(buffer, (LogEntry) packet);
        case WATCH -> writeWatch(buffer, (Watch) packet);
        case PROCESS_FLOW -> writeProcessFlow(buffer, (ProcessFlow) packet);
        case CONTROL_COMMAND -> writeControlCommand(buffer, (ControlCommand) packet);
        case STREAM -> writeStream(buffer, (StreamPacket) packet);
        case LOG_HEADER -> buffer.writeString(((LogHeader) packet).content());
        default -> throw new ProtocolException("Unsupported packet kind " + packet.kind());
      }
    } catch (IllegalStateException ex) {
      throw new ProtocolException("Packet too large to encode", ex);
    }
    buffer.putInt(sizeOffset, buffer.position() - FRAME_HEADER_BYTES);
    return new EncodedPacket(buffer.toByteArray(), packet.level(), packet.kind());
  }

  /**
   * Decodes a single complete frame.
   *
   * @param frame frame bytes as produced by {@link #encode(Packet)}
   * @return decoded packet
   * @throws ProtocolException when the frame is truncated, malformed, or of an unknown kind
   */
  public Packet decode(byte[] frame) throws ProtocolException {
    Objects.requireNonNull(frame, "frame");
    FrameReader header = new FrameReader(frame, 0, frame.length);
    int tag = header.readShort();
    int bodySize = header.readInt();
    if (bodySize < 0 || bodySize != frame.length - FRAME_HEADER_BYTES) {
      throw new ProtocolException(
          "body size " + bodySize + " does not match frame length " + frame.length);
    }
    FrameReader reader = new FrameReader(frame, FRAME_HEADER_BYTES, frame.length);
    try {
      PacketKind kind = PacketKind.fromTag(tag);
      PacketHeader packetHeader = readHeader(reader);
      Packet packet = switch (kind) {
        case LOG_ENTRY -> readLogEntry(reader, packetHeader);
        case WATCH -> readWatch(reader, packetHeader);
        case PROCESS_FLOW -> readProcessFlow(reader, packetHeader);
        case CONTROL_COMMAND -> new ControlCommand(
            packetHeader, ControlCommandType.fromWire(reader.readInt()), reader.readBytes());
        case STREAM -> new StreamPacket(
            packetHeader, reader.readString(), reader.readString(), reader.readString(), reader.readString());
        case LOG_HEADER -> new LogHeader(packetHeader, reader.readString());
      };
      if (reader.remaining() != 0) {
        throw new ProtocolException(reader.remaining() + " trailing bytes after " + kind + " body");
      }
      return packet;
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new ProtocolException("Malformed frame: " + ex.getMessage(), ex);
    }
  }

  private void writeHeader(FrameBuffer buffer, PacketHeader header) throws ProtocolException {
    buffer.writeInt(header.level().wireValue());
    buffer.writeLong(header.timestampMicros());
    buffer.writeString(header.sessionName());
    buffer.writeString(header.correlationId());
    buffer.writeString(header.operationId());
    buffer.writeBytes(json.write(header.context()));
  }

  private PacketHeader readHeader(FrameReader reader) throws ProtocolException {
    Level level = Level.fromWire(reader.readInt());
    long timestamp = reader.readLong();
    String session = reader.readString();
    String correlationId = reader.readString();
    String operationId = reader.readString();
    Map<String, String> context = json.read(reader.readBytes());
    return new PacketHeader(level, timestamp, session, context, correlationId, operationId);
  }

  private static void writeLogEntry(FrameBuffer buffer, LogEntry entry) {
    buffer.writeInt(entry.entryType().wireValue());
    buffer.writeInt(entry.viewerId().wireValue());
    buffer.writeInt(entry.processId());
    buffer.writeInt(entry.threadId());
    buffer.writeInt(entry.color().toWire());
    buffer.writeInt(entry.operationDepth());
    buffer.writeString(entry.appName());
    buffer.writeString(entry.hostName());
    buffer.writeString(entry.title());
    buffer.writeBytes(entry.data());
  }

  private static LogEntry readLogEntry(FrameReader reader, PacketHeader header) throws ProtocolException {
    LogEntryType type = LogEntryType.fromWire(reader.readInt());
    ViewerId viewer = ViewerId.fromWire(reader.readInt());
    int processId = reader.readInt();
    int threadId = reader.readInt();
    Color color = Color.fromWire(reader.readInt());
    int depth = reader.readInt();
    String appName = reader.readString();
    String hostName = reader.readString();
    String title = reader.readString();
    byte[] data = reader.readBytes();
    return new LogEntry(header, type, viewer, title, appName, hostName, processId, threadId, color, depth, data);
  }

  private void writeWatch(FrameBuffer buffer, Watch watch) throws ProtocolException {
    buffer.writeInt(watch.watchType().wireValue());
    buffer.writeString(watch.name());
    buffer.writeString(watch.value());
    buffer.writeString(watch.group());
    buffer.writeBytes(json.write(watch.labels()));
  }

  private Watch readWatch(FrameReader reader, PacketHeader header) throws ProtocolException {
    WatchType type = WatchType.fromWire(reader.readInt());
    String name = reader.readString();
    String value = reader.readString();
    String group = reader.readString();
    Map<String, String> labels = json.read(reader.readBytes());
    return new Watch(header, name, value, type, group, labels);
  }

  private static void writeProcessFlow(FrameBuffer buffer, ProcessFlow flow) {
    buffer.writeInt(flow.flowType().wireValue());
    buffer.writeInt(flow.processId());
    buffer.writeInt(flow.threadId());
    buffer.writeString(flow.title());
    buffer.writeString(flow.hostName());
  }

  private static ProcessFlow readProcessFlow(FrameReader reader, PacketHeader header)
      throws ProtocolException {
    ProcessFlowType type = ProcessFlowType.fromWire(reader.readInt());
    int processId = reader.readInt();
    int threadId = reader.readInt();
    String title = reader.readString();
    String hostName = reader.readString();
    return new ProcessFlow(header, type, title, hostName, processId, threadId);
  }

  private static void writeControlCommand(FrameBuffer buffer, ControlCommand command) {
    buffer.writeInt(command.commandType().wireValue());
    buffer.writeBytes(command.data());
  }

  private static void writeStream(FrameBuffer buffer, StreamPacket stream) {
    buffer.writeString(stream.channel());
    buffer.writeString(stream.data());
    buffer.writeString(stream.streamType());
    buffer.writeString(stream.group());
  }
}
