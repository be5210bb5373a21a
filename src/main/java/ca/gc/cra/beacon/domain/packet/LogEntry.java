package ca.gc.cra.beacon.domain.packet;

import java.util.Arrays;
import java.util.Objects;

/**
 * Textual or binary log record shown in the console's main view.
 *
 * @param header shared header
 * @param entryType console classification
 * @param viewerId viewer used for {@code data}
 * @param title single line caption
 * @param appName application name of the emitting client
 * @param hostName host name of the emitting process
 * @param processId emitting process id
 * @param threadId emitting thread id
 * @param color background colour
 * @param operationDepth nesting depth of the active operation
 * @param data optional payload rendered by {@code viewerId}; may be {@code null}
 * @since 0.1.0
 */
public record LogEntry(
    PacketHeader header,
    LogEntryType entryType,
    ViewerId viewerId,
    String title,
    String appName,
    String hostName,
    int processId,
    int threadId,
    Color color,
    int operationDepth,
    byte[] data) implements Packet {

  public LogEntry {
    Objects.requireNonNull(header, "header");
    Objects.requireNonNull(entryType, "entryType");
    viewerId = Objects.requireNonNullElse(viewerId, ViewerId.TITLE);
    color = Objects.requireNonNullElse(color, Color.DEFAULT);
    data = data != null ? data.clone() : null;
  }

  @Override
  public PacketKind kind() {
    return PacketKind.LOG_ENTRY;
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
    if (!(o instanceof LogEntry other)) {
      return false;
    }
    return processId == other.processId
        && threadId == other.threadId
        && operationDepth == other.operationDepth
        && header.equals(other.header)
        && entryType == other.entryType
        && viewerId == other.viewerId
        && Objects.equals(title, other.title)
        && Objects.equals(appName, other.appName)
        && Objects.equals(hostName, other.hostName)
        && color.equals(other.color)
        && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(header, entryType, viewerId, title, appName, hostName, color);
    result = 31 * result + processId;
    result = 31 * result + threadId;
    result = 31 * result + operationDepth;
    result = 31 * result + Arrays.hashCode(data);
    return result;
  }

  @Override
  public String toString() {
    return "LogEntry{"
        + "level=" + header.level()
        + ", session=" + header.sessionName()
        + ", entryType=" + entryType
        + ", viewerId=" + viewerId
        + ", title=" + title
        + ", dataLength=" + (data == null ? -1 : data.length)
        + '}';
  }
}
