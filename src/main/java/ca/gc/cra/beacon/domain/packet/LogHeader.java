package ca.gc.cra.beacon.domain.packet;

import java.util.Objects;

/**
 * Connection preamble describing the client to the console; sent once per established connection.
 *
 * @param header shared header
 * @param content CRLF separated {@code key=value} lines
 * @since 0.1.0
 */
public record LogHeader(PacketHeader header, String content) implements Packet {

  public LogHeader {
    Objects.requireNonNull(header, "header");
    Objects.requireNonNull(content, "content");
  }

  /**
   * Builds the preamble announcing host, application, and room.
   *
   * @param header shared header
   * @param hostName client host name
   * @param appName client application name
   * @param room console room the client joins
   * @return log header packet
   */
  public static LogHeader of(PacketHeader header, String hostName, String appName, String room) {
    String content = "hostname=" + Objects.requireNonNullElse(hostName, "") + "\r\n"
        + "appname=" + Objects.requireNonNullElse(appName, "") + "\r\n"
        + "room=" + Objects.requireNonNullElse(room, "default") + "\r\n";
    return new LogHeader(header, content);
  }

  @Override
  public PacketKind kind() {
    return PacketKind.LOG_HEADER;
  }
}
