package ca.gc.cra.beacon.infrastructure.net;

import ca.gc.cra.beacon.application.port.ConnectionException;
import ca.gc.cra.beacon.application.port.PacketTransport;
import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PacketTransport} over one established console socket.
 * <p><strong>Why:</strong> The console acknowledges each frame with a fixed-size answer. Frames are written in
 * windows of at most {@value #WINDOW_BYTES} bytes and the window's answers are read before the next one, so a
 * replayed backlog neither pays one round trip per frame nor lets unread answers back up until both peers
 * block on writes.</p>
 * <p><strong>Role:</strong> Infrastructure adapter created by {@link TcpTransportFactory} after the handshake.</p>
 * <p><strong>Thread-safety:</strong> {@link #send(List)} is called by one thread at a time; {@link #close()} may be
 * called concurrently and makes a blocked send fail promptly.</p>
 *
 * @since 0.1.0
 */
final class TcpPacketTransport implements PacketTransport {
  private static final Logger log = LoggerFactory.getLogger(TcpPacketTransport.class);
  static final int ANSWER_SIZE = 2;
  static final int WINDOW_BYTES = 64 * 1024;

  private final Socket socket;
  private final String endpoint;
  private final OutputStream out;
  private final InputStream in;
  private byte[] answers = new byte[ANSWER_SIZE * 64];
  private volatile boolean closed;

  TcpPacketTransport(Socket socket, String endpoint) throws IOException {
    this.socket = Objects.requireNonNull(socket, "socket");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.out = new BufferedOutputStream(socket.getOutputStream(), WINDOW_BYTES);
    this.in = socket.getInputStream();
  }

  @Override
  public void send(List<EncodedPacket> burst) throws ConnectionException {
    if (closed) {
      throw new ConnectionException("Connection to " + endpoint + " is closed");
    }
    try {
      int pendingFrames = 0;
      long pendingBytes = 0;
      for (EncodedPacket packet : burst) {
        if (pendingFrames > 0 && pendingBytes + packet.size() > WINDOW_BYTES) {
          out.flush();
          readAnswers(pendingFrames);
          pendingFrames = 0;
          pendingBytes = 0;
        }
        packet.writeTo(out);
        pendingFrames++;
        pendingBytes += packet.size();
      }
      out.flush();
      readAnswers(pendingFrames);
    } catch (IOException ex) {
      close();
      throw new ConnectionException("Send to " + endpoint + " failed: " + ex.getMessage(), ex);
    }
  }

  private void readAnswers(int frames) throws IOException {
    int expected = frames * ANSWER_SIZE;
    if (answers.length < expected) {
      answers = new byte[expected];
    }
    int read = 0;
    while (read < expected) {
      int n = in.read(answers, read, expected - read);
      if (n < 0) {
        throw new IOException("console closed the connection before acknowledging");
      }
      read += n;
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Error closing connection to {}", endpoint, ex);
    }
  }

  @Override
  public String toString() {
    return "TcpPacketTransport{" + endpoint + (closed ? ", closed" : "") + '}';
  }
}
