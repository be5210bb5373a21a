package ca.gc.cra.beacon.infrastructure.net;

import ca.gc.cra.beacon.application.port.ConnectionException;
import ca.gc.cra.beacon.application.port.PacketTransport;
import ca.gc.cra.beacon.application.port.TransportFactory;
import ca.gc.cra.beacon.logging.Logs;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Opens console connections and performs the banner handshake.
 * <p><strong>Handshake:</strong> connect with timeout and {@code TCP_NODELAY}; read the server banner up to the first
 * newline; write the client banner; enable keep-alive. The read timeout stays in force so a console that stops
 * acknowledging cannot stall the sender forever.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class TcpTransportFactory implements TransportFactory {
  private static final Logger log = LoggerFactory.getLogger(TcpTransportFactory.class);
  /** Client library version announced in the banner. */
  public static final String CLIENT_VERSION = "0.1.0";
  /** Banner written after the server banner is received. */
  public static final String CLIENT_BANNER = "BEACON Java Client v" + CLIENT_VERSION + "\n";
  private static final int MAX_BANNER_BYTES = 1024;

  @Override
  public PacketTransport open(String host, int port, Duration timeout) throws ConnectionException {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(timeout, "timeout");
    int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    String endpoint = host + ":" + port;
    Socket socket = new Socket();
    try {
      socket.setTcpNoDelay(true);
      socket.connect(new InetSocketAddress(host, port), timeoutMillis);
      socket.setSoTimeout(timeoutMillis);
      String serverBanner = readBanner(socket.getInputStream());
      socket.getOutputStream().write(CLIENT_BANNER.getBytes(StandardCharsets.US_ASCII));
      socket.getOutputStream().flush();
      socket.setKeepAlive(true);
      log.debug("Handshake with {} complete; server banner '{}'", endpoint, Logs.truncate(serverBanner, 128));
      return new TcpPacketTransport(socket, endpoint);
    } catch (SocketTimeoutException ex) {
      closeQuietly(socket);
      throw new ConnectionException("Timed out connecting to " + endpoint, ex);
    } catch (IOException ex) {
      closeQuietly(socket);
      throw new ConnectionException("Failed to connect to " + endpoint + ": " + ex.getMessage(), ex);
    }
  }

  static String readBanner(InputStream in) throws IOException {
    ByteArrayOutputStream banner = new ByteArrayOutputStream();
    while (true) {
      int b = in.read();
      if (b < 0) {
        throw new IOException("server closed connection during handshake");
      }
      if (b == '\n') {
        break;
      }
      if (banner.size() >= MAX_BANNER_BYTES) {
        throw new IOException("server banner exceeds " + MAX_BANNER_BYTES + " bytes");
      }
      banner.write(b);
    }
    return banner.toString(StandardCharsets.US_ASCII).trim();
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Error closing failed socket", ex);
    }
  }
}
