package ca.gc.cra.beacon.application.port;

import java.time.Duration;

/**
 * Opens {@link PacketTransport}s; one call per connection attempt.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TransportFactory {
  /**
   * Connects to the console and completes any handshake.
   *
   * @param host resolved host name or address
   * @param port TCP port
   * @param timeout connect and read timeout
   * @return open transport
   * @throws ConnectionException when the connection or handshake fails
   */
  PacketTransport open(String host, int port, Duration timeout) throws ConnectionException;
}
