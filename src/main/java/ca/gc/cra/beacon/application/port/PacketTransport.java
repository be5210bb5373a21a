package ca.gc.cra.beacon.application.port;

import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import java.util.List;

/**
 * <strong>What:</strong> Open connection to the logging console.
 * <p><strong>Why:</strong> Isolates socket handling from reconnect and backlog policy.</p>
 * <p><strong>Role:</strong> Port implemented by {@code TcpPacketTransport}; produced by {@link TransportFactory}.</p>
 * <p><strong>Thread-safety:</strong> {@link #send(List)} is called by one thread at a time; {@link #close()} may be
 * called concurrently with a send to abort it.</p>
 *
 * @since 0.1.0
 */
public interface PacketTransport extends AutoCloseable {
  /**
   * Writes frames in order and waits for the console's acknowledgement.
   *
   * @param burst frames to write, oldest first
   * @throws ConnectionException when the write or acknowledgement fails; the transport is unusable afterwards
   */
  void send(List<EncodedPacket> burst) throws ConnectionException;

  /** Closes the connection; idempotent and never throws. */
  @Override
  void close();
}
