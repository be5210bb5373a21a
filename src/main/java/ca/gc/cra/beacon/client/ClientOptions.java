package ca.gc.cra.beacon.client;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.ConnectionListener;
import ca.gc.cra.beacon.application.port.HostResolver;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.TransportFactory;
import ca.gc.cra.beacon.infrastructure.net.GatewayHostResolver;
import ca.gc.cra.beacon.infrastructure.net.TcpTransportFactory;
import ca.gc.cra.beacon.infrastructure.time.SystemClockAdapter;
import java.util.Objects;

/**
 * Collaborators and switches for a {@link BeaconClient}. Immutable; the {@code with*} methods return copies.
 *
 * @param listener connection lifecycle and error callbacks
 * @param metrics metrics sink
 * @param clock time source for timestamps and reconnect gating
 * @param transportFactory opens console connections
 * @param hostResolver maps the configured host to the dialled address
 * @param flushOnShutdown whether shutdown attempts to deliver buffered packets
 * @since 0.1.0
 */
public record ClientOptions(
    ConnectionListener listener,
    MetricsPort metrics,
    ClockPort clock,
    TransportFactory transportFactory,
    HostResolver hostResolver,
    boolean flushOnShutdown) {

  public ClientOptions {
    listener = Objects.requireNonNullElse(listener, ConnectionListener.NO_OP);
    metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    clock = Objects.requireNonNullElseGet(clock, SystemClockAdapter::new);
    transportFactory = Objects.requireNonNullElseGet(transportFactory, TcpTransportFactory::new);
    hostResolver = Objects.requireNonNullElseGet(hostResolver, GatewayHostResolver::new);
  }

  /**
   * Returns production defaults: TCP transport, WSL-aware host resolution, system clock, no metrics.
   *
   * @return default options
   */
  public static ClientOptions defaults() {
    return new ClientOptions(null, null, null, null, null, true);
  }

  public ClientOptions withListener(ConnectionListener listener) {
    return new ClientOptions(listener, metrics, clock, transportFactory, hostResolver, flushOnShutdown);
  }

  public ClientOptions withMetrics(MetricsPort metrics) {
    return new ClientOptions(listener, metrics, clock, transportFactory, hostResolver, flushOnShutdown);
  }

  public ClientOptions withClock(ClockPort clock) {
    return new ClientOptions(listener, metrics, clock, transportFactory, hostResolver, flushOnShutdown);
  }

  public ClientOptions withTransportFactory(TransportFactory transportFactory) {
    return new ClientOptions(listener, metrics, clock, transportFactory, hostResolver, flushOnShutdown);
  }

  public ClientOptions withHostResolver(HostResolver hostResolver) {
    return new ClientOptions(listener, metrics, clock, transportFactory, hostResolver, flushOnShutdown);
  }

  public ClientOptions withFlushOnShutdown(boolean flushOnShutdown) {
    return new ClientOptions(listener, metrics, clock, transportFactory, hostResolver, flushOnShutdown);
  }
}
