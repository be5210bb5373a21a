package ca.gc.cra.beacon.application.pipeline;

import static ca.gc.cra.beacon.testing.Frames.frame;
import static ca.gc.cra.beacon.testing.Frames.markers;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.port.ConnectionException;
import ca.gc.cra.beacon.application.port.HostResolver;
import ca.gc.cra.beacon.config.ConfigurationException;
import ca.gc.cra.beacon.config.ConnectionSettings;
import ca.gc.cra.beacon.config.ConnectionStringParser;
import ca.gc.cra.beacon.config.VariableStore;
import ca.gc.cra.beacon.testing.ManualClock;
import ca.gc.cra.beacon.testing.RecordingListener;
import ca.gc.cra.beacon.testing.RecordingMetricsPort;
import ca.gc.cra.beacon.testing.RecordingTransportFactory;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConnectionManagerTest {
  private final RecordingTransportFactory factory = new RecordingTransportFactory();
  private final RecordingListener listener = new RecordingListener();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ManualClock clock = new ManualClock(1_000_000L);

  @Test
  void outageProducesOneAttemptPerInterval() throws Exception {
    ConnectionManager manager = manager("tcp(host=console,reconnect.interval=3s)", HostResolver.IDENTITY);
    factory.refuseConnections(true);

    assertFalse(manager.tryConnect());
    for (int i = 0; i < 1_000; i++) {
      assertFalse(manager.tryConnect());
    }
    assertEquals(1, factory.attempts());
    assertEquals(3_000, manager.nextAttemptDelayMillis());

    clock.advance(2_999);
    assertFalse(manager.tryConnect());
    assertEquals(1, factory.attempts());
    assertEquals(1, manager.nextAttemptDelayMillis());

    clock.advance(1);
    assertFalse(manager.tryConnect());
    assertEquals(2, factory.attempts());
    assertEquals(2, metrics.count("connection.failure"));
    assertEquals(List.of("error:ConnectionException", "error:ConnectionException"), listener.events());
  }

  @Test
  void greetingIsTheFirstFrameOnEveryConnection() throws Exception {
    ConnectionManager manager = new ConnectionManager(settings("tcp(host=console)"), factory,
        HostResolver.IDENTITY, clock, metrics, listener, () -> frame(16, 99));

    assertTrue(manager.tryConnect());
    assertTrue(manager.send(List.of(frame(10, 1))));

    assertEquals(List.of(List.of(99), List.of(1)),
        factory.bursts().stream().map(burst -> markers(burst)).toList());
    assertEquals(List.of("connect"), listener.events());
    assertEquals(1, metrics.count("connection.established"));
    assertEquals(1, metrics.count("sender.sent"));
    assertEquals(List.of(1L), metrics.observed("sender.batch.size"));
  }

  @Test
  void sendFailureClosesTransportAndNotifies() throws Exception {
    ConnectionManager manager = manager("tcp(host=console)", HostResolver.IDENTITY);
    assertTrue(manager.tryConnect());
    factory.failSends(true);

    assertFalse(manager.send(List.of(frame(10, 1))));

    assertEquals(ConnectionState.DISCONNECTED, manager.state());
    assertEquals(1, factory.closed());
    assertEquals(List.of("connect", "disconnect", "error:ConnectionException"), listener.events());
    assertEquals(1, metrics.count("connection.lost"));
  }

  @Test
  void reconnectIsReportedAsSuch() throws Exception {
    ConnectionManager manager = manager("tcp(host=console,reconnect.interval=1s)", HostResolver.IDENTITY);
    assertTrue(manager.tryConnect());
    factory.failSends(true);
    manager.send(List.of(frame(10, 1)));
    factory.failSends(false);

    assertFalse(manager.tryConnect(), "still inside the interval");
    clock.advance(1_000);
    assertTrue(manager.tryConnect());

    assertEquals("reconnect", listener.events().get(listener.events().size() - 1));
  }

  @Test
  void reconnectDisabledAllowsOnlyTheFirstAttempt() throws Exception {
    ConnectionManager manager = manager("tcp(host=console,reconnect=false)", HostResolver.IDENTITY);
    factory.refuseConnections(true);

    assertFalse(manager.tryConnect());
    clock.advance(3_600_000);
    factory.refuseConnections(false);

    assertFalse(manager.tryConnect());
    assertFalse(manager.connectForFinalFlush());
    assertEquals(1, factory.attempts());
    assertEquals(Long.MAX_VALUE, manager.nextAttemptDelayMillis());
  }

  @Test
  void intentionalDisconnectStillPermitsReconnectWhenReconnectDisabled() throws Exception {
    ConnectionManager manager = manager("tcp(host=console,reconnect=false,reconnect.interval=3s)",
        HostResolver.IDENTITY);
    assertTrue(manager.tryConnect());

    manager.disconnect();
    assertEquals(List.of("connect"), listener.events(), "intentional close raises no callback");
    assertFalse(manager.tryConnect(), "time gate still applies");

    clock.advance(3_000);
    assertTrue(manager.tryConnect());
    assertEquals(List.of("connect", "reconnect"), listener.events());
  }

  @Test
  void finalFlushConnectBypassesTheTimeGate() throws Exception {
    ConnectionManager manager = manager("tcp(host=console,reconnect.interval=60s)", HostResolver.IDENTITY);
    factory.refuseConnections(true);
    assertFalse(manager.tryConnect());
    factory.refuseConnections(false);

    assertFalse(manager.tryConnect());
    assertTrue(manager.connectForFinalFlush());
    assertTrue(manager.isConnected());
  }

  @Test
  void shutdownIsTerminal() throws Exception {
    ConnectionManager manager = manager("tcp(host=console,reconnect.interval=0)", HostResolver.IDENTITY);
    assertTrue(manager.tryConnect());

    manager.shutdown();

    assertTrue(manager.isTerminal());
    assertFalse(manager.isConnected());
    assertFalse(manager.tryConnect());
    assertFalse(manager.connectForFinalFlush());
    assertFalse(manager.send(List.of(frame(10, 1))));
    assertEquals(1, factory.attempts());
    assertEquals(1, factory.closed());
    assertEquals(Long.MAX_VALUE, manager.nextAttemptDelayMillis());
  }

  @Test
  void dialsTheResolvedHost() throws Exception {
    ConnectionManager manager = manager("tcp(port=4300)", host -> "172.20.0.1");

    assertTrue(manager.tryConnect());

    assertEquals(List.of("172.20.0.1:4300"), factory.dialled());
  }

  @Test
  void resolverFailureCountsAsFailedAttempt() throws Exception {
    ConnectionManager manager = manager("tcp()", host -> {
      throw new IllegalStateException("no route");
    });

    assertFalse(manager.tryConnect());

    assertEquals(ConnectionState.DISCONNECTED, manager.state());
    assertEquals(1, metrics.count("connection.failure"));
    assertInstanceOf(ConnectionException.class, listener.errors().get(0));
  }

  private ConnectionManager manager(String descriptor, HostResolver resolver) throws ConfigurationException {
    return new ConnectionManager(settings(descriptor), factory, resolver, clock, metrics, listener, null);
  }

  static ConnectionSettings settings(String descriptor) throws ConfigurationException {
    return new ConnectionStringParser(new VariableStore()).parse(descriptor);
  }
}
