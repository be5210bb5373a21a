package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.ConnectionException;
import ca.gc.cra.beacon.application.port.ConnectionListener;
import ca.gc.cra.beacon.application.port.HostResolver;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.PacketTransport;
import ca.gc.cra.beacon.application.port.TransportFactory;
import ca.gc.cra.beacon.config.ConnectionSettings;
import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns the console connection and its state machine.
 * <p><strong>Why:</strong> Centralizes reconnect time gating so a sustained outage produces at most one attempt
 * per interval no matter how many packets arrive.</p>
 * <p><strong>Role:</strong> Application pipeline component driven by {@link PacketSender}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Move between {@link ConnectionState#DISCONNECTED}, {@link ConnectionState#CONNECTING}, and
 *   {@link ConnectionState#CONNECTED}.</li>
 *   <li>Permit an attempt only when the interval has elapsed since the previous attempt started.</li>
 *   <li>Resolve the host, open the transport, and send the greeting frame.</li>
 *   <li>Turn transport failures into state changes and listener notifications.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> State is guarded by a private monitor held only for field updates; socket
 * I/O happens outside it. {@link #tryConnect()} and {@link #send(List)} are called by one thread at a time (the
 * sender lock holder); {@link #shutdown()} may run concurrently and aborts an in-flight send by closing the
 * transport.</p>
 * <p><strong>Observability:</strong> Counts {@code connection.attempt}, {@code connection.established},
 * {@code connection.failure}, {@code connection.lost}, and {@code sender.sent}; observes
 * {@code sender.batch.size}.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionManager {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final ConnectionSettings settings;
  private final TransportFactory transportFactory;
  private final HostResolver hostResolver;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ConnectionListener listener;
  private final Supplier<EncodedPacket> greeting;
  private final long intervalMillis;

  private final Object stateLock = new Object();
  private ConnectionState state = ConnectionState.DISCONNECTED;
  private PacketTransport transport;
  private boolean attempted;
  private boolean everConnected;
  private boolean closedIntentionally;
  private boolean terminal;
  private long lastAttemptMillis;

  /**
   * Creates a connection manager.
   *
   * @param settings host, port, timeout, and reconnect policy
   * @param transportFactory opens transports
   * @param hostResolver maps the configured host to the dialled address
   * @param clock time source for gating
   * @param metrics metrics sink
   * @param listener receives lifecycle notifications
   * @param greeting frame sent first on every new connection; may return {@code null}
   */
  public ConnectionManager(
      ConnectionSettings settings,
      TransportFactory transportFactory,
      HostResolver hostResolver,
      ClockPort clock,
      MetricsPort metrics,
      ConnectionListener listener,
      Supplier<EncodedPacket> greeting) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
    this.hostResolver = Objects.requireNonNullElse(hostResolver, HostResolver.IDENTITY);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.listener = Objects.requireNonNullElse(listener, ConnectionListener.NO_OP);
    this.greeting = Objects.requireNonNullElse(greeting, () -> null);
    this.intervalMillis = settings.reconnectInterval().toMillis();
  }

  /**
   * Attempts to connect if disconnected and the time gate allows it.
   *
   * @return {@code true} when connected on return
   */
  public boolean tryConnect() {
    synchronized (stateLock) {
      if (state == ConnectionState.CONNECTED) {
        return true;
      }
      if (terminal || state != ConnectionState.DISCONNECTED || !gateOpenLocked(clock.nowMillis())) {
        return false;
      }
      beginAttemptLocked();
    }
    return completeAttempt();
  }

  /**
   * Attempts to connect once, bypassing the time gate. Used for the final flush at shutdown.
   *
   * @return {@code true} when connected on return
   */
  boolean connectForFinalFlush() {
    synchronized (stateLock) {
      if (state == ConnectionState.CONNECTED) {
        return true;
      }
      if (terminal || state != ConnectionState.DISCONNECTED) {
        return false;
      }
      if (attempted && !settings.reconnect() && !closedIntentionally) {
        return false;
      }
      beginAttemptLocked();
    }
    return completeAttempt();
  }

  /**
   * Writes a burst on the current connection.
   *
   * @param burst frames, oldest first
   * @return {@code true} when every frame was written and acknowledged; {@code false} when not connected or the
   *         write failed, in which case the connection is now closed
   */
  public boolean send(List<EncodedPacket> burst) {
    if (burst.isEmpty()) {
      return isConnected();
    }
    PacketTransport current;
    synchronized (stateLock) {
      if (state != ConnectionState.CONNECTED) {
        return false;
      }
      current = transport;
    }
    try {
      current.send(burst);
      metrics.observe("sender.batch.size", burst.size());
      for (int i = 0; i < burst.size(); i++) {
        metrics.increment("sender.sent");
      }
      return true;
    } catch (ConnectionException ex) {
      connectionLost(current, ex);
      return false;
    }
  }

  /**
   * Closes the connection on purpose, for example after a flush when connections are not kept open.
   * No disconnect notification is raised.
   */
  public void disconnect() {
    PacketTransport toClose;
    synchronized (stateLock) {
      toClose = transport;
      transport = null;
      if (state == ConnectionState.CONNECTED) {
        state = ConnectionState.DISCONNECTED;
        closedIntentionally = true;
      }
    }
    if (toClose != null) {
      toClose.close();
    }
  }

  /**
   * Closes the connection and disables every further attempt. Safe to call concurrently with a send.
   */
  public void shutdown() {
    PacketTransport toClose;
    synchronized (stateLock) {
      terminal = true;
      toClose = transport;
      transport = null;
      state = ConnectionState.DISCONNECTED;
    }
    if (toClose != null) {
      toClose.close();
      log.debug("Console connection closed by shutdown");
    }
  }

  public boolean isConnected() {
    synchronized (stateLock) {
      return state == ConnectionState.CONNECTED;
    }
  }

  public ConnectionState state() {
    synchronized (stateLock) {
      return state;
    }
  }

  public boolean isTerminal() {
    synchronized (stateLock) {
      return terminal;
    }
  }

  /**
   * Returns how long until the time gate next permits an attempt.
   *
   * @return milliseconds until an attempt is allowed, {@code 0} if allowed now, or {@link Long#MAX_VALUE} when no
   *         further attempt will ever be allowed
   */
  public long nextAttemptDelayMillis() {
    synchronized (stateLock) {
      if (terminal || !attemptsAllowedLocked()) {
        return Long.MAX_VALUE;
      }
      if (!attempted) {
        return 0;
      }
      long elapsed = clock.nowMillis() - lastAttemptMillis;
      return Math.max(0, intervalMillis - elapsed);
    }
  }

  private boolean gateOpenLocked(long now) {
    if (!attempted) {
      return true;
    }
    if (!attemptsAllowedLocked()) {
      return false;
    }
    return now - lastAttemptMillis >= intervalMillis;
  }

  private boolean attemptsAllowedLocked() {
    return !attempted || settings.reconnect() || closedIntentionally;
  }

  private void beginAttemptLocked() {
    state = ConnectionState.CONNECTING;
    attempted = true;
    closedIntentionally = false;
    lastAttemptMillis = clock.nowMillis();
  }

  private boolean completeAttempt() {
    metrics.increment("connection.attempt");
    PacketTransport opened = null;
    try {
      String host = hostResolver.resolve(settings.host());
      log.debug("Connecting to console at {}:{}", host, settings.port());
      opened = transportFactory.open(host, settings.port(), settings.timeout());
      EncodedPacket hello = greeting.get();
      if (hello != null) {
        opened.send(List.of(hello));
      }
    } catch (ConnectionException | RuntimeException ex) {
      if (opened != null) {
        opened.close();
      }
      synchronized (stateLock) {
        state = ConnectionState.DISCONNECTED;
      }
      metrics.increment("connection.failure");
      log.debug("Console connection attempt failed: {}", ex.getMessage());
      listener.onError(ex instanceof ConnectionException ce
          ? ce
          : new ConnectionException("Connection attempt failed", ex));
      return false;
    }

    boolean reconnect;
    boolean installed;
    synchronized (stateLock) {
      installed = !terminal;
      reconnect = everConnected;
      if (installed) {
        transport = opened;
        state = ConnectionState.CONNECTED;
        everConnected = true;
      } else {
        state = ConnectionState.DISCONNECTED;
      }
    }
    if (!installed) {
      opened.close();
      return false;
    }
    metrics.increment("connection.established");
    log.info("Connected to console at {}:{}{}", settings.host() == null ? "auto" : settings.host(),
        settings.port(), reconnect ? " (reconnect)" : "");
    listener.onConnect(reconnect);
    return true;
  }

  private void connectionLost(PacketTransport failed, ConnectionException cause) {
    boolean notify;
    synchronized (stateLock) {
      notify = !terminal && transport == failed;
      if (transport == failed) {
        transport = null;
        state = ConnectionState.DISCONNECTED;
      }
    }
    failed.close();
    if (!notify) {
      return;
    }
    metrics.increment("connection.lost");
    log.warn("Console connection lost: {}", cause.getMessage());
    listener.onDisconnect();
    listener.onError(cause);
  }
}
