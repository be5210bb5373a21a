package ca.gc.cra.beacon.client;

import ca.gc.cra.beacon.application.pipeline.ConnectionManager;
import ca.gc.cra.beacon.application.pipeline.NotificationRelay;
import ca.gc.cra.beacon.application.pipeline.PacketSender;
import ca.gc.cra.beacon.application.pipeline.QueueStats;
import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.ProtocolException;
import ca.gc.cra.beacon.application.session.Session;
import ca.gc.cra.beacon.application.session.SessionHost;
import ca.gc.cra.beacon.application.session.SessionRegistry;
import ca.gc.cra.beacon.config.ClientConfig;
import ca.gc.cra.beacon.config.ClientConfigLoader;
import ca.gc.cra.beacon.config.ConfigurationException;
import ca.gc.cra.beacon.config.ConnectionSettings;
import ca.gc.cra.beacon.config.ConnectionStringParser;
import ca.gc.cra.beacon.config.VariableStore;
import ca.gc.cra.beacon.domain.context.ContextPropagator;
import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import ca.gc.cra.beacon.domain.packet.Level;
import ca.gc.cra.beacon.domain.packet.LogHeader;
import ca.gc.cra.beacon.domain.packet.Packet;
import ca.gc.cra.beacon.domain.packet.PacketHeader;
import ca.gc.cra.beacon.infrastructure.codec.PacketCodec;
import ca.gc.cra.beacon.validation.Strings;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Instance facade owning sessions, context, variables, and the delivery pipeline.
 * <p><strong>Why:</strong> Applications configure one object and log through its sessions; no global state is
 * involved, so several clients can coexist in one process.</p>
 * <p><strong>Role:</strong> Composition root wiring codec, relay, connection manager, and sender per connection.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse connection descriptors and (re)build the pipeline.</li>
 *   <li>Encode packets on the caller's thread; an encoding failure drops only that packet.</li>
 *   <li>Apply file-based configuration with the same enable rules as the connection descriptor.</li>
 *   <li>Flush and close on {@link #shutdown()}; the client stays terminal afterwards.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Logging calls are safe from any thread. Lifecycle changes ({@code connect},
 * {@code setEnabled}, {@code shutdown}) are serialized on a private monitor.</p>
 *
 * <pre>{@code
 * try (BeaconClient beacon = new BeaconClient("Assessments")) {
 *   beacon.connect("tcp(host=console.internal,port=4228,backlog.flushon=error)");
 *   beacon.mainSession().logMessage("started");
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class BeaconClient implements SessionHost, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BeaconClient.class);
  /** Application name used when none is configured. */
  public static final String DEFAULT_APP_NAME = "Java App";

  private final ClientOptions options;
  private final String hostName;
  private final int processId;
  private final PacketCodec codec = new PacketCodec();
  private final ContextPropagator context = new ContextPropagator();
  private final VariableStore variables = new VariableStore();
  private final SessionRegistry sessions;

  private final Object lifecycle = new Object();
  private volatile String appName;
  private volatile Level level = Level.DEBUG;
  private volatile Level defaultLevel = Level.MESSAGE;
  private volatile boolean enabled;
  private volatile Pipeline pipeline;
  private ConnectionSettings settings;
  private String connections;
  private boolean closed;

  private record Pipeline(NotificationRelay relay, ConnectionManager connection, PacketSender sender) {}

  public BeaconClient(String appName) {
    this(appName, ClientOptions.defaults());
  }

  /**
   * Creates a disabled client; call {@link #connect(String)} to start sending.
   *
   * @param appName application name announced to the console
   * @param options collaborators; {@code null} means {@link ClientOptions#defaults()}
   */
  public BeaconClient(String appName, ClientOptions options) {
    this.appName = appName == null || appName.isBlank() ? DEFAULT_APP_NAME : appName.trim();
    this.options = Objects.requireNonNullElseGet(options, ClientOptions::defaults);
    this.hostName = localHostName();
    this.processId = (int) ProcessHandle.current().pid();
    this.sessions = new SessionRegistry(this);
  }

  /**
   * Creates a client and applies a loaded configuration to it.
   *
   * @param config configuration, typically from {@link ClientConfigLoader}
   * @param options collaborators
   * @return configured client
   * @throws ConfigurationException when the configured connection descriptor is invalid
   */
  public static BeaconClient fromConfig(ClientConfig config, ClientOptions options) throws ConfigurationException {
    Objects.requireNonNull(config, "config");
    BeaconClient client = new BeaconClient(config.appName().orElse(DEFAULT_APP_NAME), options);
    client.applyConfig(config);
    return client;
  }

  /**
   * Parses {@code descriptor}, replaces any existing connection, and enables the client.
   *
   * @param descriptor connection descriptor such as {@code tcp(host=localhost)}
   * @throws ConfigurationException when the descriptor is malformed or references an unknown variable
   */
  public void connect(String descriptor) throws ConfigurationException {
    ConnectionSettings parsed = parse(descriptor);
    synchronized (lifecycle) {
      ensureOpen();
      this.settings = parsed;
      stopPipelineLocked();
      startPipelineLocked();
      enabled = true;
    }
  }

  /**
   * Parses and stores {@code descriptor} without connecting; {@link #setEnabled(boolean)} connects later.
   *
   * @param descriptor connection descriptor
   * @throws ConfigurationException when the descriptor is malformed
   */
  public void configure(String descriptor) throws ConfigurationException {
    ConnectionSettings parsed = parse(descriptor);
    synchronized (lifecycle) {
      ensureOpen();
      this.settings = parsed;
    }
  }

  /**
   * Applies a configuration: names and levels first, then the connection with these rules. When {@code enabled} is
   * absent the connection is only configured; when true it is connected; when false the client is disabled and the
   * connection configured for later.
   *
   * @param config configuration to apply
   * @throws ConfigurationException when the connection descriptor is invalid
   */
  public void applyConfig(ClientConfig config) throws ConfigurationException {
    Objects.requireNonNull(config, "config");
    config.appName().ifPresent(this::setAppName);
    config.level().ifPresent(this::setLevel);
    config.defaultLevel().ifPresent(this::setDefaultLevel);
    Optional<Boolean> enable = config.enabled();
    if (config.connections().isPresent()) {
      String descriptor = config.connections().get();
      if (enable.isEmpty()) {
        configure(descriptor);
      } else if (enable.get()) {
        connect(descriptor);
      } else {
        setEnabled(false);
        configure(descriptor);
      }
    } else {
      enable.ifPresent(this::setEnabled);
    }
  }

  /**
   * Loads a YAML or properties file and applies it.
   *
   * @param path configuration file
   * @throws ConfigurationException when the file is unreadable or invalid
   */
  public void loadConfiguration(Path path) throws ConfigurationException {
    applyConfig(ClientConfigLoader.load(path, variables));
  }

  /**
   * Enables or disables emission. Enabling with a configured connection starts the pipeline; disabling stops it,
   * flushing buffered packets unless the options disable that.
   *
   * @param enabled new state
   */
  public void setEnabled(boolean enabled) {
    synchronized (lifecycle) {
      if (closed || enabled == this.enabled) {
        return;
      }
      if (enabled) {
        if (settings != null && pipeline == null) {
          startPipelineLocked();
        }
        this.enabled = true;
      } else {
        this.enabled = false;
        stopPipelineLocked();
      }
    }
  }

  @Override
  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Encodes and hands a packet to the pipeline. Never throws: while disabled the packet is ignored and an encoding
   * failure is logged, counted, and reported through {@code onError}.
   *
   * @param packet packet to send
   */
  @Override
  public void submit(Packet packet) {
    Pipeline current = pipeline;
    if (!enabled || current == null || packet == null) {
      return;
    }
    EncodedPacket encoded = encode(packet, current);
    if (encoded != null) {
      current.sender().submit(encoded);
    }
  }

  /**
   * Like {@link #submit(Packet)} but never blocks on a full throttled queue.
   *
   * @param packet packet to send
   * @return {@code true} when accepted
   * @throws ca.gc.cra.beacon.application.pipeline.QueueOverflowException when the throttled queue is full
   */
  public boolean trySubmit(Packet packet) {
    Pipeline current = pipeline;
    if (!enabled || current == null || packet == null) {
      return false;
    }
    EncodedPacket encoded = encode(packet, current);
    return encoded != null && current.sender().trySubmit(encoded);
  }

  public Session mainSession() {
    return sessions.main();
  }

  /**
   * Returns the named session, creating it on first reference.
   *
   * @param name session name
   * @return session
   */
  public Session session(String name) {
    return sessions.get(name);
  }

  public boolean deleteSession(String name) {
    return sessions.delete(name);
  }

  public Set<String> sessionNames() {
    return sessions.names();
  }

  public void setVariable(String key, String value) {
    variables.set(key, value);
  }

  public Optional<String> variable(String key) {
    return variables.get(key);
  }

  public void unsetVariable(String key) {
    variables.unset(key);
  }

  @Override
  public Level level() {
    return level;
  }

  public void setLevel(Level level) {
    this.level = Level.requireCallerLevel(level);
  }

  @Override
  public Level defaultLevel() {
    return defaultLevel;
  }

  public void setDefaultLevel(Level defaultLevel) {
    this.defaultLevel = Level.requireCallerLevel(defaultLevel);
  }

  @Override
  public String appName() {
    return appName;
  }

  public void setAppName(String appName) {
    this.appName = Strings.requireNonBlank("appName", appName);
  }

  @Override
  public String hostName() {
    return hostName;
  }

  @Override
  public int processId() {
    return processId;
  }

  @Override
  public ClockPort clock() {
    return options.clock();
  }

  @Override
  public ContextPropagator context() {
    return context;
  }

  /**
   * Returns the descriptor of the current or configured connection after variable expansion.
   *
   * @return descriptor, or empty when none was configured
   */
  public Optional<String> connections() {
    synchronized (lifecycle) {
      return Optional.ofNullable(connections);
    }
  }

  public QueueStats queueStats() {
    Pipeline current = pipeline;
    return current == null ? QueueStats.EMPTY : current.sender().stats();
  }

  public boolean isConnected() {
    Pipeline current = pipeline;
    return current != null && current.sender().isConnected();
  }

  /**
   * Stops the pipeline after a best-effort flush (unless disabled in the options) and makes the client terminal.
   */
  public void shutdown() {
    synchronized (lifecycle) {
      if (closed) {
        return;
      }
      closed = true;
      enabled = false;
      stopPipelineLocked();
    }
    log.debug("Beacon client '{}' shut down", appName);
  }

  @Override
  public void close() {
    shutdown();
  }

  private ConnectionSettings parse(String descriptor) throws ConfigurationException {
    ConnectionSettings parsed = new ConnectionStringParser(variables).parse(descriptor);
    String expanded = variables.expand(descriptor);
    synchronized (lifecycle) {
      this.connections = expanded;
    }
    return parsed;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("client has been shut down");
    }
  }

  private void startPipelineLocked() {
    ConnectionSettings active = settings;
    NotificationRelay relay = new NotificationRelay(options.listener());
    ConnectionManager connection = new ConnectionManager(
        active,
        options.transportFactory(),
        options.hostResolver(),
        options.clock(),
        options.metrics(),
        relay,
        () -> greeting(active, relay));
    PacketSender sender = new PacketSender(active, connection, relay, options.metrics());
    sender.setFlushOnStop(options.flushOnShutdown());
    sender.start();
    pipeline = new Pipeline(relay, connection, sender);
    log.info("Beacon client '{}' sending to {}:{} ({}, backlog {})",
        appName,
        active.host() == null ? "auto" : active.host(),
        active.port(),
        active.asyncEnabled() ? "async" : "sync",
        active.backlogEnabled() ? active.backlogBytes() + " bytes" : "off");
  }

  private void stopPipelineLocked() {
    Pipeline current = pipeline;
    pipeline = null;
    if (current != null) {
      current.sender().close();
    }
  }

  private EncodedPacket greeting(ConnectionSettings active, NotificationRelay relay) {
    PacketHeader header = PacketHeader.of(Level.MESSAGE, options.clock().nowMicros(), SessionRegistry.MAIN);
    try {
      return codec.encode(LogHeader.of(header, hostName, appName, active.room()));
    } catch (ProtocolException ex) {
      options.metrics().increment("codec.error");
      log.error("Unable to encode log header; connecting without it", ex);
      relay.onError(ex);
      return null;
    }
  }

  private EncodedPacket encode(Packet packet, Pipeline current) {
    try {
      return codec.encode(packet);
    } catch (ProtocolException | RuntimeException ex) {
      options.metrics().increment("codec.error");
      options.metrics().increment("sender.dropped");
      log.error("Dropping {} packet from session '{}': {}",
          packet.kind(), packet.header().sessionName(), ex.getMessage());
      current.relay().onError(ex);
      return null;
    }
  }

  private static String localHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Local host name unavailable: {}", ex.getMessage());
      return "localhost";
    }
  }
}
