package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.application.port.ConnectionListener;
import ca.gc.cra.beacon.application.session.Session;
import ca.gc.cra.beacon.application.session.SessionRegistry;
import ca.gc.cra.beacon.client.BeaconClient;
import ca.gc.cra.beacon.client.ClientOptions;
import ca.gc.cra.beacon.config.ClientConfig;
import ca.gc.cra.beacon.config.ClientConfigLoader;
import ca.gc.cra.beacon.config.ConfigurationException;
import ca.gc.cra.beacon.config.VariableStore;
import ca.gc.cra.beacon.domain.packet.Level;
import ca.gc.cra.beacon.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.beacon.logging.LoggingConfigurator;
import ca.gc.cra.beacon.validation.Net;
import ca.gc.cra.beacon.validation.Numbers;
import ca.gc.cra.beacon.validation.Strings;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one or more log entries to a console and reports whether the connection succeeded.
 *
 * <p>Runs the client in synchronous mode so every entry is written before shutdown; useful for smoke-testing a
 * console endpoint or a configuration file.</p>
 *
 * @since 0.1.0
 */
public final class SendCli {
  private static final Logger log = LoggerFactory.getLogger(SendCli.class);
  private static final String DEFAULT_APP_NAME = "beacon-cli";
  private static final int MAX_COUNT = 100_000;
  private static final String SUMMARY_USAGE =
      "usage: send message=TEXT [host=HOST] [port=PORT] [timeout=SPAN] [level=LEVEL] [session=NAME] "
          + "[appName=NAME] [count=N] [connection=tcp(...)|config=PATH] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      BEACON send

      Usage:
        send message="hello" [options]

      Required:
        message=TEXT             Title of the log entry

      Connection (pick one):
        host=HOST port=PORT      Console address; host defaults to auto-detection, port to 4228
        timeout=SPAN             Connect and read timeout (default 5s)
        connection=tcp(...)      Full connection descriptor
        config=PATH              YAML or properties client configuration

      Optional:
        level=LEVEL              DEBUG|VERBOSE|MESSAGE|WARNING|ERROR|FATAL (default MESSAGE)
        session=NAME             Session name (default Main)
        appName=NAME             Application name announced to the console (default beacon-cli)
        count=N                  Number of entries to send (default 1)
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private SendCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the send command.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for send CLI");
    }

    SendRequest request;
    try {
      Map<String, String> kv = input.options();
      TelemetryConfigurator.configureMetrics(kv);
      request = SendRequest.fromMap(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConnectionOutcome outcome = new ConnectionOutcome();
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      ClientOptions options = ClientOptions.defaults().withListener(outcome).withMetrics(metrics);
      BeaconClient client;
      try {
        client = openClient(request, options);
      } catch (ConfigurationException ex) {
        log.error("Invalid connection configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
      try {
        log.info("Sending {} entries to {}", request.count(), client.connections().orElse("<none>"));
        Session session = client.session(request.session());
        for (int i = 0; i < request.count(); i++) {
          session.log(request.level(), request.message());
        }
      } finally {
        client.shutdown();
        metrics.forceFlush();
      }
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in send command", ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    if (!outcome.connected.get()) {
      Exception error = outcome.firstError.get();
      log.error("Unable to reach console: {}", error != null ? error.getMessage() : "no connection attempt made");
      return ExitCode.IO_ERROR;
    }
    CliPrinter.printf("sent %d %s entries to session %s", request.count(), request.level(), request.session());
    return ExitCode.SUCCESS;
  }

  private static BeaconClient openClient(SendRequest request, ClientOptions options)
      throws ConfigurationException {
    if (request.config() != null) {
      ClientConfig config = ClientConfigLoader.load(request.config(), new VariableStore());
      if (config.connections().isEmpty()) {
        throw new ConfigurationException("configuration " + request.config() + " defines no connections");
      }
      BeaconClient client = BeaconClient.fromConfig(config, options);
      client.setEnabled(true);
      return client;
    }
    BeaconClient client = new BeaconClient(request.appName(), options);
    client.connect(request.descriptor());
    return client;
  }

  /** Collects connection outcomes reported by the client. */
  private static final class ConnectionOutcome implements ConnectionListener {
    private final AtomicBoolean connected = new AtomicBoolean();
    private final AtomicReference<Exception> firstError = new AtomicReference<>();

    @Override
    public void onConnect(boolean reconnect) {
      connected.set(true);
    }

    @Override
    public void onDisconnect() {
      log.debug("Console connection closed");
    }

    @Override
    public void onError(Exception error) {
      firstError.compareAndSet(null, error);
      log.warn("Client reported: {}", error.getMessage());
    }
  }

  /**
   * Validated send arguments.
   *
   * @param message entry title
   * @param level entry level
   * @param session session name
   * @param appName application name
   * @param count number of entries
   * @param descriptor connection descriptor; {@code null} when {@code config} is set
   * @param config configuration file; may be {@code null}
   */
  record SendRequest(
      String message,
      Level level,
      String session,
      String appName,
      int count,
      String descriptor,
      Path config) {

    static SendRequest fromMap(Map<String, String> kv) {
      String message = Strings.requireNonBlank("message", require(kv, "message"));
      Level level = parseLevel(kv.remove("level"));
      String session = valueOr(kv.remove("session"), SessionRegistry.MAIN);
      String appName = valueOr(kv.remove("appName"), DEFAULT_APP_NAME);
      int count = Numbers.parseInt("count", valueOr(kv.remove("count"), "1"), 1, MAX_COUNT);

      String connection = kv.remove("connection");
      String configPath = kv.remove("config");
      String host = kv.remove("host");
      String port = kv.remove("port");
      String timeout = valueOr(kv.remove("timeout"), "5s");
      if (!kv.isEmpty()) {
        throw new IllegalArgumentException("unknown arguments: " + kv.keySet());
      }
      if (connection != null && configPath != null) {
        throw new IllegalArgumentException("connection and config are mutually exclusive");
      }
      if ((connection != null || configPath != null) && (host != null || port != null)) {
        throw new IllegalArgumentException("host/port cannot be combined with connection or config");
      }

      Path config = null;
      String descriptor = null;
      if (configPath != null) {
        config = Path.of(Strings.requireNonBlank("config", configPath));
        if (!Files.isRegularFile(config)) {
          throw new IllegalArgumentException("config file does not exist: " + config);
        }
      } else if (connection != null) {
        descriptor = Strings.requireNonBlank("connection", connection);
      } else {
        descriptor = buildDescriptor(host, port, timeout);
      }
      return new SendRequest(message, level, session, appName, count, descriptor, config);
    }

    private static String buildDescriptor(String host, String port, String timeout) {
      StringBuilder sb = new StringBuilder("tcp(");
      if (host != null && !host.isBlank()) {
        sb.append("host=").append(Net.validateHost(host.trim())).append(',');
      }
      if (port != null) {
        sb.append("port=").append(Numbers.parseInt("port", port, 1, 65_535)).append(',');
      }
      sb.append("timeout=").append(Strings.requirePrintableAscii("timeout", timeout, 32)).append(',');
      sb.append("async.enabled=false,reconnect=false)");
      return sb.toString();
    }

    static Level parseLevel(String raw) {
      if (raw == null || raw.isBlank()) {
        return Level.MESSAGE;
      }
      Level level = Level.parse(raw, null);
      if (level == null || level == Level.CONTROL) {
        throw new IllegalArgumentException("unknown level: " + raw);
      }
      return level;
    }

    static String require(Map<String, String> kv, String key) {
      String value = kv.remove(key);
      if (value == null) {
        throw new IllegalArgumentException(key + " is required");
      }
      return value;
    }

    private static String valueOr(String value, String fallback) {
      return value == null || value.isBlank() ? fallback : value.trim();
    }
  }
}
