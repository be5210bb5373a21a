package ca.gc.cra.beacon.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the meter used by {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Each setting is read from a system property first, then from the matching environment variable:</p>
 * <ul>
 *   <li>{@code otel.metrics.exporter} / {@code OTEL_METRICS_EXPORTER}: {@code otlp} (default) or {@code none}</li>
 *   <li>{@code otel.exporter.otlp.endpoint} / {@code OTEL_EXPORTER_OTLP_ENDPOINT}</li>
 *   <li>{@code otel.resource.attributes} / {@code OTEL_RESOURCE_ATTRIBUTES}: {@code k=v} pairs, comma separated</li>
 * </ul>
 * <p>Any failure while building the exporter leaves the client with a noop meter; telemetry never stops
 * log shipping.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String SCOPE = "ca.gc.cra.beacon";
  private static final String CLIENT_VERSION = "0.1.0";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize() {
    String exporter = setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "otlp").toLowerCase(Locale.ROOT);
    if ("none".equals(exporter)) {
      log.info("OpenTelemetry metrics disabled (exporter=none)");
      return BootstrapResult.noop();
    }
    if (!"otlp".equals(exporter)) {
      log.warn("Unsupported metrics exporter '{}'; using otlp", exporter);
    }
    String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      Attributes extra = resourceAttributes(setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", ""));
      BootstrapResult result = build(reader, extra);
      log.info("Exporting BEACON metrics over OTLP to {}", endpoint);
      return result;
    } catch (RuntimeException ex) {
      log.error("OpenTelemetry exporter setup failed for endpoint {}; metrics disabled", endpoint, ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extra) {
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "beacon")
        .put(AttributeKey.stringKey("service.version"), CLIENT_VERSION)
        .putAll(extra)
        .build()));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(SCOPE).setInstrumentationVersion(CLIENT_VERSION).build();
    return new BootstrapResult(meter, provider);
  }

  static Attributes resourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    for (String pair : raw.split(",")) {
      int eq = pair.indexOf('=');
      String key = eq < 0 ? "" : pair.substring(0, eq).trim();
      String value = eq < 0 ? "" : pair.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        if (!pair.isBlank()) {
          log.warn("Ignoring malformed resource attribute '{}'", pair.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String setting(String property, String env, String fallback) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  /**
   * Meter plus the provider that owns it; {@code provider} is {@code null} in noop mode.
   *
   * @param meter meter handed to the adapter
   * @param provider SDK provider to flush and close
   */
  record BootstrapResult(Meter meter, SdkMeterProvider provider) implements AutoCloseable {

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(SCOPE), null);
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode pending, String action) {
      if (!pending.join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within {}s", action, SHUTDOWN_WAIT_SECONDS);
      }
    }
  }
}
