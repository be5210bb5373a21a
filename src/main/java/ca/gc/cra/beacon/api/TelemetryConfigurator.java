package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry CLI arguments into the system properties read by {@code OpenTelemetryBootstrap}.
 *
 * <p>Consumed keys are removed from the argument map so commands only see their own options.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private enum Option {
    EXPORTER("metricsExporter", "otel.metrics.exporter", TelemetryConfigurator::exporter),
    ENDPOINT("otelEndpoint", "otel.exporter.otlp.endpoint", TelemetryConfigurator::validateEndpoint),
    RESOURCE_ATTRIBUTES("otelResourceAttributes", "otel.resource.attributes",
        raw -> Strings.requirePrintableAscii("otelResourceAttributes", raw, 4_096));

    final String argument;
    final String property;
    final UnaryOperator<String> normalizer;

    Option(String argument, String property, UnaryOperator<String> normalizer) {
      this.argument = argument;
      this.property = property;
      this.normalizer = normalizer;
    }
  }

  private TelemetryConfigurator() {}

  /**
   * Applies {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}. Blank values are
   * consumed and ignored.
   *
   * @param args mutable CLI argument map
   * @throws IllegalArgumentException when a telemetry value is invalid
   */
  static void configureMetrics(Map<String, String> args) {
    if (args == null) {
      return;
    }
    for (Option option : Option.values()) {
      String raw = args.remove(option.argument);
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String value = option.normalizer.apply(raw.trim());
      log.debug("Setting {}={}", option.property, value);
      System.setProperty(option.property, value);
    }
  }

  private static String exporter(String raw) {
    String normalized = raw.toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return normalized;
  }

  /**
   * Accepts absolute {@code http} or {@code https} URIs that name a host.
   *
   * @param raw endpoint text
   * @return {@code raw}
   * @throws IllegalArgumentException when the endpoint is not usable by the OTLP exporter
   */
  static String validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
    return raw;
  }
}
