package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private static final String[] PROPERTIES = {
      "otel.metrics.exporter", "otel.exporter.otlp.endpoint", "otel.resource.attributes"};

  private final Map<String, String> saved = new HashMap<>();

  @BeforeEach
  void save() {
    for (String property : PROPERTIES) {
      saved.put(property, System.getProperty(property));
    }
  }

  @AfterEach
  void restore() {
    for (String property : PROPERTIES) {
      String previous = saved.get(property);
      if (previous == null) {
        System.clearProperty(property);
      } else {
        System.setProperty(property, previous);
      }
    }
  }

  @Test
  void movesTelemetryArgumentsIntoSystemProperties() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "deployment.environment=test",
        "message", "kept"));

    TelemetryConfigurator.configureMetrics(args);

    assertEquals(Map.of("message", "kept"), args);
    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("deployment.environment=test", System.getProperty("otel.resource.attributes"));
  }

  @Test
  void rejectsUnknownExporter() {
    Map<String, String> args = new HashMap<>(Map.of("metricsExporter", "prometheus"));

    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(args));
  }

  @Test
  void endpointMustBeHttpWithHost() {
    assertDoesNotThrow(() -> TelemetryConfigurator.validateEndpoint("https://otel.example:4318"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.validateEndpoint("ftp://host"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.validateEndpoint("http://"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.validateEndpoint("not a uri"));
  }
}
