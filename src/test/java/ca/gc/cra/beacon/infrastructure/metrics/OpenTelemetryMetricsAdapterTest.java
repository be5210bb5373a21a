package ca.gc.cra.beacon.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("beacon.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void incrementRecordsCounterWithResource() {
    adapter.increment("sender.sent");
    adapter.increment("sender.sent");
    adapter.increment("sender.sent");
    adapter.forceFlush();

    MetricData counter = metric(reader.collectAllMetrics(), "sender.sent");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("sender.sent", point.getAttributes().get(METRIC_KEY));
    assertEquals("beacon", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("sender.burst.bytes", 100);
    adapter.observe("sender.burst.bytes", 300);

    MetricData histogram = metric(reader.collectAllMetrics(), "sender.burst.bytes");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(400.0, point.getSum(), 0.0001);
  }

  @Test
  void invalidNamesAreSanitizedButKeyIsKept() {
    adapter.increment("2 Queue/Depth");

    MetricData counter = metric(reader.collectAllMetrics(), "m2_queue_depth");
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals("2 Queue/Depth", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeNameFallsBackForBlankKeys() {
    assertEquals("beacon.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
    assertEquals("queue.evicted", OpenTelemetryMetricsAdapter.sanitizeName("Queue.Evicted"));
  }

  private static MetricData metric(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(m -> m.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported: " + metrics));
  }
}
