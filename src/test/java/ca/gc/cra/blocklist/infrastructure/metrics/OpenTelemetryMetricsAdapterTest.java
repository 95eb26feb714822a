package ca.gc.cra.blocklist.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTR = AttributeKey.stringKey("blocklist.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithOriginalKey() {
    adapter.increment("verify.failOpen");
    adapter.increment("verify.failOpen");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "verify.failopen").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("verify.failOpen", point.getAttributes().get(KEY_ATTR));

    assertEquals("blocklist", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void observeRecordsHistogramSamples() {
    adapter.observe("verify.latencyNanos", 1_000L);
    adapter.observe("verify.latencyNanos", 5_000L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "verify.latencynanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(6_000.0, point.getSum());
    assertEquals("verify.latencyNanos", point.getAttributes().get(KEY_ATTR));
  }

  @Test
  void sanitizeProducesInstrumentSafeNames() {
    assertEquals("source.domains.tldmismatch", OpenTelemetryMetricsAdapter.sanitize("source.domains.tldMismatch"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitize("9lives"));
    assertEquals("fetch_attempt", OpenTelemetryMetricsAdapter.sanitize("fetch attempt"));
    assertEquals("blocklist.metric", OpenTelemetryMetricsAdapter.sanitize("  "));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
