package ca.gc.cra.flowstart.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
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
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = OpenTelemetryMetricsAdapter.withReader(reader);
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  private MetricData metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported"));
  }

  @Test
  void incrementRecordsCounterTaggedWithKey() {
    adapter.increment("flowstart.event.dropped");
    adapter.increment("flowstart.event.dropped");

    MetricData counter = metric("flowstart.event.dropped");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("flowstart.event.dropped", point.getAttributes().get(AttributeKey.stringKey("flowstart.metric.key")));
    assertEquals("flowstart", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("flowstart.event.bytes", 200L);
    adapter.observe("flowstart.event.bytes", 300L);

    MetricData histogram = metric("flowstart.event.bytes");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(500.0, point.getSum());
  }

  @Test
  void noopHandleIgnoresUpdates() {
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle.noop())) {
      noop.increment("flowstart.event.emitted");
      noop.observe("flowstart.event.bytes", 1L);
      noop.forceFlush();
      assertTrue(noop.isNoop());
    }
  }
}
