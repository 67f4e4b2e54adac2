package ca.gc.cra.flowstart.infrastructure.metrics;

import ca.gc.cra.flowstart.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link MetricsPort} backed by OpenTelemetry. Each dotted key maps to one lazily created counter or
 * histogram named after the key and tagged with {@code flowstart.metric.key}.
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("flowstart.metric.key");

  private final OpenTelemetryBootstrap.Handle handle;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter selected by system properties or environment.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
  }

  /**
   * Creates an adapter that reports into {@code reader}, typically an in-memory reader in tests.
   *
   * @param reader metric reader to register
   * @return adapter bound to a private meter provider
   */
  public static OpenTelemetryMetricsAdapter withReader(MetricReader reader) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, k -> meter.counterBuilder(k).setUnit("1").build())
        .add(1, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, k -> meter.histogramBuilder(k).ofLongs().build())
        .record(value, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  /** @return {@code true} when no exporter is active */
  public boolean isNoop() {
    return handle.isNoop();
  }

  /** Pushes pending measurements to the exporter. */
  public void forceFlush() {
    handle.forceFlush();
  }

  @Override
  public void close() {
    handle.close();
  }
}
