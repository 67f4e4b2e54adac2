package ca.gc.cra.flowstart.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for output modules.
 * <p><strong>Why:</strong> Lets loggers count emitted and dropped events without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} or {@link #NO_OP}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from worker threads.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 * <p><strong>Observability:</strong> Metric names use dotted keys (e.g., {@code flowstart.event.dropped}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (bytes, nanoseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
