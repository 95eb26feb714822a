package ca.gc.cra.blocklist.application.port;

/**
 * <strong>What:</strong> Port abstracting block list metrics emission.
 * <p><strong>Why:</strong> Lets the pipeline count retries, drops, and verification outcomes without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code OpenTelemetryMetricsAdapter} and
 * {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from source and verification
 * workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code verify.nxdomain},
 * {@code fetch.retry}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value (nanoseconds, counts); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
