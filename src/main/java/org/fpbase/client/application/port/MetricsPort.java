package org.fpbase.client.application.port;

/**
 * <strong>What:</strong> Port abstracting client metrics emission.
 * <p><strong>Why:</strong> Lets the cache, resolver, and transport record counters and latencies without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} when metrics are disabled.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates.</p>
 * <p><strong>Observability:</strong> Metric names use dotted keys such as {@code cache.hit} or
 * {@code transport.latencyNanos}.</p>
 *
 * @implNote Callers must not pass {@code null} keys.
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
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; unit defined by the key (e.g. nanoseconds)
   */
  void observe(String key, long value);

  /**
   * Pushes buffered measurements to the backend. Blocks until the export completes or times out.
   */
  default void flush() {}

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
