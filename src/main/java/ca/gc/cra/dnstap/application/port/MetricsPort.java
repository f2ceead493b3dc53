package ca.gc.cra.dnstap.application.port;

/**
 * <strong>What:</strong> Port abstracting counter and histogram emission.
 * <p><strong>Why:</strong> Lets the handler and publishers record throughput and failures without binding to a
 * vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from handler workers.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and O(1).</p>
 *
 * @implNote Metric keys use dotted names such as {@code handler.events.published}.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value (nanoseconds, bytes, queue depth)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
