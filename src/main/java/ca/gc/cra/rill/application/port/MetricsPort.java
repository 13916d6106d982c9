package ca.gc.cra.rill.application.port;

/**
 * <strong>What:</strong> Port abstracting pipeline metrics emission.
 * <p><strong>Why:</strong> Lets drains record counters and observations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like dropped records or drain failures.</li>
 *   <li>Record numeric observations for queue depths and latencies.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from logging threads
 * and async workers.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code async.queue.depth}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code async.dropped}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
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
