package ca.gc.cra.rill.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps for log records.
 * <p><strong>Why:</strong> Tests need deterministic record timestamps.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; every logging thread reads the clock.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
