package ca.gc.cra.rill.application.port;

import ca.gc.cra.rill.domain.record.LogRecord;

/**
 * <strong>What:</strong> Out-of-band channel for drain failures that cannot reach the logging call site.
 * <p><strong>Why:</strong> Log calls never throw, and async drains have already returned when their worker
 * fails; operators still need to see those failures.</p>
 * <p><strong>Role:</strong> Port implemented by {@code LoggingDrainErrorHandler} and {@code LastErrorSlot}.</p>
 * <p><strong>Thread-safety:</strong> Invoked from logging threads and async workers concurrently.</p>
 * <p><strong>Performance:</strong> Runs on the failure path only; must not block for long.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DrainErrorHandler {
  /**
   * Receives a failure.
   *
   * @param record record whose delivery failed
   * @param failure drain failure, or an unchecked exception thrown while serializing
   */
  void onError(LogRecord record, Exception failure);

  /**
   * Returns a handler that forwards to this handler and then to {@code next}.
   *
   * @param next handler invoked after this one
   * @return composed handler
   */
  default DrainErrorHandler andThen(DrainErrorHandler next) {
    return (record, failure) -> {
      onError(record, failure);
      next.onError(record, failure);
    };
  }
}
