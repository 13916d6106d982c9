package ca.gc.cra.rill.domain.kv;

import ca.gc.cra.rill.domain.record.LogRecord;

/**
 * Deferred computation backing a lazy field value.
 *
 * <p>Implementations run only when a drain serializes the record, at most once per log call, and may
 * run on a thread other than the one that logged (an async drain evaluates on its worker). Any state the
 * computation captures must therefore be safe to read from another thread.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LazyComputation {
  /**
   * Computes the field's scalar value.
   *
   * @param record read-only view of the event being serialized
   * @return the value to serialize; may be {@code null}
   */
  Object compute(LogRecord record);
}
