package ca.gc.cra.rill.application.port;

import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;

/**
 * <strong>What:</strong> Sink capability that consumes log records and their fields.
 * <p><strong>Why:</strong> Filters, fan-out, runtime switching, async hand-off and concrete writers all compose
 * through this single method.</p>
 * <p><strong>Role:</strong> Output port of the logging pipeline; implemented by every combinator and by any
 * number of external sinks.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decide whether the record is written, forwarded, or dropped.</li>
 *   <li>Touch {@link Fields} only when the record will actually be serialized.</li>
 *   <li>Signal failure through {@link DrainException}; never swallow it silently.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> A drain shared by several loggers is called concurrently and must tolerate
 * that. Drains wrapped by an async drain are called from its single worker thread only.</p>
 * <p><strong>Performance:</strong> Hot path for every log call; short-circuiting drains must return without
 * iterating the fields.</p>
 *
 * @since 0.1.0
 */
public interface Drain {
  /**
   * Handles one record.
   *
   * @param record event metadata
   * @param fields lazy field sequence, most specific first
   * @throws DrainException if the sink fails to write or rejects the record
   */
  void log(LogRecord record, Fields fields) throws DrainException;

  /**
   * Hints whether a record at {@code level} could produce output.
   *
   * <p>Loggers consult this before building a record. Returning {@code true} is always safe; returning
   * {@code false} lets the caller skip the call entirely.</p>
   *
   * @param level severity of a prospective record
   * @return {@code false} only when the record would certainly be dropped
   */
  default boolean isEnabled(Level level) {
    return true;
  }
}
