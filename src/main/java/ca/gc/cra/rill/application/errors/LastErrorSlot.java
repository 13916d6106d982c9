package ca.gc.cra.rill.application.errors;

import ca.gc.cra.rill.application.port.DrainErrorHandler;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Error handler that keeps the most recent drain failure for operators to inspect.
 *
 * <p>Thread-safe: updates replace the slot atomically, so readers always see a record and failure that
 * belong together.</p>
 *
 * @since 0.1.0
 */
public final class LastErrorSlot implements DrainErrorHandler {
  private final AtomicReference<Failure> last = new AtomicReference<>();
  private final LongAdder count = new LongAdder();

  @Override
  public void onError(LogRecord record, Exception failure) {
    last.set(new Failure(record, failure));
    count.increment();
  }

  /**
   * Returns the most recent failure.
   *
   * @return last failure, or empty when none occurred since creation or the last {@link #clear()}
   */
  public Optional<Failure> last() {
    return Optional.ofNullable(last.get());
  }

  /**
   * Returns and clears the most recent failure.
   *
   * @return last failure, or empty
   */
  public Optional<Failure> take() {
    return Optional.ofNullable(last.getAndSet(null));
  }

  /**
   * Returns the number of failures recorded since creation.
   *
   * @return total failures
   */
  public long count() {
    return count.sum();
  }

  /**
   * Empties the slot without resetting the counter.
   */
  public void clear() {
    last.set(null);
  }

  /**
   * A failure together with the record whose delivery failed.
   *
   * @param record record that was being delivered
   * @param error failure reported by the drain
   */
  public record Failure(LogRecord record, Exception error) {}
}
