package ca.gc.cra.rill.application.drain;

import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Forwards records accepted by a predicate over the record metadata.
 *
 * <p>The predicate sees only the {@link LogRecord}, never the fields, so rejected records cost no field
 * evaluation. Predicates shared across threads must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class FilterDrain implements Drain {
  private final Predicate<LogRecord> predicate;
  private final Drain inner;

  /**
   * Creates a predicate filter.
   *
   * @param predicate test deciding which records pass
   * @param inner drain receiving records that pass
   */
  public FilterDrain(Predicate<LogRecord> predicate, Drain inner) {
    this.predicate = Objects.requireNonNull(predicate, "predicate");
    this.inner = Objects.requireNonNull(inner, "inner");
  }

  @Override
  public void log(LogRecord record, Fields fields) throws DrainException {
    if (predicate.test(record)) {
      inner.log(record, fields);
    }
  }

  @Override
  public boolean isEnabled(Level level) {
    return inner.isEnabled(level);
  }
}
