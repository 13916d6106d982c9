package ca.gc.cra.rill.application.drain;

import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Rewrites inner drain failures, e.g. to add the sink's name to the message.
 *
 * @since 0.1.0
 */
public final class MapErrorDrain implements Drain {
  private final Drain inner;
  private final UnaryOperator<DrainException> mapper;

  /**
   * Wraps a drain.
   *
   * @param inner drain whose failures are rewritten
   * @param mapper rewrite applied to each failure; must not return {@code null}
   */
  public MapErrorDrain(Drain inner, UnaryOperator<DrainException> mapper) {
    this.inner = Objects.requireNonNull(inner, "inner");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public void log(LogRecord record, Fields fields) throws DrainException {
    try {
      inner.log(record, fields);
    } catch (DrainException failure) {
      throw Objects.requireNonNull(mapper.apply(failure), "mapped failure");
    }
  }

  @Override
  public boolean isEnabled(Level level) {
    return inner.isEnabled(level);
  }
}
