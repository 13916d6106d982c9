package ca.gc.cra.rill.application.drain;

import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.application.port.DrainFailedException;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.util.Objects;

/**
 * Turns inner drain failures into unchecked {@link DrainFailedException}s.
 *
 * <p>Use where losing a record is fatal. The unchecked exception escapes combinators but is still caught by
 * {@code Logger}, which routes it to its error handler; callers that need it to surface must invoke the
 * drain directly.</p>
 *
 * @since 0.1.0
 */
public final class FuseDrain implements Drain {
  private final Drain inner;

  /**
   * Wraps a drain.
   *
   * @param inner drain whose failures become unchecked
   */
  public FuseDrain(Drain inner) {
    this.inner = Objects.requireNonNull(inner, "inner");
  }

  @Override
  public void log(LogRecord record, Fields fields) {
    try {
      inner.log(record, fields);
    } catch (DrainException failure) {
      throw new DrainFailedException(failure);
    }
  }

  @Override
  public boolean isEnabled(Level level) {
    return inner.isEnabled(level);
  }
}
