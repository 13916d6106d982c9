package ca.gc.cra.rill.application.drain;

import ca.gc.cra.rill.application.port.AggregateDrainException;
import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.util.List;
import java.util.Objects;

/**
 * Fans every record out to two drains.
 *
 * <p>Both drains are always invoked, in order, whatever the first one does. A single failure is rethrown as
 * is; two failures are reported together as an {@link AggregateDrainException}. Lazy values reached by both
 * drains are evaluated once, because both receive the same {@link Fields} instance.</p>
 *
 * @since 0.1.0
 */
public final class DuplicateDrain implements Drain {
  private final Drain first;
  private final Drain second;

  /**
   * Creates a fan-out drain.
   *
   * @param first drain invoked first
   * @param second drain invoked second
   */
  public DuplicateDrain(Drain first, Drain second) {
    this.first = Objects.requireNonNull(first, "first");
    this.second = Objects.requireNonNull(second, "second");
  }

  @Override
  public void log(LogRecord record, Fields fields) throws DrainException {
    DrainException firstFailure = invoke(first, record, fields);
    DrainException secondFailure = invoke(second, record, fields);
    if (firstFailure != null && secondFailure != null) {
      throw new AggregateDrainException(List.of(firstFailure, secondFailure));
    }
    if (firstFailure != null) {
      throw firstFailure;
    }
    if (secondFailure != null) {
      throw secondFailure;
    }
  }

  @Override
  public boolean isEnabled(Level level) {
    return first.isEnabled(level) || second.isEnabled(level);
  }

  private static DrainException invoke(Drain drain, LogRecord record, Fields fields) {
    try {
      drain.log(record, fields);
      return null;
    } catch (DrainException failure) {
      return failure;
    } catch (RuntimeException unexpected) {
      return new DrainException("Drain threw " + unexpected.getClass().getSimpleName(), unexpected);
    }
  }
}
