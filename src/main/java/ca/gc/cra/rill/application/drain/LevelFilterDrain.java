package ca.gc.cra.rill.application.drain;

import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.util.Objects;

/**
 * Forwards records at least as severe as a threshold; drops the rest without touching their fields.
 *
 * <p>Thread-safety follows the inner drain.</p>
 *
 * @since 0.1.0
 */
public final class LevelFilterDrain implements Drain {
  private final Level threshold;
  private final Drain inner;

  /**
   * Creates a level filter.
   *
   * @param threshold least severe level that passes
   * @param inner drain receiving records that pass
   */
  public LevelFilterDrain(Level threshold, Drain inner) {
    this.threshold = Objects.requireNonNull(threshold, "threshold");
    this.inner = Objects.requireNonNull(inner, "inner");
  }

  @Override
  public void log(LogRecord record, Fields fields) throws DrainException {
    if (record.level().isAtLeast(threshold)) {
      inner.log(record, fields);
    }
  }

  @Override
  public boolean isEnabled(Level level) {
    return level.isAtLeast(threshold) && inner.isEnabled(level);
  }

  /**
   * Returns the configured threshold.
   *
   * @return least severe level that passes
   */
  public Level threshold() {
    return threshold;
  }
}
