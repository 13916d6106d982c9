package ca.gc.cra.rill.application.drain;

import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;

/**
 * Drain that accepts and drops every record without reading its fields.
 *
 * <p>Thread-safe and stateless.</p>
 *
 * @since 0.1.0
 */
public final class DiscardDrain implements Drain {
  /** Shared instance. */
  public static final DiscardDrain INSTANCE = new DiscardDrain();

  private DiscardDrain() {}

  @Override
  public void log(LogRecord record, Fields fields) {
    // Dropped.
  }

  @Override
  public boolean isEnabled(Level level) {
    return false;
  }
}
