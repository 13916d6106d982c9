package ca.gc.cra.rill.infrastructure.sink;

import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.kv.KeyValue;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Drain that resolves every field and keeps the result in memory.
 *
 * <p>Thread-safe. Intended for tests and for short diagnostic captures; it never evicts.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryDrain implements Drain {
  private final CopyOnWriteArrayList<CapturedRecord> records = new CopyOnWriteArrayList<>();
  private final Level threshold;

  /** Creates a drain capturing every level. */
  public InMemoryDrain() {
    this(Level.MOST_VERBOSE);
  }

  /**
   * Creates a drain that reports itself enabled only at or above {@code threshold}.
   *
   * @param threshold least severe level advertised through {@link #isEnabled(Level)}
   */
  public InMemoryDrain(Level threshold) {
    this.threshold = threshold;
  }

  @Override
  public void log(LogRecord record, Fields fields) {
    List<Map.Entry<String, Object>> resolved = new ArrayList<>(fields.size());
    for (KeyValue pair : fields) {
      resolved.add(CapturedRecord.entry(pair, fields.resolve(pair.value())));
    }
    records.add(new CapturedRecord(record, resolved, Thread.currentThread().getName()));
  }

  @Override
  public boolean isEnabled(Level level) {
    return level.isAtLeast(threshold);
  }

  public List<CapturedRecord> snapshot() {
    return List.copyOf(records);
  }

  public int size() {
    return records.size();
  }

  public void clear() {
    records.clear();
  }
}
