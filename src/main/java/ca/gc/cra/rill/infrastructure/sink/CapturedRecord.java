package ca.gc.cra.rill.infrastructure.sink;

import ca.gc.cra.rill.domain.kv.KeyValue;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.util.AbstractMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fully resolved snapshot of one record as seen by {@link InMemoryDrain}.
 *
 * @param record the original record
 * @param fields resolved pairs in sequence order; duplicates kept, scalars may be {@code null}
 * @param thread name of the thread the drain ran on
 * @since 0.1.0
 */
public record CapturedRecord(LogRecord record, List<Map.Entry<String, Object>> fields, String thread) {
  public CapturedRecord {
    Objects.requireNonNull(record, "record");
    fields = List.copyOf(fields);
    thread = Objects.requireNonNullElse(thread, "");
  }

  public Level level() {
    return record.level();
  }

  public String message() {
    return record.message();
  }

  /**
   * Returns the keys in sequence order.
   *
   * @return keys, duplicates included
   */
  public List<String> keys() {
    return fields.stream().map(Map.Entry::getKey).toList();
  }

  /**
   * Returns the first (most specific) value for {@code key}.
   *
   * @param key field name
   * @return resolved value, or empty when absent or {@code null}
   */
  public Optional<Object> first(String key) {
    for (Map.Entry<String, Object> entry : fields) {
      if (entry.getKey().equals(key)) {
        return Optional.ofNullable(entry.getValue());
      }
    }
    return Optional.empty();
  }

  static Map.Entry<String, Object> entry(KeyValue pair, Object scalar) {
    return new AbstractMap.SimpleImmutableEntry<>(pair.key(), scalar);
  }
}
