package ca.gc.cra.rill.domain.kv;

import java.util.Objects;

/**
 * A single structured field.
 *
 * <p>Keys compare exactly. Duplicate keys are legal anywhere in a field sequence and are never merged.</p>
 *
 * @param key field name; never {@code null}
 * @param value field payload; never {@code null}
 * @since 0.1.0
 */
public record KeyValue(String key, Value value) {
  /**
   * Validates the pair.
   */
  public KeyValue {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
  }

  /**
   * Creates a pair holding an eager value, or the supplied {@link Value} unchanged.
   *
   * @param key field name
   * @param value scalar or pre-built {@link Value}
   * @return key-value pair
   */
  public static KeyValue kv(String key, Object value) {
    if (value instanceof Value held) {
      return new KeyValue(key, held);
    }
    return new KeyValue(key, Value.of(value));
  }

  /**
   * Creates a pair whose value is computed only if the record is serialized.
   *
   * @param key field name
   * @param computation thread-safe deferred computation
   * @return key-value pair holding a lazy value
   */
  public static KeyValue lazy(String key, LazyComputation computation) {
    return new KeyValue(key, Value.lazy(computation));
  }
}
