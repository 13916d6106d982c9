package ca.gc.cra.rill.domain.kv;

import java.io.IOException;

/**
 * Visitor that receives resolved fields in sequence order.
 *
 * <p>Drains implement this to write fields in their own format. {@link Fields#serialize(Serializer)}
 * resolves each value and dispatches to the most specific emit method for its runtime type.</p>
 *
 * @since 0.1.0
 */
public interface Serializer {
  /**
   * Emits a textual value.
   *
   * @param key field name
   * @param value text; never {@code null}
   * @throws IOException if the underlying output fails
   */
  void emitString(String key, String value) throws IOException;

  /**
   * Emits an integral value.
   *
   * @param key field name
   * @param value integral number
   * @throws IOException if the underlying output fails
   */
  void emitLong(String key, long value) throws IOException;

  /**
   * Emits a floating point value.
   *
   * @param key field name
   * @param value floating point number
   * @throws IOException if the underlying output fails
   */
  void emitDouble(String key, double value) throws IOException;

  /**
   * Emits a boolean value.
   *
   * @param key field name
   * @param value flag
   * @throws IOException if the underlying output fails
   */
  void emitBoolean(String key, boolean value) throws IOException;

  /**
   * Emits an absent value.
   *
   * @param key field name
   * @throws IOException if the underlying output fails
   */
  void emitNull(String key) throws IOException;

  /**
   * Emits a value with no dedicated method; defaults to its string form.
   *
   * @param key field name
   * @param value arbitrary object; never {@code null}
   * @throws IOException if the underlying output fails
   */
  default void emitObject(String key, Object value) throws IOException {
    emitString(key, String.valueOf(value));
  }
}
