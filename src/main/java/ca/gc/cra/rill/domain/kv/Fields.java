package ca.gc.cra.rill.domain.kv;

import ca.gc.cra.rill.domain.record.LogRecord;
import java.io.IOException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * <strong>What:</strong> Lazy field sequence of one log call.
 * <p><strong>Why:</strong> Drains that drop a record must be able to do so without assembling or evaluating
 * any field.</p>
 * <p><strong>Role:</strong> Domain value passed to every drain next to the {@link LogRecord}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enumerate call-site pairs, then the logger's own pairs, then each ancestor's pairs, nearest first.</li>
 *   <li>Resolve lazy values against the record, at most once per call.</li>
 *   <li>Dispatch resolved values to a {@link Serializer} by runtime type.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe to enumerate and resolve from several threads; memoized lazy results
 * are guarded by this instance.</p>
 * <p><strong>Performance:</strong> Construction is O(1); nothing is walked until a consumer iterates.</p>
 *
 * @implNote Merge order is a contract: call-site pairs first, then the emitting logger's context, then its
 * ancestors. Duplicate keys are preserved in that order.
 * @since 0.1.0
 */
public final class Fields implements Iterable<KeyValue> {
  private final LogRecord record;
  private final List<KeyValue> callSite;
  private final ContextNode context;
  private Map<Value.Lazy, Object> resolved;

  private Fields(LogRecord record, List<KeyValue> callSite, ContextNode context) {
    this.record = Objects.requireNonNull(record, "record");
    this.callSite = Objects.requireNonNull(callSite, "callSite");
    this.context = Objects.requireNonNull(context, "context");
  }

  /**
   * Creates the field sequence for a log call.
   *
   * @param record record the lazy values will be evaluated against
   * @param callSite pairs supplied at the call site, in call order
   * @param context context node of the emitting logger
   * @return lazy field sequence
   */
  public static Fields of(LogRecord record, List<KeyValue> callSite, ContextNode context) {
    return new Fields(record, List.copyOf(callSite), context);
  }

  /**
   * Creates a field sequence that consists only of {@code pairs}.
   *
   * @param record record the lazy values will be evaluated against
   * @param pairs pairs in enumeration order
   * @return field sequence with no inherited context
   */
  public static Fields of(LogRecord record, KeyValue... pairs) {
    return new Fields(record, List.of(pairs), ContextNode.empty());
  }

  /**
   * Returns the record lazy values are evaluated against.
   *
   * @return owning record
   */
  public LogRecord record() {
    return record;
  }

  /**
   * Returns the number of pairs the sequence will yield without walking the chain.
   *
   * @return call-site pairs plus all inherited pairs
   */
  public int size() {
    return callSite.size() + context.totalPairs();
  }

  @Override
  public Iterator<KeyValue> iterator() {
    Iterator<KeyValue> inherited = context.iterator();
    Iterator<KeyValue> local = callSite.iterator();
    return new Iterator<>() {
      @Override
      public boolean hasNext() {
        return local.hasNext() || inherited.hasNext();
      }

      @Override
      public KeyValue next() {
        if (local.hasNext()) {
          return local.next();
        }
        if (inherited.hasNext()) {
          return inherited.next();
        }
        throw new NoSuchElementException();
      }
    };
  }

  /**
   * Resolves a value to its scalar, running a lazy computation on first use.
   *
   * @param value value taken from this sequence
   * @return scalar; may be {@code null}
   */
  public Object resolve(Value value) {
    if (value instanceof Value.Eager eager) {
      return eager.scalar();
    }
    Value.Lazy lazy = (Value.Lazy) value;
    synchronized (this) {
      if (resolved == null) {
        resolved = new HashMap<>();
      } else if (resolved.containsKey(lazy)) {
        return resolved.get(lazy);
      }
      Object computed = lazy.computation().compute(record);
      resolved.put(lazy, computed);
      return computed;
    }
  }

  /**
   * Resolves every pair in sequence order and hands it to {@code serializer}.
   *
   * @param serializer output visitor
   * @throws IOException if the serializer fails; iteration stops at the failing pair
   */
  public void serialize(Serializer serializer) throws IOException {
    for (KeyValue pair : this) {
      emit(serializer, pair.key(), resolve(pair.value()));
    }
  }

  /**
   * Dispatches one resolved scalar to the matching serializer method.
   *
   * @param serializer output visitor
   * @param key field name
   * @param scalar resolved value; may be {@code null}
   * @throws IOException if the serializer fails
   */
  public static void emit(Serializer serializer, String key, Object scalar) throws IOException {
    if (scalar == null) {
      serializer.emitNull(key);
    } else if (scalar instanceof CharSequence text) {
      serializer.emitString(key, text.toString());
    } else if (scalar instanceof Boolean flag) {
      serializer.emitBoolean(key, flag);
    } else if (scalar instanceof Long || scalar instanceof Integer
        || scalar instanceof Short || scalar instanceof Byte) {
      serializer.emitLong(key, ((Number) scalar).longValue());
    } else if (scalar instanceof Double || scalar instanceof Float) {
      serializer.emitDouble(key, ((Number) scalar).doubleValue());
    } else if (scalar instanceof Enum<?> constant) {
      serializer.emitString(key, constant.name());
    } else {
      serializer.emitObject(key, scalar);
    }
  }
}
