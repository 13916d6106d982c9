package ca.gc.cra.rill.domain.kv;

import java.util.Objects;

/**
 * <strong>What:</strong> Payload of a log field, either held eagerly or computed on demand.
 * <p><strong>Why:</strong> Expensive diagnostics should cost nothing unless a drain actually writes them.</p>
 * <p><strong>Role:</strong> Domain value carried by {@link KeyValue}; resolved only through {@link Fields}.</p>
 * <p><strong>Thread-safety:</strong> Both variants are immutable; lazy computations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface Value {

  /**
   * Returns whether resolving this value runs a deferred computation.
   *
   * @return {@code true} for lazy values
   */
  boolean isLazy();

  /**
   * Wraps a ready scalar.
   *
   * @param scalar string, number, boolean, {@code null}, or any object rendered through {@code toString}
   * @return eager value
   */
  static Value of(Object scalar) {
    return new Eager(scalar);
  }

  /**
   * Wraps a deferred computation.
   *
   * @param computation thread-safe computation invoked at serialization time
   * @return lazy value
   */
  static Value lazy(LazyComputation computation) {
    return new Lazy(computation);
  }

  /**
   * Value that is already known when the field is created.
   *
   * @param scalar held value; may be {@code null}
   */
  record Eager(Object scalar) implements Value {
    @Override
    public boolean isLazy() {
      return false;
    }
  }

  /**
   * Value computed when a drain serializes the record.
   *
   * <p>Equality is identity so that per-call memoization keys on the instance, not on the lambda's
   * structural equality.</p>
   *
   * @param computation deferred computation
   */
  record Lazy(LazyComputation computation) implements Value {
    /**
     * Rejects {@code null} computations.
     */
    public Lazy {
      Objects.requireNonNull(computation, "computation");
    }

    @Override
    public boolean isLazy() {
      return true;
    }

    @Override
    public boolean equals(Object other) {
      return this == other;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(this);
    }
  }
}
