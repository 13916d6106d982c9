package ca.gc.cra.rill.application.drain;

import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <strong>What:</strong> Drain whose inner drain can be replaced at runtime.
 * <p><strong>Why:</strong> Lets operators redirect or re-filter output without rebuilding the logger hierarchy.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read one snapshot of the current inner drain at call entry and use it for the whole call.</li>
 *   <li>Install replacements atomically for subsequent calls.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Lock-free; {@link #set(Drain)} never blocks loggers and a racing call
 * completes against the drain it started with. A replaced drain stays reachable until its in-flight calls
 * return.</p>
 *
 * @since 0.1.0
 */
public final class AtomicSwitchDrain implements Drain {
  private final AtomicReference<Drain> current;
  private final Control control;

  /**
   * Creates a switch initially forwarding to {@code initial}.
   *
   * @param initial drain used until the first replacement
   */
  public AtomicSwitchDrain(Drain initial) {
    this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    this.control = new Control(current);
  }

  @Override
  public void log(LogRecord record, Fields fields) throws DrainException {
    Drain snapshot = current.get();
    snapshot.log(record, fields);
  }

  @Override
  public boolean isEnabled(Level level) {
    return current.get().isEnabled(level);
  }

  /**
   * Installs {@code drain} for subsequent calls.
   *
   * @param drain replacement drain
   */
  public void set(Drain drain) {
    control.set(drain);
  }

  /**
   * Installs {@code drain} and returns the one it replaced.
   *
   * @param drain replacement drain
   * @return previously installed drain
   */
  public Drain swap(Drain drain) {
    return control.swap(drain);
  }

  /**
   * Returns the currently installed drain.
   *
   * @return current snapshot
   */
  public Drain get() {
    return current.get();
  }

  /**
   * Returns a handle that can replace the inner drain without exposing the switch itself.
   *
   * @return control handle sharing this switch's state
   */
  public Control control() {
    return control;
  }

  /**
   * Replacement handle for an {@link AtomicSwitchDrain}.
   */
  public static final class Control {
    private final AtomicReference<Drain> current;

    private Control(AtomicReference<Drain> current) {
      this.current = current;
    }

    /**
     * Installs {@code drain} for subsequent calls.
     *
     * @param drain replacement drain
     */
    public void set(Drain drain) {
      current.set(Objects.requireNonNull(drain, "drain"));
    }

    /**
     * Installs {@code drain} and returns the one it replaced.
     *
     * @param drain replacement drain
     * @return previously installed drain
     */
    public Drain swap(Drain drain) {
      return current.getAndSet(Objects.requireNonNull(drain, "drain"));
    }

    /**
     * Returns the currently installed drain.
     *
     * @return current snapshot
     */
    public Drain get() {
      return current.get();
    }
  }
}
