package ca.gc.cra.rill.application.drain;

import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainErrorHandler;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.application.port.MetricsPort;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Static factories for the built-in drain combinators.
 *
 * <pre>{@code
 * AsyncDrain async = Drains.async(Drains.filterLevel(Level.INFO, sink));
 * Logger root = Logger.root(async, KeyValue.kv("service", "billing"));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Drains {
  private Drains() {
    // Utility
  }

  /**
   * Returns the drain that drops everything.
   *
   * @return shared discard drain
   */
  public static Drain discard() {
    return DiscardDrain.INSTANCE;
  }

  /**
   * Wraps {@code inner} so only records at least as severe as {@code threshold} reach it.
   *
   * @param threshold least severe level that passes
   * @param inner drain receiving passing records
   * @return level filter
   */
  public static LevelFilterDrain filterLevel(Level threshold, Drain inner) {
    return new LevelFilterDrain(threshold, inner);
  }

  /**
   * Wraps {@code inner} so only records accepted by {@code predicate} reach it.
   *
   * @param predicate record test
   * @param inner drain receiving passing records
   * @return predicate filter
   */
  public static FilterDrain filter(Predicate<LogRecord> predicate, Drain inner) {
    return new FilterDrain(predicate, inner);
  }

  /**
   * Sends every record to both drains.
   *
   * @param first drain invoked first
   * @param second drain invoked second
   * @return fan-out drain
   */
  public static DuplicateDrain duplicate(Drain first, Drain second) {
    return new DuplicateDrain(first, second);
  }

  /**
   * Creates a runtime-replaceable drain.
   *
   * @param initial drain installed at creation
   * @return switch drain
   */
  public static AtomicSwitchDrain atomicSwitch(Drain initial) {
    return new AtomicSwitchDrain(initial);
  }

  /**
   * Moves {@code inner} behind a bounded queue with default settings.
   *
   * @param inner drain called from the worker thread
   * @return async drain; close it to flush
   */
  public static AsyncDrain async(Drain inner) {
    return new AsyncDrain(inner);
  }

  /**
   * Moves {@code inner} behind a bounded queue.
   *
   * @param inner drain called from the worker thread
   * @param settings queue and worker tuning
   * @param errorHandler receives inner failures
   * @param metrics queue and delivery metrics
   * @return async drain; close it to flush
   */
  public static AsyncDrain async(
      Drain inner, AsyncDrain.Settings settings, DrainErrorHandler errorHandler, MetricsPort metrics) {
    return new AsyncDrain(inner, settings, errorHandler, metrics);
  }

  /**
   * Makes inner failures unchecked.
   *
   * @param inner drain whose failures become {@code DrainFailedException}
   * @return fused drain
   */
  public static FuseDrain fuse(Drain inner) {
    return new FuseDrain(inner);
  }

  /**
   * Makes inner failures count as success.
   *
   * @param inner best-effort drain
   * @param metrics counter sink for ignored failures
   * @return ignoring drain
   */
  public static IgnoreResultDrain ignoreResult(Drain inner, MetricsPort metrics) {
    return new IgnoreResultDrain(inner, metrics);
  }

  /**
   * Rewrites inner failures.
   *
   * @param inner drain whose failures are rewritten
   * @param mapper failure rewrite
   * @return mapping drain
   */
  public static MapErrorDrain mapError(Drain inner, UnaryOperator<DrainException> mapper) {
    return new MapErrorDrain(inner, mapper);
  }
}
