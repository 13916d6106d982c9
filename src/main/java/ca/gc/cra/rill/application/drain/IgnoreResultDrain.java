package ca.gc.cra.rill.application.drain;

import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.application.port.MetricsPort;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports inner drain failures as success after counting them.
 *
 * <p>Useful for a best-effort branch of a {@link DuplicateDrain} whose failures should not show up in the
 * aggregate result. Failures increment {@code drain.ignored.error} and are logged at debug level.</p>
 *
 * @since 0.1.0
 */
public final class IgnoreResultDrain implements Drain {
  private static final Logger log = LoggerFactory.getLogger(IgnoreResultDrain.class);

  private final Drain inner;
  private final MetricsPort metrics;

  /**
   * Wraps a drain.
   *
   * @param inner best-effort drain
   * @param metrics metrics sink; {@link MetricsPort#NO_OP} when {@code null}
   */
  public IgnoreResultDrain(Drain inner, MetricsPort metrics) {
    this.inner = Objects.requireNonNull(inner, "inner");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  @Override
  public void log(LogRecord record, Fields fields) {
    try {
      inner.log(record, fields);
    } catch (DrainException failure) {
      metrics.increment("drain.ignored.error");
      log.debug("Ignoring failure of best-effort drain for record '{}'", record.message(), failure);
    }
  }

  @Override
  public boolean isEnabled(Level level) {
    return inner.isEnabled(level);
  }
}
