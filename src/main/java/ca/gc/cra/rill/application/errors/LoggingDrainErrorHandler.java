package ca.gc.cra.rill.application.errors;

import ca.gc.cra.rill.application.port.DrainErrorHandler;
import ca.gc.cra.rill.application.port.MetricsPort;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports drain failures through SLF4J, throttled so a failing sink cannot flood the diagnostic log.
 *
 * <p>The first failure and every {@value #LOG_EVERY}th one after it are logged with a stack trace; the
 * rest only bump the {@code drain.error} counter.</p>
 *
 * @since 0.1.0
 */
public final class LoggingDrainErrorHandler implements DrainErrorHandler {
  private static final Logger log = LoggerFactory.getLogger(LoggingDrainErrorHandler.class);
  static final int LOG_EVERY = 1_000;

  /** Shared instance without metrics. */
  public static final LoggingDrainErrorHandler INSTANCE = new LoggingDrainErrorHandler(MetricsPort.NO_OP);

  private final MetricsPort metrics;
  private final AtomicInteger failureCount = new AtomicInteger();

  /**
   * Creates a handler that also counts failures.
   *
   * @param metrics metrics sink; {@link MetricsPort#NO_OP} when {@code null}
   */
  public LoggingDrainErrorHandler(MetricsPort metrics) {
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  @Override
  public void onError(LogRecord record, Exception failure) {
    metrics.increment("drain.error");
    int count = failureCount.incrementAndGet();
    if (count == 1 || count % LOG_EVERY == 0) {
      log.warn(
          "Drain failed for {} record '{}' at {} ({} failures so far)",
          record.level(),
          record.message(),
          record.location(),
          count,
          failure);
    }
  }

  /**
   * Returns the number of failures seen so far.
   *
   * @return failure count
   */
  public int failureCount() {
    return failureCount.get();
  }
}
