package ca.gc.cra.rill.application.logger;

import ca.gc.cra.rill.application.errors.LoggingDrainErrorHandler;
import ca.gc.cra.rill.application.port.ClockPort;
import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainErrorHandler;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.domain.kv.ContextNode;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.kv.KeyValue;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.Location;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Handle that pairs inherited context with a shared drain and emits records.
 * <p><strong>Why:</strong> Context travels with the logger object passed to each component; nothing is looked up
 * from global state.</p>
 * <p><strong>Role:</strong> Application entry point of the logging pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create children that share the drain and extend the context chain.</li>
 *   <li>Build a {@link LogRecord} and a lazy {@link Fields} sequence per call and hand them to the drain.</li>
 *   <li>Keep drain failures away from application control flow, routing them to the error handler.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; any number of threads may log through the same logger or its
 * relatives without external locking.</p>
 * <p><strong>Performance:</strong> Disabled levels cost one {@link Drain#isEnabled(Level)} check. Enabled calls
 * capture the caller frame unless location capture is turned off.</p>
 *
 * @since 0.1.0
 */
public final class Logger {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(Logger.class);
  private static final StackWalker WALKER = StackWalker.getInstance();
  private static final String LOGGER_CLASS = Logger.class.getName();

  private final Drain drain;
  private final ContextNode context;
  private final DrainErrorHandler errorHandler;
  private final ClockPort clock;
  private final boolean captureLocation;

  private Logger(
      Drain drain,
      ContextNode context,
      DrainErrorHandler errorHandler,
      ClockPort clock,
      boolean captureLocation) {
    this.drain = drain;
    this.context = context;
    this.errorHandler = errorHandler;
    this.clock = clock;
    this.captureLocation = captureLocation;
  }

  /**
   * Creates a root logger with default error handling and the system clock.
   *
   * @param drain drain every record is sent to
   * @param pairs context pairs owned by the root
   * @return root logger
   */
  public static Logger root(Drain drain, KeyValue... pairs) {
    return builder(drain).with(pairs).build();
  }

  /**
   * Starts building a root logger.
   *
   * @param drain drain every record is sent to
   * @return builder
   */
  public static Builder builder(Drain drain) {
    return new Builder(drain);
  }

  /**
   * Creates a child logger that shares this logger's drain and inherits its context.
   *
   * @param pairs pairs owned by the child; enumerated before everything inherited
   * @return child logger
   */
  public Logger newChild(KeyValue... pairs) {
    return new Logger(drain, context.child(asList(pairs)), errorHandler, clock, captureLocation);
  }

  /**
   * Returns the drain this logger emits to.
   *
   * @return shared drain
   */
  public Drain drain() {
    return drain;
  }

  /**
   * Returns this logger's context node.
   *
   * @return node owning this logger's pairs
   */
  public ContextNode context() {
    return context;
  }

  /**
   * Returns whether the drain may produce output for {@code level}.
   *
   * @param level candidate severity
   * @return drain's enablement hint; {@code true} when the hint itself fails
   */
  public boolean isEnabled(Level level) {
    try {
      return drain.isEnabled(level);
    } catch (RuntimeException hintFailure) {
      log.debug("Drain {} failed its enablement check for {}; treating as enabled",
          drain.getClass().getName(), level, hintFailure);
      return true;
    }
  }

  /**
   * Emits a record. Drain failures are reported to the error handler, never thrown.
   *
   * @param level severity
   * @param message message text
   * @param pairs call-site pairs; enumerated before the logger's context
   */
  public void log(Level level, String message, KeyValue... pairs) {
    if (!isEnabled(level)) {
      return;
    }
    emit(level, callerLocation(), "", message, pairs);
  }

  /**
   * Emits a record carrying a routing tag.
   *
   * @param level severity
   * @param tag tag exposed to filters through {@link LogRecord#tag()}
   * @param message message text
   * @param pairs call-site pairs
   */
  public void logTagged(Level level, String tag, String message, KeyValue... pairs) {
    if (!isEnabled(level)) {
      return;
    }
    emit(level, callerLocation(), tag, message, pairs);
  }

  /**
   * Emits a record at an explicit location, for adapters that already know the call site.
   *
   * @param level severity
   * @param location call-site position
   * @param tag routing tag; empty when {@code null}
   * @param message message text
   * @param pairs call-site pairs
   */
  public void logAt(Level level, Location location, String tag, String message, KeyValue... pairs) {
    if (!isEnabled(level)) {
      return;
    }
    emit(level, location, tag, message, pairs);
  }

  /**
   * Emits at {@link Level#CRITICAL}.
   *
   * @param message message text
   * @param pairs call-site pairs
   */
  public void critical(String message, KeyValue... pairs) {
    log(Level.CRITICAL, message, pairs);
  }

  /**
   * Emits at {@link Level#ERROR}.
   *
   * @param message message text
   * @param pairs call-site pairs
   */
  public void error(String message, KeyValue... pairs) {
    log(Level.ERROR, message, pairs);
  }

  /**
   * Emits at {@link Level#WARNING}.
   *
   * @param message message text
   * @param pairs call-site pairs
   */
  public void warning(String message, KeyValue... pairs) {
    log(Level.WARNING, message, pairs);
  }

  /**
   * Emits at {@link Level#INFO}.
   *
   * @param message message text
   * @param pairs call-site pairs
   */
  public void info(String message, KeyValue... pairs) {
    log(Level.INFO, message, pairs);
  }

  /**
   * Emits at {@link Level#DEBUG}.
   *
   * @param message message text
   * @param pairs call-site pairs
   */
  public void debug(String message, KeyValue... pairs) {
    log(Level.DEBUG, message, pairs);
  }

  /**
   * Emits at {@link Level#TRACE}.
   *
   * @param message message text
   * @param pairs call-site pairs
   */
  public void trace(String message, KeyValue... pairs) {
    log(Level.TRACE, message, pairs);
  }

  private void emit(Level level, Location location, String tag, String message, KeyValue[] pairs) {
    LogRecord record =
        new LogRecord(level, message, location, Instant.ofEpochMilli(clock.nowMillis()), tag);
    Fields fields = Fields.of(record, asList(pairs), context);
    try {
      drain.log(record, fields);
    } catch (DrainException | RuntimeException failure) {
      errorHandler.onError(record, failure);
    }
  }

  private Location callerLocation() {
    if (!captureLocation) {
      return Location.UNKNOWN;
    }
    return WALKER.walk(frames -> frames
            .dropWhile(frame -> frame.getClassName().equals(LOGGER_CLASS))
            .findFirst())
        .map(Location::of)
        .orElse(Location.UNKNOWN);
  }

  private static List<KeyValue> asList(KeyValue[] pairs) {
    return pairs == null || pairs.length == 0 ? List.of() : Arrays.asList(pairs);
  }

  /**
   * Builder for root loggers.
   */
  public static final class Builder {
    private final Drain drain;
    private List<KeyValue> pairs = List.of();
    private DrainErrorHandler errorHandler = LoggingDrainErrorHandler.INSTANCE;
    private ClockPort clock = ClockPort.SYSTEM;
    private boolean captureLocation = true;

    private Builder(Drain drain) {
      this.drain = Objects.requireNonNull(drain, "drain");
    }

    /**
     * Sets the pairs owned by the root.
     *
     * @param pairs root context pairs
     * @return this builder
     */
    public Builder with(KeyValue... pairs) {
      this.pairs = asList(pairs);
      return this;
    }

    /**
     * Sets the handler receiving drain failures.
     *
     * @param errorHandler out-of-band failure channel
     * @return this builder
     */
    public Builder errorHandler(DrainErrorHandler errorHandler) {
      this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
      return this;
    }

    /**
     * Sets the clock used to timestamp records.
     *
     * @param clock time source
     * @return this builder
     */
    public Builder clock(ClockPort clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Enables or disables stack-based call-site capture.
     *
     * @param captureLocation {@code false} to emit {@link Location#UNKNOWN}
     * @return this builder
     */
    public Builder captureLocation(boolean captureLocation) {
      this.captureLocation = captureLocation;
      return this;
    }

    /**
     * Builds the root logger.
     *
     * @return root logger
     */
    public Logger build() {
      return new Logger(drain, ContextNode.root(pairs), errorHandler, clock, captureLocation);
    }
  }
}
