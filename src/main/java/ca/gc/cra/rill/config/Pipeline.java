package ca.gc.cra.rill.config;

import ca.gc.cra.rill.application.drain.AtomicSwitchDrain;
import ca.gc.cra.rill.application.errors.LastErrorSlot;
import ca.gc.cra.rill.application.logger.Logger;
import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainErrorHandler;
import ca.gc.cra.rill.domain.kv.KeyValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.LoggerFactory;

/**
 * A wired drain tree plus the resources it owns.
 *
 * <p>{@link #drain()} is the switch at the top of the tree; {@link #control()} lets operators replace what sits
 * behind it at runtime. {@link #close()} flushes the async stage before closing the sink and the metrics
 * exporter. Closing does not touch drains installed later through the control.</p>
 *
 * @since 0.1.0
 */
public final class Pipeline implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(Pipeline.class);

  private final PipelineConfig config;
  private final AtomicSwitchDrain root;
  private final DrainErrorHandler errorHandler;
  private final LastErrorSlot lastErrors;
  private final List<AutoCloseable> closeables;
  private boolean closed;

  Pipeline(
      PipelineConfig config,
      AtomicSwitchDrain root,
      DrainErrorHandler errorHandler,
      LastErrorSlot lastErrors,
      List<AutoCloseable> closeables) {
    this.config = Objects.requireNonNull(config, "config");
    this.root = Objects.requireNonNull(root, "root");
    this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
    this.lastErrors = Objects.requireNonNull(lastErrors, "lastErrors");
    this.closeables = new ArrayList<>(closeables);
  }

  public PipelineConfig config() {
    return config;
  }

  /**
   * Returns the top of the drain tree.
   *
   * @return switch drain
   */
  public Drain drain() {
    return root;
  }

  public AtomicSwitchDrain.Control control() {
    return root.control();
  }

  /**
   * Returns the slot holding the most recent drain failure seen by this pipeline.
   *
   * @return failure slot
   */
  public LastErrorSlot lastErrors() {
    return lastErrors;
  }

  /**
   * Creates a root logger over this pipeline whose failures go to the pipeline's error handler.
   *
   * @param pairs root context
   * @return root logger
   */
  public Logger rootLogger(KeyValue... pairs) {
    return Logger.builder(root).with(pairs).errorHandler(errorHandler).build();
  }

  /**
   * Flushes and releases everything this pipeline opened, in wiring order. Idempotent.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (AutoCloseable closeable : closeables) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close {} for pipeline {}", closeable.getClass().getSimpleName(), config.name(), ex);
      }
    }
    log.debug("Pipeline {} closed", config.name());
  }

  List<AutoCloseable> closeables() {
    return Collections.unmodifiableList(closeables);
  }
}
