package ca.gc.cra.rill.config;

import ca.gc.cra.rill.application.drain.AsyncDrain;
import ca.gc.cra.rill.application.drain.AtomicSwitchDrain;
import ca.gc.cra.rill.application.drain.DiscardDrain;
import ca.gc.cra.rill.application.drain.LevelFilterDrain;
import ca.gc.cra.rill.application.errors.LastErrorSlot;
import ca.gc.cra.rill.application.errors.LoggingDrainErrorHandler;
import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainErrorHandler;
import ca.gc.cra.rill.application.port.MetricsPort;
import ca.gc.cra.rill.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.rill.infrastructure.sink.JsonLinesDrain;
import ca.gc.cra.rill.infrastructure.sink.Slf4jDrain;
import ca.gc.cra.rill.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires pipelines from configuration: sink, level filter, optional async stage, and a switch on top.
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private CompositionRoot() {}

  /**
   * Loads the {@code pipeline} section of a YAML file and builds it. Missing files yield the defaults.
   *
   * @param path YAML configuration
   * @param pipeline pipeline section name
   * @return running pipeline
   * @throws IOException when the configuration or a sink file cannot be opened
   */
  public static Pipeline fromYaml(Path path, String pipeline) throws IOException {
    Map<String, String> values = YamlConfigLoader.load(path, pipeline).orElseGet(() -> {
      log.info("No configuration at {}; using defaults for pipeline {}", path, pipeline);
      return Map.of();
    });
    return build(PipelineConfig.fromMap(pipeline, values));
  }

  /**
   * Builds and starts a pipeline.
   *
   * @param config validated configuration
   * @return running pipeline; the caller must close it
   * @throws IOException when the sink file cannot be opened
   */
  public static Pipeline build(PipelineConfig config) throws IOException {
    return build(config, CompositionRoot::createMetrics);
  }

  static Pipeline build(PipelineConfig config, Function<PipelineConfig, MetricsPort> metricsFactory)
      throws IOException {
    Objects.requireNonNull(config, "config");
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    MetricsPort metrics = Objects.requireNonNullElse(metricsFactory.apply(config), MetricsPort.NO_OP);
    AutoCloseable metricsResource = metrics instanceof AutoCloseable ? (AutoCloseable) metrics : null;

    LastErrorSlot lastErrors = new LastErrorSlot();
    DrainErrorHandler errorHandler = new LoggingDrainErrorHandler(metrics).andThen(lastErrors);

    List<AutoCloseable> closeables = new ArrayList<>();
    Drain sink;
    try {
      sink = buildSink(config, closeables);
    } catch (IOException | RuntimeException ex) {
      if (metricsResource != null) {
        closeAfterFailure(metricsResource, ex);
      }
      throw ex;
    }
    if (metricsResource != null) {
      // Exporter goes last so it still sees counters from the async flush and the sink.
      closeables.add(metricsResource);
    }
    Drain top = new LevelFilterDrain(config.level(), sink);
    if (config.asyncEnabled()) {
      AsyncDrain async = new AsyncDrain(top, config.async(), errorHandler, metrics);
      // Flush the queue before the sink behind it is closed.
      closeables.add(0, async);
      top = async;
    }
    log.info(
        "Built pipeline {}: sink={} level={} async={}",
        config.name(),
        config.sink(),
        config.level(),
        config.asyncEnabled() ? config.async() : "off");
    return new Pipeline(config, new AtomicSwitchDrain(top), errorHandler, lastErrors, closeables);
  }

  private static MetricsPort createMetrics(PipelineConfig config) {
    if (config.metricsExporter().equals("none")) {
      return MetricsPort.NO_OP;
    }
    return OpenTelemetryMetricsAdapter.create(config.metricsExporter(), config.metricsEndpoint(), config.name());
  }

  private static void closeAfterFailure(AutoCloseable metricsResource, Exception cause) {
    try {
      metricsResource.close();
    } catch (Exception closeFailure) {
      log.warn("Failed to close metrics exporter after pipeline build failure", closeFailure);
      cause.addSuppressed(closeFailure);
    }
  }

  private static Drain buildSink(PipelineConfig config, List<AutoCloseable> closeables) throws IOException {
    return switch (config.sink()) {
      case SLF4J -> new Slf4jDrain(
          LoggerFactory.getLogger(config.slf4jLogger()),
          config.redactedKeys(),
          config.slf4jMaxValueBytes());
      case JSON -> {
        JsonLinesDrain json = JsonLinesDrain.open(config.jsonPath());
        closeables.add(json);
        yield json;
      }
      case DISCARD -> DiscardDrain.INSTANCE;
    };
  }
}
