package ca.gc.cra.rill.config;

import ca.gc.cra.rill.application.drain.AsyncDrain;
import ca.gc.cra.rill.application.drain.OverflowStrategy;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.validation.Numbers;
import ca.gc.cra.rill.validation.Strings;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Validated settings for one logging pipeline.
 *
 * <p>Recognised keys, all optional:</p>
 * <ul>
 *   <li>{@code level} threshold passed to the level filter, default {@code info}</li>
 *   <li>{@code sink} one of {@code slf4j}, {@code json}, {@code discard}, default {@code slf4j}</li>
 *   <li>{@code json.path} output file, required when {@code sink=json}</li>
 *   <li>{@code slf4j.logger}, {@code slf4j.maxValueBytes}, {@code slf4j.redact} SLF4J bridge tuning</li>
 *   <li>{@code async.enabled}, {@code async.capacity}, {@code async.overflow}, {@code async.threadName}</li>
 *   <li>{@code metrics.exporter} ({@code none} or {@code otlp}) and {@code metrics.endpoint}; when absent the
 *       {@code otel.metrics.exporter} system property and {@code OTEL_METRICS_EXPORTER} environment variable
 *       are consulted</li>
 *   <li>{@code diagnostics.verbose} lowers RILL's own loggers to DEBUG</li>
 * </ul>
 *
 * @param name pipeline name, used as the metrics service name
 * @param level level filter threshold
 * @param sink terminal sink
 * @param jsonPath JSON lines file; {@code null} unless {@code sink=json}
 * @param slf4jLogger SLF4J logger name for the bridge sink
 * @param slf4jMaxValueBytes per-value byte budget for the bridge sink
 * @param redactedKeys keys masked by the bridge sink
 * @param asyncEnabled whether an async stage sits in front of the sink
 * @param async async stage tuning
 * @param metricsExporter {@code none} or {@code otlp}
 * @param metricsEndpoint OTLP endpoint; blank for the exporter default
 * @param verbose whether to enable debug diagnostics
 * @since 0.1.0
 */
public record PipelineConfig(
    String name,
    Level level,
    SinkType sink,
    Path jsonPath,
    String slf4jLogger,
    int slf4jMaxValueBytes,
    Set<String> redactedKeys,
    boolean asyncEnabled,
    AsyncDrain.Settings async,
    String metricsExporter,
    String metricsEndpoint,
    boolean verbose) {

  private static final int MAX_ASYNC_CAPACITY = 1_000_000;
  private static final int MAX_THREAD_NAME = 64;

  public PipelineConfig {
    name = Strings.requirePrintableAscii("name", name, MAX_THREAD_NAME);
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(sink, "sink");
    if (sink == SinkType.JSON && jsonPath == null) {
      throw new IllegalArgumentException("json.path is required when sink=json");
    }
    slf4jLogger = Strings.requireNonBlank("slf4j.logger", slf4jLogger);
    Numbers.requireRange("slf4j.maxValueBytes", slf4jMaxValueBytes, 16, 1_048_576);
    redactedKeys = Set.copyOf(redactedKeys);
    Objects.requireNonNull(async, "async");
    metricsExporter = Objects.requireNonNullElse(metricsExporter, "none").trim().toLowerCase(Locale.ROOT);
    if (!metricsExporter.equals("none") && !metricsExporter.equals("otlp")) {
      throw new IllegalArgumentException(
          "metrics.exporter must be none or otlp (was '" + metricsExporter + "')");
    }
    metricsEndpoint = Objects.requireNonNullElse(metricsEndpoint, "").trim();
  }

  /**
   * Returns the defaults: info threshold, SLF4J sink, blocking async stage of 128, metrics off.
   *
   * @param name pipeline name
   * @return default configuration
   */
  public static PipelineConfig defaults(String name) {
    return fromMap(name, Map.of());
  }

  /**
   * Builds a configuration from flattened keys, such as those produced by {@link YamlConfigLoader}.
   *
   * @param name pipeline name
   * @param values flattened settings
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static PipelineConfig fromMap(String name, Map<String, String> values) {
    return fromMap(name, values, System::getProperty, System::getenv);
  }

  static PipelineConfig fromMap(
      String name,
      Map<String, String> values,
      Function<String, String> systemProperties,
      Function<String, String> environment) {
    Objects.requireNonNull(values, "values");
    Level level = Level.parse(value(values, "level", "info"));
    SinkType sink = SinkType.parse(value(values, "sink", "slf4j"));
    String rawPath = value(values, "json.path", "");
    Path jsonPath = rawPath.isEmpty() ? null : Path.of(Strings.requireNonBlank("json.path", rawPath));

    int capacity = Numbers.parseIntInRange(
        "async.capacity", value(values, "async.capacity", "128"), 1, MAX_ASYNC_CAPACITY);
    OverflowStrategy overflow = OverflowStrategy.parse(value(values, "async.overflow", "block"));
    String threadName = Strings.requirePrintableAscii(
        "async.threadName", value(values, "async.threadName", "rill-async"), MAX_THREAD_NAME);

    String exporter = value(values, "metrics.exporter",
        firstNonBlank(systemProperties.apply("otel.metrics.exporter"),
            environment.apply("OTEL_METRICS_EXPORTER"), "none"));
    String endpoint = value(values, "metrics.endpoint",
        firstNonBlank(systemProperties.apply("otel.exporter.otlp.metrics.endpoint"),
            environment.apply("OTEL_EXPORTER_OTLP_METRICS_ENDPOINT"), ""));

    return new PipelineConfig(
        name,
        level,
        sink,
        jsonPath,
        value(values, "slf4j.logger", "rill"),
        Numbers.parseIntInRange(
            "slf4j.maxValueBytes", value(values, "slf4j.maxValueBytes", "1024"), 16, 1_048_576),
        splitKeys(value(values, "slf4j.redact", "")),
        parseBoolean("async.enabled", value(values, "async.enabled", "true")),
        new AsyncDrain.Settings(capacity, overflow, threadName),
        exporter,
        endpoint,
        parseBoolean("diagnostics.verbose", value(values, "diagnostics.verbose", "false")));
  }

  private static String value(Map<String, String> values, String key, String fallback) {
    String raw = values.get(key);
    return raw == null || raw.isBlank() ? fallback : raw.trim();
  }

  private static String firstNonBlank(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return "";
  }

  private static boolean parseBoolean(String key, String raw) {
    return switch (raw.toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
    };
  }

  private static Set<String> splitKeys(String raw) {
    Set<String> keys = new LinkedHashSet<>();
    Arrays.stream(raw.split(","))
        .map(String::trim)
        .filter(key -> !key.isEmpty())
        .forEach(keys::add);
    return keys;
  }
}
