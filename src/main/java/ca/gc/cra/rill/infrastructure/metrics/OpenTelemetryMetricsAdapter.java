package ca.gc.cra.rill.infrastructure.metrics;

import ca.gc.cra.rill.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards pipeline counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created on first use and cached per key. Closing the adapter shuts down the meter
 * provider it owns.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("rill.metric.key");
  private static final String FALLBACK_METRIC_NAME = "rill.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter for the named exporter.
   *
   * @param exporter {@code otlp} or {@code none}
   * @param endpoint OTLP gRPC endpoint; default used when blank
   * @param serviceName {@code service.name} resource attribute
   * @return adapter; noop-backed when the exporter is {@code none} or fails to start
   * @throws IllegalArgumentException when {@code exporter} is not recognised
   */
  public static OpenTelemetryMetricsAdapter create(String exporter, String endpoint, String serviceName) {
    OpenTelemetryBootstrap.ExporterMode mode = OpenTelemetryBootstrap.ExporterMode.from(exporter);
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.initialize(mode, endpoint, serviceName));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    CounterInstrument instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    HistogramInstrument instrument = histograms.computeIfAbsent(effectiveKey, this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  /**
   * Returns whether metrics are being discarded.
   *
   * @return {@code true} when backed by the noop meter
   */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private CounterInstrument createCounter(String key) {
    String sanitized = sanitizeName(key);
    LongCounter counter = meter
        .counterBuilder(sanitized)
        .setUnit("1")
        .setDescription("RILL counter for " + key)
        .build();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, sanitized);
    }
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    String sanitized = sanitizeName(key);
    LongHistogram histogram = meter
        .histogramBuilder(sanitized)
        .ofLongs()
        .setDescription("RILL observation for " + key)
        .build();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, sanitized);
    }
    return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
