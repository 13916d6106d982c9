package ca.gc.cra.rill.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider behind {@link OpenTelemetryMetricsAdapter}.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.rill";
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  /**
   * Initializes metrics for the given exporter, falling back to a noop meter on any failure.
   *
   * @param exporter exporter mode
   * @param endpoint OTLP endpoint; {@link #DEFAULT_ENDPOINT} when blank
   * @param serviceName value of the {@code service.name} resource attribute
   * @return bootstrap result; never {@code null}
   */
  static BootstrapResult initialize(ExporterMode exporter, String endpoint, String serviceName) {
    if (exporter == ExporterMode.NONE) {
      log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
      return BootstrapResult.noop();
    }
    try {
      String target = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
      OtlpGrpcMetricExporter otlp = OtlpGrpcMetricExporter.builder().setEndpoint(target).build();
      MetricReader reader = PeriodicMetricReader.builder(otlp).setInterval(EXPORT_INTERVAL).build();
      BootstrapResult result = build(reader, serviceName);
      log.info("OpenTelemetry metrics initialized with exporter {} targeting {}", exporter, target);
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), "rill");
  }

  private static BootstrapResult build(MetricReader reader, String serviceName) {
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(buildResource(serviceName))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).build();
    return BootstrapResult.active(provider, meter);
  }

  private static Resource buildResource(String serviceName) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, serviceName == null || serviceName.isBlank() ? "rill" : serviceName.trim());
    String instanceId = detectInstanceId();
    if (!instanceId.isBlank()) {
      builder.put(SERVICE_INSTANCE_ID, instanceId);
    }
    return Resource.getDefault().merge(Resource.create(builder.build()));
  }

  private static String detectInstanceId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Falling back to process id for instance id", ex);
      return Long.toString(ProcessHandle.current().pid());
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> throw new IllegalArgumentException("Unknown metrics exporter '" + raw + "'");
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;
    private final boolean noop;

    private BootstrapResult(Meter meter, SdkMeterProvider provider, boolean noop) {
      this.meter = meter;
      this.provider = provider;
      this.noop = noop;
    }

    static BootstrapResult noop() {
      Meter meter = MeterProvider.noop().get(INSTRUMENTATION_SCOPE);
      return new BootstrapResult(meter, null, true);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, provider, false);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return noop;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown();
        shutdown.join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
