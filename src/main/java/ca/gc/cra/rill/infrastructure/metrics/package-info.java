/**
 * <strong>Purpose:</strong> Metrics adapters implementing {@link ca.gc.cra.rill.application.port.MetricsPort}.
 * <p><strong>Pipeline role:</strong> Receives async queue, drop, and failure counters from drains.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe; OpenTelemetry instruments are cached in concurrent maps.
 * <p><strong>Observability:</strong> Exports through OTLP gRPC when enabled; otherwise discards.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rill.infrastructure.metrics;
