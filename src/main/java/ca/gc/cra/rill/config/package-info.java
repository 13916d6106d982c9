/**
 * <strong>Purpose:</strong> YAML configuration and wiring of drain pipelines.
 * <p><strong>Pipeline role:</strong> Composition root; the only place that knows concrete sinks.
 * <p><strong>Concurrency:</strong> Built once at startup; the resulting {@code Pipeline} is thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rill.config;
