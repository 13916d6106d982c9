/**
 * <strong>Purpose:</strong> Ports of the logging pipeline: the drain capability, its failure types, the out-of-band
 * error channel, and the clock and metrics abstractions.
 * <p><strong>Pipeline role:</strong> Loggers call {@link ca.gc.cra.rill.application.port.Drain}; combinators and sinks
 * implement it.
 * <p><strong>Concurrency:</strong> Implementations document their guarantees; the core may call drains concurrently.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rill.application.port;
