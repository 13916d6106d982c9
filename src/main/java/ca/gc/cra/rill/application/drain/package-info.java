/**
 * <strong>Purpose:</strong> Drain combinators: discard, level and predicate filters, fan-out, runtime switching,
 * asynchronous hand-off, and failure policies.
 * <p><strong>Pipeline role:</strong> Sit between loggers and concrete sinks; compose freely because each is a
 * {@link ca.gc.cra.rill.application.port.Drain}.
 * <p><strong>Concurrency:</strong> Filters and fan-out inherit the thread-safety of their children; the switch is
 * lock-free; the async drain serializes calls onto one worker thread.
 * <p><strong>Performance:</strong> Short-circuiting combinators never iterate the field sequence.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rill.application.drain;
