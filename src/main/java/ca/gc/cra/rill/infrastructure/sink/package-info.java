/**
 * <strong>Purpose:</strong> Terminal drains that render records outside the process.
 * <p><strong>Pipeline role:</strong> Leaves of a drain tree: SLF4J bridge, JSON lines files, in-memory capture.
 * <p><strong>Concurrency:</strong> {@code InMemoryDrain} and {@code Slf4jDrain} are thread-safe;
 * {@code JsonLinesDrain} serializes writers internally.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rill.infrastructure.sink;
