/**
 * <strong>Purpose:</strong> Structured fields and the context chain that carries them through a logger hierarchy.
 * <p><strong>Pipeline role:</strong> Loggers build {@link ca.gc.cra.rill.domain.kv.Fields} from call-site pairs
 * and their {@link ca.gc.cra.rill.domain.kv.ContextNode}; drains resolve and serialize them.
 * <p><strong>Concurrency:</strong> Nodes and pairs are immutable; lazy computations must be thread-safe.
 * <p><strong>Performance:</strong> Child creation copies only the new pairs; enumeration is lazy.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rill.domain.kv;
