/**
 * Log event metadata: severity levels, call-site locations, and the per-call record.
 * <p><strong>Role:</strong> Domain layer inputs produced by loggers and consumed by drains.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe across threads.</p>
 */
package ca.gc.cra.rill.domain.record;
