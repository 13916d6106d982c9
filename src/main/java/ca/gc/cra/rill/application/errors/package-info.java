/**
 * Out-of-band drain failure handlers.
 * <p><strong>Concurrency:</strong> Handlers are invoked from logging threads and async workers; all are thread-safe.
 */
package ca.gc.cra.rill.application.errors;
