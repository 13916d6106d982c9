/**
 * Executor construction for asynchronous drain workers.
 */
package ca.gc.cra.rill.infrastructure.exec;
