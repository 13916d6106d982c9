/**
 * Loggers: immutable handles that carry context down a hierarchy and emit records to a shared drain.
 */
package ca.gc.cra.rill.application.logger;
