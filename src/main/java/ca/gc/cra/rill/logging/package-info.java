/**
 * Logging backend helpers shared by the SLF4J sink and pipeline bootstrap.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rill.logging;
