/**
 * <strong>Purpose:</strong> Validation helpers applied while parsing pipeline configuration.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rill.validation;
