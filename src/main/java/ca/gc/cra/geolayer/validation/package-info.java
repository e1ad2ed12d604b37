/**
 * <strong>Purpose:</strong> Input validation helpers shared by configuration loading and the CLI.
 * <p><strong>Concurrency:</strong> Stateless; thread-safe.
 * <p><strong>Observability:</strong> Failures raise {@link java.lang.IllegalArgumentException} with the offending
 * parameter name.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.validation;
