/**
 * Executor factories for layer builds and build deadlines.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.infrastructure.exec;
