/**
 * <strong>Purpose:</strong> Application services: geographic join, layer synthesis, the per-host layer cache and
 * the pipeline that connects them.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.application;
