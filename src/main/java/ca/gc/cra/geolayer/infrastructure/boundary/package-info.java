/**
 * File-backed boundary store adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.infrastructure.boundary;
