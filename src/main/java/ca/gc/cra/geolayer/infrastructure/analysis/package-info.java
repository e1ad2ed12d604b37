/**
 * File-backed analysis source adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.infrastructure.analysis;
