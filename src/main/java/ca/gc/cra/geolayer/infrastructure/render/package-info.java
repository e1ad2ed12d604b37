/**
 * Render descriptor readers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.infrastructure.render;
