/**
 * Jackson streaming helpers shared by the file adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.infrastructure.json;
