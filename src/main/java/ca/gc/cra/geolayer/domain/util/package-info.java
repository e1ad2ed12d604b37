/**
 * Attribute map helpers shared by the domain records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.domain.util;
