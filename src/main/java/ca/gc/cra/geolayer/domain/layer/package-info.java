/**
 * <strong>Purpose:</strong> Layer blueprints, render descriptors, signatures and handles of attached layers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.domain.layer;
