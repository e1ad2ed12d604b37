/**
 * <strong>Purpose:</strong> Domain model of the analysis overlay: geography, layers and attribute helpers.
 * <p><strong>Concurrency:</strong> Value types only; no shared mutable state.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.domain;
