/**
 * <strong>Purpose:</strong> Immutable analysis records, boundary geometry and joined records.
 * <p><strong>Concurrency:</strong> All types are immutable value records, safe to share across threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.domain.geo;
