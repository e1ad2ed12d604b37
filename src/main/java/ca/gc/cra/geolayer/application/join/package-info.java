/**
 * <strong>Purpose:</strong> Geographic join of analysis records with boundary geometry through ordered
 * identifier normalization strategies.
 * <p><strong>Concurrency:</strong> The engine is safe for concurrent joins; boundary indexes are immutable.
 * <p><strong>Observability:</strong> Emits {@code join.*} metrics and a WARN summary of unmatched records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.application.join;
