/**
 * <strong>Purpose:</strong> Per-host visualization layer cache: single-flight builds keyed by signature, build
 * deadlines, last-request-wins superseding and atomic layer swaps.
 * <p><strong>Concurrency:</strong> One lock per cache guards slot state and host mutation; waiters share one
 * future per build.
 * <p><strong>Observability:</strong> {@code cache.*} metrics; INFO on attach, replace and cleanup, WARN on
 * timeouts and discarded late results.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.application.cache;
