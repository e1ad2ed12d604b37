/**
 * <strong>Purpose:</strong> Layer synthesis: filtering, volume capping, geometry projection and field schema
 * inference for joined analysis records.
 * <p><strong>Concurrency:</strong> Stateless services; safe to call from concurrent build routines.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.application.synth;
