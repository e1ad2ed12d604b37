package ca.gc.cra.geolayer.application.pipeline;

import ca.gc.cra.geolayer.application.cache.HostSession;
import ca.gc.cra.geolayer.application.cache.LayerOutcome;
import ca.gc.cra.geolayer.application.join.GeographicJoinEngine;
import ca.gc.cra.geolayer.application.join.JoinResult;
import ca.gc.cra.geolayer.application.port.BoundaryStore;
import ca.gc.cra.geolayer.application.synth.LayerSynthesizer;
import ca.gc.cra.geolayer.domain.geo.AnalysisBatch;
import ca.gc.cra.geolayer.domain.geo.BoundarySet;
import ca.gc.cra.geolayer.domain.layer.LayerDescriptor;
import ca.gc.cra.geolayer.domain.layer.MapLayer;
import ca.gc.cra.geolayer.domain.layer.RenderRules;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one visualization request end to end: join, signature, cached layer build.
 * <p><strong>Role:</strong> Application service bridging the join engine, synthesizer and the host's layer
 * cache.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load boundaries, failing fast when they are unavailable.</li>
 *   <li>Join records and derive the request signature.</li>
 *   <li>Acquire the layer through the cache with a build routine that synthesizes on the build executor.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent requests; coordination happens in the cache.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code pipeline=visualize} while preparing a request.</p>
 *
 * @since 0.1.0
 */
public final class VisualizationUseCase {
  private static final Logger log = LoggerFactory.getLogger(VisualizationUseCase.class);
  private static final String MDC_PIPELINE = "pipeline";

  private final BoundaryStore boundaryStore;
  private final GeographicJoinEngine joinEngine;
  private final LayerSynthesizer synthesizer;
  private final SignatureFactory signatures;
  private final MapLayerFactory layers;
  private final HostSession session;
  private final Executor buildExecutor;

  /**
   * Creates the use case.
   *
   * @param boundaryStore boundary source
   * @param joinEngine join engine
   * @param synthesizer layer synthesizer
   * @param signatures signature factory
   * @param layers layer factory
   * @param session host session owning the layer cache
   * @param buildExecutor executor running synthesis
   */
  public VisualizationUseCase(
      BoundaryStore boundaryStore,
      GeographicJoinEngine joinEngine,
      LayerSynthesizer synthesizer,
      SignatureFactory signatures,
      MapLayerFactory layers,
      HostSession session,
      Executor buildExecutor) {
    this.boundaryStore = Objects.requireNonNull(boundaryStore, "boundaryStore");
    this.joinEngine = Objects.requireNonNull(joinEngine, "joinEngine");
    this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
    this.signatures = Objects.requireNonNull(signatures, "signatures");
    this.layers = Objects.requireNonNull(layers, "layers");
    this.session = Objects.requireNonNull(session, "session");
    this.buildExecutor = Objects.requireNonNull(buildExecutor, "buildExecutor");
  }

  /**
   * Joins a batch and renders it as the host's analysis layer.
   *
   * @param batch analysis records
   * @param rules render descriptor
   * @return outcome shared with any concurrent request for the same signature
   * @throws ca.gc.cra.geolayer.application.join.BoundaryUnavailableException when boundaries cannot be loaded
   */
  public CompletableFuture<LayerOutcome> visualize(AnalysisBatch batch, RenderRules rules) {
    return render(prepare(batch, rules));
  }

  /**
   * Joins a batch and computes its signature without touching the cache.
   *
   * @param batch analysis records
   * @param rules render descriptor
   * @return joined run
   * @throws ca.gc.cra.geolayer.application.join.BoundaryUnavailableException when boundaries cannot be loaded
   */
  public JoinRun prepare(AnalysisBatch batch, RenderRules rules) {
    Objects.requireNonNull(batch, "batch");
    Objects.requireNonNull(rules, "rules");
    String previous = MDC.get(MDC_PIPELINE);
    MDC.put(MDC_PIPELINE, "visualize");
    try {
      BoundarySet boundaries = boundaryStore.boundaries();
      JoinResult joined = joinEngine.joinWithReport(batch.records(), boundaries);
      JoinRun run = new JoinRun(
          batch.targetVariable(),
          rules,
          joined.records(),
          joined.report(),
          signatures.signatureFor(batch.targetVariable(), rules, joined.records()));
      log.debug("Prepared visualization {} for {} ({} records)",
          run.signature().shortForm(), run.targetVariable(), run.records().size());
      return run;
    } finally {
      if (previous == null) {
        MDC.remove(MDC_PIPELINE);
      } else {
        MDC.put(MDC_PIPELINE, previous);
      }
    }
  }

  /**
   * Renders a prepared run through the host's layer cache.
   *
   * @param run joined run
   * @return cache outcome
   */
  public CompletableFuture<LayerOutcome> render(JoinRun run) {
    Objects.requireNonNull(run, "run");
    return session.cache().acquire(run.signature(), signature ->
        CompletableFuture.supplyAsync(() -> materialize(run), buildExecutor));
  }

  /**
   * Synthesizes the layer blueprint of a run without attaching it.
   *
   * @param run joined run
   * @return layer descriptor
   * @throws ca.gc.cra.geolayer.application.synth.SynthesisEmptyException when nothing is renderable
   */
  public LayerDescriptor preview(JoinRun run) {
    Objects.requireNonNull(run, "run");
    return synthesizer.synthesize(run.records(), run.rules(), run.targetVariable());
  }

  private MapLayer materialize(JoinRun run) {
    return layers.materialize(preview(run), run.signature());
  }
}
