package ca.gc.cra.geolayer.application.cache;

import ca.gc.cra.geolayer.domain.layer.LayerBuildException;
import ca.gc.cra.geolayer.domain.layer.LayerHandle;
import ca.gc.cra.geolayer.domain.layer.VisualizationSignature;
import java.util.Objects;

/**
 * Result delivered to every caller waiting on one layer build.
 *
 * <p>All waiters of a build receive the same outcome instance.</p>
 *
 * @since 0.1.0
 */
public sealed interface LayerOutcome
    permits LayerOutcome.Attached, LayerOutcome.Superseded, LayerOutcome.TimedOut, LayerOutcome.Failed {

  /**
   * Returns the signature this outcome answers.
   *
   * @return requested signature
   */
  VisualizationSignature signature();

  /**
   * Indicates whether the requested layer is attached.
   *
   * @return {@code true} for {@link Attached}
   */
  default boolean isAttached() {
    return this instanceof Attached;
  }

  /**
   * Returns the attached handle or throws the typed failure.
   *
   * @return attached handle
   * @throws LayerSupersededException for {@link Superseded}
   * @throws BuildTimeoutException for {@link TimedOut}
   * @throws LayerBuildException for {@link Failed}; build-level causes are rethrown as-is
   */
  default LayerHandle handleOrThrow() {
    if (this instanceof Attached attached) {
      return attached.handle();
    }
    if (this instanceof Superseded superseded) {
      throw new LayerSupersededException(superseded.signature(), superseded.winner());
    }
    if (this instanceof TimedOut timedOut) {
      throw new BuildTimeoutException(timedOut.signature());
    }
    Failed failed = (Failed) this;
    if (failed.cause() instanceof LayerBuildException buildFailure) {
      throw buildFailure;
    }
    throw new LayerBuildException(
        "layer build " + failed.signature().shortForm() + " failed: " + failed.cause().getMessage(),
        failed.cause());
  }

  /**
   * The requested layer is attached to the host.
   *
   * @param handle attached layer handle
   */
  record Attached(LayerHandle handle) implements LayerOutcome {
    /** Validates the handle. */
    public Attached {
      Objects.requireNonNull(handle, "handle");
    }

    @Override
    public VisualizationSignature signature() {
      return handle.signature();
    }
  }

  /**
   * A newer request won; the requested build result will never be attached.
   *
   * @param signature requested signature
   * @param winner signature of the newer request
   */
  record Superseded(VisualizationSignature signature, VisualizationSignature winner) implements LayerOutcome {
    /** Validates signatures. */
    public Superseded {
      Objects.requireNonNull(signature, "signature");
      Objects.requireNonNull(winner, "winner");
    }
  }

  /**
   * The build did not resolve before its deadline.
   *
   * @param signature requested signature
   */
  record TimedOut(VisualizationSignature signature) implements LayerOutcome {
    /** Validates the signature. */
    public TimedOut {
      Objects.requireNonNull(signature, "signature");
    }
  }

  /**
   * The build failed; the previously attached layer, if any, is untouched.
   *
   * @param signature requested signature
   * @param cause failure
   */
  record Failed(VisualizationSignature signature, Throwable cause) implements LayerOutcome {
    /** Validates fields. */
    public Failed {
      Objects.requireNonNull(signature, "signature");
      Objects.requireNonNull(cause, "cause");
    }
  }
}
