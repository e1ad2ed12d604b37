package ca.gc.cra.geolayer.application.pipeline;

import ca.gc.cra.geolayer.domain.geo.JoinedRecord;
import ca.gc.cra.geolayer.domain.layer.RenderRules;
import ca.gc.cra.geolayer.domain.layer.VisualizationSignature;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Derives deterministic visualization signatures.
 *
 * <p>The signature is the SHA-256 of the target variable, the render-rules fingerprint, the record count and
 * a digest of the ordered {@code (areaId, score)} pairs. Equal inputs always yield equal signatures.</p>
 *
 * @since 0.1.0
 */
public final class SignatureFactory {
  private static final ThreadLocal<MessageDigest> SHA256 = ThreadLocal.withInitial(SignatureFactory::initSha256);
  private static final HexFormat HEX = HexFormat.of();

  /**
   * Computes the signature for one visualization request.
   *
   * @param targetVariable analysed variable
   * @param rules render descriptor
   * @param records joined records in producer order
   * @return signature
   */
  public VisualizationSignature signatureFor(
      String targetVariable, RenderRules rules, List<JoinedRecord> records) {
    Objects.requireNonNull(targetVariable, "targetVariable");
    Objects.requireNonNull(rules, "rules");
    Objects.requireNonNull(records, "records");

    MessageDigest digest = SHA256.get();
    digest.reset();
    for (JoinedRecord record : records) {
      update(digest, record.areaId());
      digest.update((byte) '=');
      update(digest, record.score() == null ? "" : Double.toString(record.score()));
      digest.update((byte) ';');
    }
    String recordFingerprint = HEX.formatHex(digest.digest());

    digest.reset();
    update(digest, "tv=" + targetVariable);
    digest.update((byte) '|');
    update(digest, "rules=" + rules.fingerprint());
    digest.update((byte) '|');
    update(digest, "count=" + records.size());
    digest.update((byte) '|');
    update(digest, "records=" + recordFingerprint);
    return VisualizationSignature.of(HEX.formatHex(digest.digest()));
  }

  private static void update(MessageDigest digest, String text) {
    digest.update(text.getBytes(StandardCharsets.UTF_8));
  }

  private static MessageDigest initSha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
