package io.invoicedesk.backend.signing;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of checking a stored signed document.
 *
 * @param hashMatches the stored SHA-256 matches the stored bytes
 * @param signatures one entry per embedded signature, in document order
 */
public record SignatureVerification(
    String fileName,
    String storedSha256,
    String actualSha256,
    boolean hashMatches,
    List<SignatureCheck> signatures) {

  public SignatureVerification {
    signatures = List.copyOf(signatures);
  }

  /** Hash matches and every signature is cryptographically valid. */
  @JsonProperty("valid")
  public boolean valid() {
    return hashMatches
        && !signatures.isEmpty()
        && signatures.stream().allMatch(SignatureCheck::valid);
  }

  /**
   * @param coversWholeDocument the signed byte ranges reach the end of the file
   * @param certifiedNoChanges the signature certifies the document with DocMDP P=1
   * @param problem why the signature is invalid, null when valid
   */
  public record SignatureCheck(
      String fieldName,
      String subFilter,
      String signer,
      Instant signedAt,
      boolean coversWholeDocument,
      boolean certifiedNoChanges,
      boolean valid,
      String problem) {}
}
