package io.invoicedesk.backend.signing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.invoicedesk.backend.document.ContentHashes;
import io.invoicedesk.backend.document.TestSnapshots;
import io.invoicedesk.backend.invoice.DocumentArtifact;
import java.time.Instant;
import java.util.Arrays;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class PdfDocumentSignerTest {

  private static byte[] unsigned;

  private final PdfDocumentSigner signer = new PdfDocumentSigner();
  private final SignedDocumentVerifier verifier = new SignedDocumentVerifier();

  @BeforeAll
  static void renderOnce() {
    unsigned = TestSnapshots.renderedPdf();
  }

  @Test
  void rsaSignatureIsCertifiedCadesDetached() throws Exception {
    var capability = TestKeys.rsa();

    byte[] signed =
        signer.sign(unsigned, capability, KeyAlgorithmFamily.RSA, "Invoice issued", "Sofia");

    var verification = verifier.verify(artifact(signed));
    assertThat(verification.valid()).isTrue();
    assertThat(verification.signatures()).hasSize(1);
    var check = verification.signatures().get(0);
    assertThat(check.fieldName()).startsWith(PdfDocumentSigner.FIELD_NAME_PREFIX);
    assertThat(check.subFilter()).isEqualTo("ETSI.CAdES.detached");
    assertThat(check.coversWholeDocument()).isTrue();
    assertThat(check.certifiedNoChanges()).isTrue();
    assertThat(check.signer()).contains("Invoice Desk Test");
  }

  @Test
  void ecSignatureVerifies() throws Exception {
    byte[] signed = signer.sign(unsigned, TestKeys.ec(), KeyAlgorithmFamily.EC, null, null);

    var verification = verifier.verify(artifact(signed));

    assertThat(verification.valid()).isTrue();
    assertThat(verification.signatures().get(0).certifiedNoChanges()).isTrue();
  }

  @Test
  void signingAppendsARevisionAndLeavesInputUntouched() throws Exception {
    byte[] copy = unsigned.clone();

    byte[] signed = signer.sign(copy, TestKeys.rsa(), KeyAlgorithmFamily.RSA, null, null);

    assertThat(copy).isEqualTo(unsigned);
    assertThat(signed.length).isGreaterThan(unsigned.length);
    assertThat(Arrays.copyOf(signed, unsigned.length)).isEqualTo(unsigned);
    assertThat(ContentHashes.sha256Hex(signed)).isNotEqualTo(ContentHashes.sha256Hex(unsigned));
  }

  @Test
  void catalogDeclaresDocMdpPermission() throws Exception {
    byte[] signed = signer.sign(unsigned, TestKeys.rsa(), KeyAlgorithmFamily.RSA, null, null);

    try (PDDocument document = PDDocument.load(signed)) {
      var perms =
          document.getDocumentCatalog().getCOSObject().getDictionaryObject(COSName.PERMS);
      assertThat(perms).isNotNull();
    }
  }

  @Test
  void tamperedBytesFailVerification() throws Exception {
    byte[] signed = signer.sign(unsigned, TestKeys.rsa(), KeyAlgorithmFamily.RSA, null, null);
    var stored = artifact(signed);
    byte[] tampered = signed.clone();
    // first bytes sit inside the signed byte range
    tampered[10] = (byte) (tampered[10] ^ 0x01);

    var verification =
        verifier.verify(
            new DocumentArtifact(
                tampered, stored.getFileName(), stored.getSha256(), stored.getCreatedAt()));

    assertThat(verification.hashMatches()).isFalse();
    assertThat(verification.valid()).isFalse();
  }

  @Test
  void unsignedDocumentHasNoValidSignature() {
    var verification = verifier.verify(artifact(unsigned));

    assertThat(verification.hashMatches()).isTrue();
    assertThat(verification.signatures()).isEmpty();
    assertThat(verification.valid()).isFalse();
  }

  @Test
  void garbageInputIsASigningError() throws Exception {
    var capability = TestKeys.rsa();

    assertThatThrownBy(
            () -> signer.sign(new byte[] {1, 2, 3}, capability, KeyAlgorithmFamily.RSA, null, null))
        .isInstanceOf(SigningException.class);
  }

  private static DocumentArtifact artifact(byte[] pdf) {
    return new DocumentArtifact(
        pdf, "invoice-inv42-signed.pdf", ContentHashes.sha256Hex(pdf), Instant.now());
  }
}
