package io.invoicedesk.backend.signing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.invoicedesk.backend.exception.ErrorKind;
import java.security.KeyPairGenerator;
import org.junit.jupiter.api.Test;

class KeyAlgorithmFamilyTest {

  @Test
  void classifiesRsaAndEcKeys() throws Exception {
    assertThat(KeyAlgorithmFamily.classify(TestKeys.rsa())).isEqualTo(KeyAlgorithmFamily.RSA);
    assertThat(KeyAlgorithmFamily.classify(TestKeys.ec())).isEqualTo(KeyAlgorithmFamily.EC);
    assertThat(KeyAlgorithmFamily.EC.signatureAlgorithm()).isEqualTo("SHA256withECDSA");
  }

  @Test
  void rejectsMissingKeyMaterial() throws Exception {
    var rsa = TestKeys.rsa();

    assertThatThrownBy(() -> KeyAlgorithmFamily.classify(null))
        .isInstanceOf(SigningException.class);
    assertThatThrownBy(
            () -> KeyAlgorithmFamily.classify(new SigningCapability(null, rsa.certificate())))
        .isInstanceOf(SigningException.class)
        .satisfies(e -> assertThat(ErrorKind.of(e)).isEqualTo(ErrorKind.SIGNING_ERROR));
  }

  @Test
  void capabilityWithoutCertificateIsRejectedAsSigningError() throws Exception {
    var capability = new SigningCapability(TestKeys.rsa().privateKey(), null);

    assertThat(capability.chain()).isEmpty();
    assertThatThrownBy(() -> KeyAlgorithmFamily.classify(capability))
        .isInstanceOfSatisfying(
            SigningException.class,
            e ->
                assertThat(e.getBody().getProperties())
                    .containsEntry(ErrorKind.CODE_PROPERTY, "signing.key_missing"));
  }

  @Test
  void rejectsUnsupportedAlgorithm() throws Exception {
    var generator = KeyPairGenerator.getInstance("DSA");
    generator.initialize(2048);
    var dsaKey = generator.generateKeyPair().getPrivate();
    var capability = new SigningCapability(dsaKey, TestKeys.rsa().certificate());

    assertThatThrownBy(() -> KeyAlgorithmFamily.classify(capability))
        .isInstanceOf(SigningException.class)
        .satisfies(
            e -> assertThat(((SigningException) e).getBody().getDetail()).contains("DSA"));
  }
}
