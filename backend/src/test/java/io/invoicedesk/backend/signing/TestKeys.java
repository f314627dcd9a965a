package io.invoicedesk.backend.signing;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

/** Self-signed certificates generated at test time. */
final class TestKeys {

  private TestKeys() {}

  static SigningCapability rsa() throws Exception {
    return capability(rsaKeyPair(), "SHA256withRSA", KeyUsage.digitalSignature, Duration.ZERO);
  }

  static SigningCapability ec() throws Exception {
    var generator = KeyPairGenerator.getInstance("EC");
    generator.initialize(new ECGenParameterSpec("secp256r1"));
    return capability(
        generator.generateKeyPair(), "SHA256withECDSA", KeyUsage.nonRepudiation, Duration.ZERO);
  }

  /** RSA certificate that only allows key encipherment. */
  static SigningCapability encipherOnly() throws Exception {
    return capability(rsaKeyPair(), "SHA256withRSA", KeyUsage.keyEncipherment, Duration.ZERO);
  }

  /** RSA certificate whose validity ended weeks ago. */
  static SigningCapability expired() throws Exception {
    return capability(
        rsaKeyPair(), "SHA256withRSA", KeyUsage.digitalSignature, Duration.ofDays(400));
  }

  private static KeyPair rsaKeyPair() throws Exception {
    var generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    return generator.generateKeyPair();
  }

  private static SigningCapability capability(
      KeyPair keyPair, String algorithm, int keyUsage, Duration age) throws Exception {
    Instant notBefore = Instant.now().minus(Duration.ofDays(1)).minus(age);
    Instant notAfter = notBefore.plus(Duration.ofDays(365));
    var subject = new X500Name("CN=Invoice Desk Test, O=Test, C=BG");
    var builder =
        new JcaX509v3CertificateBuilder(
            subject,
            BigInteger.valueOf(System.nanoTime()),
            Date.from(notBefore),
            Date.from(notAfter),
            subject,
            keyPair.getPublic());
    builder.addExtension(Extension.keyUsage, true, new KeyUsage(keyUsage));
    var signer = new JcaContentSignerBuilder(algorithm).build(keyPair.getPrivate());
    X509Certificate certificate =
        new JcaX509CertificateConverter().getCertificate(builder.build(signer));
    return new SigningCapability(keyPair.getPrivate(), certificate);
  }
}
