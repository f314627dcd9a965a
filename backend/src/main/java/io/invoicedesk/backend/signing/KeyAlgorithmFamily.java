package io.invoicedesk.backend.signing;

import java.security.Key;

/** Key families the signer supports, each with its SHA-256 signature scheme. */
public enum KeyAlgorithmFamily {
  RSA("SHA256withRSA"),
  EC("SHA256withECDSA");

  private final String signatureAlgorithm;

  KeyAlgorithmFamily(String signatureAlgorithm) {
    this.signatureAlgorithm = signatureAlgorithm;
  }

  public String signatureAlgorithm() {
    return signatureAlgorithm;
  }

  /**
   * Classifies the capability's key. Falls back to the certificate's public key when a token
   * hides the private key algorithm.
   *
   * @throws SigningException if key material is missing or of an unsupported family
   */
  public static KeyAlgorithmFamily classify(SigningCapability capability) {
    if (capability == null || capability.privateKey() == null || capability.certificate() == null) {
      throw new SigningException("signing.key_missing", "No private key or certificate available");
    }
    String algorithm = algorithmOf(capability.privateKey());
    if (algorithm == null) {
      algorithm = algorithmOf(capability.certificate().getPublicKey());
    }
    if (algorithm == null) {
      throw new SigningException(
          "signing.unsupported_algorithm", "Cannot determine the signing key algorithm");
    }
    return switch (algorithm.toUpperCase()) {
      case "RSA" -> RSA;
      case "EC", "ECDSA" -> EC;
      default ->
          throw new SigningException(
              "signing.unsupported_algorithm",
              "Unsupported signing key algorithm " + algorithm + "; expected RSA or EC");
    };
  }

  private static String algorithmOf(Key key) {
    return key != null ? key.getAlgorithm() : null;
  }
}
