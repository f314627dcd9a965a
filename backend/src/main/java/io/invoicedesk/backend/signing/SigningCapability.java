package io.invoicedesk.backend.signing;

import java.security.PrivateKey;
import java.security.Provider;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * A usable signing key: the private key, its certificate and the chain to embed.
 *
 * @param provider JCA provider holding the key (e.g. a PKCS#11 token), or null for the default
 *     provider lookup
 */
public record SigningCapability(
    PrivateKey privateKey,
    X509Certificate certificate,
    List<X509Certificate> chain,
    Provider provider) {

  public SigningCapability {
    if (chain == null || chain.isEmpty()) {
      chain = certificate != null ? List.of(certificate) : List.of();
    } else {
      chain = List.copyOf(chain);
    }
  }

  public SigningCapability(PrivateKey privateKey, X509Certificate certificate) {
    this(privateKey, certificate, null, null);
  }

  public String subject() {
    return certificate != null ? certificate.getSubjectX500Principal().getName() : "unknown";
  }
}
