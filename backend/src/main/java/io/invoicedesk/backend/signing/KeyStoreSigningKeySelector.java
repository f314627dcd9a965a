package io.invoicedesk.backend.signing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.InvalidParameterException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.ProviderException;
import java.security.Security;
import java.security.cert.Certificate;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateNotYetValidException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Selects the signing key from a PKCS#12 file or a PKCS#11 token. Only entries with a private key
 * whose certificate is currently valid and allows digital signature or non-repudiation are
 * candidates. The configured alias wins; otherwise the first candidate is used.
 *
 * <p>The store is opened on every call so a token inserted after startup is picked up.
 */
@Component
@ConditionalOnProperty(name = "invoicedesk.signing.key-selector", havingValue = "keystore")
public class KeyStoreSigningKeySelector implements SigningKeySelector {

  private static final Logger log = LoggerFactory.getLogger(KeyStoreSigningKeySelector.class);

  private static final int KEY_USAGE_DIGITAL_SIGNATURE = 0;
  private static final int KEY_USAGE_NON_REPUDIATION = 1;

  private final SigningProperties properties;

  public KeyStoreSigningKeySelector(SigningProperties properties) {
    this.properties = properties;
  }

  @Override
  public Optional<SigningCapability> selectSigningKey() {
    try {
      Provider provider = null;
      KeyStore keyStore;
      if ("PKCS11".equalsIgnoreCase(properties.keystoreType())) {
        provider = pkcs11Provider();
        keyStore = KeyStore.getInstance("PKCS11", provider);
        keyStore.load(null, properties.keystorePasswordChars());
      } else {
        keyStore = KeyStore.getInstance(properties.keystoreType());
        try (InputStream in = Files.newInputStream(keyStorePath())) {
          keyStore.load(in, properties.keystorePasswordChars());
        }
      }
      return select(keyStore, provider);
    } catch (IOException | GeneralSecurityException e) {
      log.warn("Cannot open {} key store", properties.keystoreType(), e);
      throw new SigningException(
          "signing.keystore_unavailable",
          "The " + properties.keystoreType() + " key store cannot be opened",
          e);
    }
  }

  private Path keyStorePath() {
    if (properties.keystorePath() == null || properties.keystorePath().isBlank()) {
      throw new SigningException("signing.key_missing", "No key store file is configured");
    }
    try {
      return Path.of(properties.keystorePath());
    } catch (InvalidPathException e) {
      throw new SigningException("signing.key_missing", "The key store path is invalid", e);
    }
  }

  private Provider pkcs11Provider() {
    if (properties.pkcs11Config() == null || properties.pkcs11Config().isBlank()) {
      throw new SigningException("signing.key_missing", "No PKCS#11 configuration is set");
    }
    Provider base = Security.getProvider("SunPKCS11");
    if (base == null) {
      throw new SigningException("signing.key_missing", "The PKCS#11 provider is not available");
    }
    try {
      return base.configure(properties.pkcs11Config());
    } catch (InvalidParameterException | ProviderException e) {
      throw new SigningException(
          "signing.key_missing", "The PKCS#11 configuration cannot be applied", e);
    }
  }

  Optional<SigningCapability> select(KeyStore keyStore, Provider provider)
      throws GeneralSecurityException {
    List<String> candidates = new ArrayList<>();
    for (String alias : Collections.list(keyStore.aliases())) {
      if (keyStore.isKeyEntry(alias)
          && keyStore.getCertificate(alias) instanceof X509Certificate certificate
          && isUsableForSigning(certificate)) {
        candidates.add(alias);
      }
    }
    if (candidates.isEmpty()) {
      log.warn("No usable signing certificate found in {} key store", properties.keystoreType());
      return Optional.empty();
    }

    String alias = candidates.get(0);
    if (properties.keyAlias() != null && !properties.keyAlias().isBlank()) {
      if (!candidates.contains(properties.keyAlias())) {
        log.warn("Configured signing alias '{}' is not usable for signing", properties.keyAlias());
        return Optional.empty();
      }
      alias = properties.keyAlias();
    }

    var privateKey = (PrivateKey) keyStore.getKey(alias, properties.keystorePasswordChars());
    var certificate = (X509Certificate) keyStore.getCertificate(alias);
    List<X509Certificate> chain = new ArrayList<>();
    Certificate[] storedChain = keyStore.getCertificateChain(alias);
    if (storedChain != null) {
      for (Certificate c : storedChain) {
        if (c instanceof X509Certificate x509) {
          chain.add(x509);
        }
      }
    }
    log.info(
        "Selected signing certificate {} (alias {})", certificate.getSubjectX500Principal(), alias);
    return Optional.of(new SigningCapability(privateKey, certificate, chain, provider));
  }

  static boolean isUsableForSigning(X509Certificate certificate) {
    try {
      certificate.checkValidity();
    } catch (CertificateExpiredException | CertificateNotYetValidException e) {
      log.debug(
          "Skipping certificate {}: {}", certificate.getSubjectX500Principal(), e.getMessage());
      return false;
    }
    boolean[] keyUsage = certificate.getKeyUsage();
    // No key usage extension means no restriction.
    return keyUsage == null
        || (keyUsage.length > KEY_USAGE_DIGITAL_SIGNATURE && keyUsage[KEY_USAGE_DIGITAL_SIGNATURE])
        || (keyUsage.length > KEY_USAGE_NON_REPUDIATION && keyUsage[KEY_USAGE_NON_REPUDIATION]);
  }
}
