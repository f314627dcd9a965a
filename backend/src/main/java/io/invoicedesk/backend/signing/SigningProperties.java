package io.invoicedesk.backend.signing;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Signing configuration.
 *
 * @param keySelector {@code noop} (signing always reports cancelled) or {@code keystore}
 * @param keystoreType PKCS12 (file) or PKCS11 (hardware token)
 * @param keystorePath PKCS#12 file, ignored for PKCS11
 * @param keystorePassword store password or token PIN
 * @param keyAlias alias to sign with; the first usable entry when unset
 * @param pkcs11Config SunPKCS11 configuration file, only for PKCS11
 * @param reason reason recorded in the signature dictionary
 * @param location location recorded in the signature dictionary
 */
@ConfigurationProperties(prefix = "invoicedesk.signing")
public record SigningProperties(
    @DefaultValue("noop") String keySelector,
    @DefaultValue("PKCS12") String keystoreType,
    String keystorePath,
    String keystorePassword,
    String keyAlias,
    String pkcs11Config,
    @DefaultValue("Invoice issued") String reason,
    String location) {

  public char[] keystorePasswordChars() {
    return keystorePassword != null ? keystorePassword.toCharArray() : null;
  }
}
