package io.invoicedesk.backend.signing;

import java.util.Optional;

/**
 * Source of the signing key. Implementations may block (a PIN prompt, a hardware token) and are
 * only ever called from the signing executor.
 */
public interface SigningKeySelector {

  /**
   * @return the key to sign with, or empty if the operator cancelled or no usable key exists
   * @throws SigningException if the key source itself fails
   */
  Optional<SigningCapability> selectSigningKey();
}
