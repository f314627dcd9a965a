package io.invoicedesk.backend.signing;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Default selector for deployments without signing keys: every request ends as cancelled. */
@Component
@ConditionalOnProperty(
    name = "invoicedesk.signing.key-selector",
    havingValue = "noop",
    matchIfMissing = true)
public class NoOpSigningKeySelector implements SigningKeySelector {

  private static final Logger log = LoggerFactory.getLogger(NoOpSigningKeySelector.class);

  @Override
  public Optional<SigningCapability> selectSigningKey() {
    log.warn("NoOp signing: no key source configured (invoicedesk.signing.key-selector=noop)");
    return Optional.empty();
  }
}
