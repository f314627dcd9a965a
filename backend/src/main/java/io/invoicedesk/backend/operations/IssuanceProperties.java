package io.invoicedesk.backend.operations;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Retry policy for issuance attempts that lose a race against a concurrent writer.
 *
 * @param maxAttempts total attempts including the first
 * @param initialBackoff pause before the second attempt; doubled for each further attempt
 * @param maxBackoff upper bound for a single pause, strictly greater than {@code initialBackoff}
 */
@ConfigurationProperties(prefix = "invoicedesk.issuance")
public record IssuanceProperties(
    @DefaultValue("5") int maxAttempts,
    @DefaultValue("50ms") Duration initialBackoff,
    @DefaultValue("1000ms") Duration maxBackoff) {

  public IssuanceProperties {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("invoicedesk.issuance.max-attempts must be at least 1");
    }
    if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
      throw new IllegalArgumentException("invoicedesk.issuance.initial-backoff must be positive");
    }
    if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) <= 0) {
      throw new IllegalArgumentException(
          "invoicedesk.issuance.max-backoff must be greater than initial-backoff");
    }
  }
}
