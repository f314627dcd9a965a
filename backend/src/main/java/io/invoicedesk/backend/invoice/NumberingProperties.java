package io.invoicedesk.backend.invoice;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Invoice number formatting.
 *
 * @param minDigits zero-pad the counter to at least this many digits; 0 disables padding
 */
@ConfigurationProperties(prefix = "invoicedesk.numbering")
public record NumberingProperties(@DefaultValue("0") int minDigits) {

  public NumberingProperties {
    if (minDigits < 0 || minDigits > 18) {
      throw new IllegalArgumentException("invoicedesk.numbering.min-digits must be in 0..18");
    }
  }
}
