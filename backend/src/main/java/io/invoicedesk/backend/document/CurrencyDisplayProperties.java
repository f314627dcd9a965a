package io.invoicedesk.backend.document;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * How amounts are shown on rendered documents during the euro transition.
 *
 * @param dualCurrencyEnabled show EUR equivalents next to BGN amounts
 * @param eurOnlyMode post-transition switch; suppresses dual display when set
 */
@ConfigurationProperties(prefix = "invoicedesk.currency-display")
public record CurrencyDisplayProperties(
    @DefaultValue("true") boolean dualCurrencyEnabled,
    @DefaultValue("false") boolean eurOnlyMode) {}
