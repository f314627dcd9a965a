package io.invoicedesk.backend.document;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Display-only BGN to EUR conversion at the rate fixed by law, 1 EUR = 1.95583 BGN. The results
 * appear on documents and are never stored; BGN remains the accounting amount.
 */
@Component
public class CurrencyDisplay {

  public static final BigDecimal BGN_PER_EUR = new BigDecimal("1.95583");

  private final CurrencyDisplayProperties properties;

  public CurrencyDisplay(CurrencyDisplayProperties properties) {
    this.properties = properties;
  }

  public boolean showDualCurrency(String currency) {
    if (properties.eurOnlyMode()) {
      return false;
    }
    return properties.dualCurrencyEnabled() && isBgn(currency);
  }

  public static BigDecimal toEur(BigDecimal amountInBgn) {
    return amountInBgn.divide(BGN_PER_EUR, 2, RoundingMode.HALF_UP);
  }

  static boolean isBgn(String currency) {
    return currency != null && "BGN".equalsIgnoreCase(currency.trim());
  }
}
