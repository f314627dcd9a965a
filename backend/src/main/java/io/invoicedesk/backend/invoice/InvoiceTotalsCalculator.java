package io.invoicedesk.backend.invoice;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Invoice arithmetic. Each line is rounded to two decimals (half away from zero) on its own and
 * the invoice sums are taken over the rounded line values, never over raw products.
 */
public final class InvoiceTotalsCalculator {

  static final int MONEY_SCALE = 2;

  private InvoiceTotalsCalculator() {}

  /** Net line value: round(quantity x unitPrice). */
  public static BigDecimal lineTotal(BigDecimal quantity, BigDecimal unitPrice) {
    return quantity.multiply(unitPrice).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
  }

  /** Line tax: round(quantity x unitPrice x taxRate), rounded once from the exact product. */
  public static BigDecimal taxAmount(
      BigDecimal quantity, BigDecimal unitPrice, BigDecimal taxRate) {
    return quantity
        .multiply(unitPrice)
        .multiply(taxRate)
        .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
  }

  public static LineAmounts line(BigDecimal quantity, BigDecimal unitPrice, BigDecimal taxRate) {
    return new LineAmounts(lineTotal(quantity, unitPrice), taxAmount(quantity, unitPrice, taxRate));
  }

  public static InvoiceTotals summarize(Collection<? extends LineAmounts.Source> lines) {
    BigDecimal subTotal = BigDecimal.ZERO.setScale(MONEY_SCALE);
    BigDecimal taxTotal = BigDecimal.ZERO.setScale(MONEY_SCALE);
    for (var line : lines) {
      subTotal = subTotal.add(line.getLineTotal());
      taxTotal = taxTotal.add(line.getTaxAmount());
    }
    return new InvoiceTotals(subTotal, taxTotal, subTotal.add(taxTotal));
  }

  public record LineAmounts(BigDecimal lineTotal, BigDecimal taxAmount) {

    /** Anything carrying already-rounded line amounts. */
    public interface Source {
      BigDecimal getLineTotal();

      BigDecimal getTaxAmount();
    }
  }

  public record InvoiceTotals(BigDecimal subTotal, BigDecimal taxTotal, BigDecimal total) {}
}
