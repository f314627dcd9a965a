package io.invoicedesk.backend.document;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything a renderer may print for one issued invoice. Built from frozen invoice data; renderers
 * never see entities.
 */
public record InvoiceSnapshot(
    String invoiceNumber,
    LocalDate issueDate,
    String currency,
    String language,
    String notes,
    Party seller,
    Party buyer,
    List<Line> lines,
    BigDecimal subTotal,
    BigDecimal taxTotal,
    BigDecimal total) {

  public InvoiceSnapshot {
    lines = List.copyOf(lines);
  }

  /** Seller or buyer as printed. Bank fields are only set for the seller. */
  public record Party(
      String name, String address, String vatNumber, String eik, String iban, String bic) {}

  public record Line(
      int position,
      String description,
      BigDecimal quantity,
      BigDecimal unitPrice,
      BigDecimal taxRate,
      BigDecimal lineTotal,
      BigDecimal taxAmount) {}
}
