package io.invoicedesk.backend.invoice.dto;

import io.invoicedesk.backend.invoice.InvoiceLine;
import java.math.BigDecimal;
import java.util.UUID;

public record InvoiceLineResponse(
    UUID id,
    String description,
    BigDecimal quantity,
    BigDecimal unitPrice,
    BigDecimal taxRate,
    BigDecimal lineTotal,
    BigDecimal taxAmount,
    int sortOrder) {

  public static InvoiceLineResponse from(InvoiceLine line) {
    return new InvoiceLineResponse(
        line.getId(),
        line.getDescription(),
        line.getQuantity(),
        line.getUnitPrice(),
        line.getTaxRate(),
        line.getLineTotal(),
        line.getTaxAmount(),
        line.getSortOrder());
  }
}
