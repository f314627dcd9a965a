package io.invoicedesk.backend.invoice.dto;

import io.invoicedesk.backend.invoice.DocumentArtifact;
import io.invoicedesk.backend.invoice.Invoice;
import io.invoicedesk.backend.invoice.InvoiceLine;
import io.invoicedesk.backend.invoice.InvoiceStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/** Invoice view. Document bytes are served by their own endpoints; only metadata appears here. */
public record InvoiceResponse(
    UUID id,
    UUID customerId,
    InvoiceStatus status,
    String invoiceNumber,
    LocalDate issueDate,
    Instant issuedAt,
    String currency,
    String language,
    String notes,
    BigDecimal subTotal,
    BigDecimal taxTotal,
    BigDecimal total,
    String customerName,
    String customerAddress,
    String customerVatNumber,
    DocumentInfo unsignedDocument,
    DocumentInfo signedDocument,
    List<InvoiceLineResponse> lines,
    Instant createdAt,
    Instant updatedAt) {

  public static InvoiceResponse from(Invoice invoice, List<InvoiceLine> lines) {
    var snapshot = invoice.getCustomerSnapshot();
    return new InvoiceResponse(
        invoice.getId(),
        invoice.getCustomerId(),
        invoice.getStatus(),
        invoice.getInvoiceNumber(),
        invoice.getIssueDate(),
        invoice.getIssuedAt(),
        invoice.getCurrency(),
        invoice.getLanguage(),
        invoice.getNotes(),
        invoice.getSubTotal(),
        invoice.getTaxTotal(),
        invoice.getTotal(),
        snapshot != null ? snapshot.name() : null,
        snapshot != null ? snapshot.address() : null,
        snapshot != null ? snapshot.vatNumber() : null,
        DocumentInfo.from(invoice.getUnsignedDocument()),
        DocumentInfo.from(invoice.getSignedDocument()),
        lines.stream().map(InvoiceLineResponse::from).toList(),
        invoice.getCreatedAt(),
        invoice.getUpdatedAt());
  }

  public record DocumentInfo(String fileName, String sha256, int size, Instant createdAt) {

    public static DocumentInfo from(DocumentArtifact artifact) {
      if (artifact == null) {
        return null;
      }
      return new DocumentInfo(
          artifact.getFileName(),
          artifact.getSha256(),
          artifact.getSize(),
          artifact.getCreatedAt());
    }
  }
}
