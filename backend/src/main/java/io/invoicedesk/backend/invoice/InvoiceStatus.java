package io.invoicedesk.backend.invoice;

/**
 * Invoice lifecycle status. DRAFT (editable, no number) moves to ISSUED exactly once; ISSUED is
 * terminal.
 */
public enum InvoiceStatus {
  DRAFT,
  ISSUED;

  public boolean canTransitionTo(InvoiceStatus target) {
    return this == DRAFT && target == ISSUED;
  }
}
