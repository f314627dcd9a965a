package io.invoicedesk.backend.document;

/** Turns an issued invoice into document bytes. */
public interface InvoiceRenderer {

  /**
   * @throws DocumentRenderingException if the document cannot be produced
   */
  byte[] render(InvoiceSnapshot snapshot);

  /** Extension of the produced files, without the dot. */
  default String fileExtension() {
    return "pdf";
  }
}
