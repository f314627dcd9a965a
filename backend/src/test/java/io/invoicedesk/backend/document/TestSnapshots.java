package io.invoicedesk.backend.document;

import io.invoicedesk.backend.document.InvoiceSnapshot.Line;
import io.invoicedesk.backend.document.InvoiceSnapshot.Party;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/** Invoice snapshots and rendered documents for renderer and signer tests. */
public final class TestSnapshots {

  private TestSnapshots() {}

  public static InvoiceSnapshot sample(String currency, String language) {
    return new InvoiceSnapshot(
        "INV42",
        LocalDate.of(2026, 3, 1),
        currency,
        language,
        "Payment within 14 days",
        new Party(
            "Seller Ltd", "1 Vitosha Blvd, Sofia", "BG123", "123", "BG80BNBG9661", "BNBGBGSD"),
        new Party("Buyer Ltd", "5 Rakovski St, Plovdiv", "BG987", null, null, null),
        List.of(
            new Line(
                1,
                "Consulting",
                new BigDecimal("2.000"),
                new BigDecimal("50.0000"),
                new BigDecimal("0.2000"),
                new BigDecimal("100.00"),
                new BigDecimal("20.00")),
            new Line(
                2,
                "Hosting & support <monthly>",
                new BigDecimal("1.000"),
                new BigDecimal("100.0000"),
                new BigDecimal("0.0000"),
                new BigDecimal("100.00"),
                new BigDecimal("0.00"))),
        new BigDecimal("200.00"),
        new BigDecimal("20.00"),
        new BigDecimal("220.00"));
  }

  public static byte[] renderedPdf() {
    return renderer().render(sample("BGN", "en"));
  }

  public static PdfInvoiceRenderer renderer() {
    return new PdfInvoiceRenderer(
        new CurrencyDisplay(new CurrencyDisplayProperties(true, false)),
        new DocumentRenderingProperties(null));
  }
}
