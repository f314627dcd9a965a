package io.invoicedesk.backend.document;

import io.invoicedesk.backend.company.Company;
import io.invoicedesk.backend.company.CompanyRepository;
import io.invoicedesk.backend.exception.InvalidStateException;
import io.invoicedesk.backend.exception.ResourceNotFoundException;
import io.invoicedesk.backend.invoice.DocumentArtifact;
import io.invoicedesk.backend.invoice.Invoice;
import io.invoicedesk.backend.invoice.InvoiceLine;
import io.invoicedesk.backend.invoice.InvoiceLineRepository;
import io.invoicedesk.backend.invoice.InvoiceRepository;
import io.invoicedesk.backend.invoice.InvoiceStatus;
import io.invoicedesk.backend.operations.CancellationToken;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Content-addressed cache of the unsigned invoice document.
 *
 * <p>An issued invoice is rendered at most once per state: later reads return the stored bytes
 * unchanged without invoking the renderer. Rendering happens outside any transaction; the result
 * is stored in a short write transaction that re-reads the invoice first, so a render that lost a
 * race to a concurrent one returns the winner's bytes.
 */
@Service
public class InvoiceDocumentService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceDocumentService.class);

  private final InvoiceRepository invoiceRepository;
  private final InvoiceLineRepository lineRepository;
  private final CompanyRepository companyRepository;
  private final InvoiceRenderer renderer;
  private final TransactionTemplate readTransaction;
  private final TransactionTemplate writeTransaction;

  public InvoiceDocumentService(
      InvoiceRepository invoiceRepository,
      InvoiceLineRepository lineRepository,
      CompanyRepository companyRepository,
      InvoiceRenderer renderer,
      PlatformTransactionManager transactionManager) {
    this.invoiceRepository = invoiceRepository;
    this.lineRepository = lineRepository;
    this.companyRepository = companyRepository;
    this.renderer = renderer;
    this.readTransaction = new TransactionTemplate(transactionManager);
    this.readTransaction.setReadOnly(true);
    this.writeTransaction = new TransactionTemplate(transactionManager);
  }

  /**
   * Returns the unsigned document of an issued invoice, rendering and storing it first when it is
   * absent or {@code forceRegenerate} is set.
   *
   * @throws ResourceNotFoundException if the invoice is absent or belongs to another company
   * @throws InvalidStateException if the invoice is still a draft
   * @throws DocumentRenderingException if rendering fails; nothing is stored
   */
  public DocumentArtifact getOrRenderUnsigned(
      UUID invoiceId, boolean forceRegenerate, CancellationToken cancellationToken) {
    var lookup =
        readTransaction.execute(
            status -> {
              var invoice = requireIssued(invoiceId);
              if (!forceRegenerate && invoice.getUnsignedDocument() != null) {
                return new CacheLookup(invoice.getUnsignedDocument(), null);
              }
              return new CacheLookup(null, buildSnapshot(invoice));
            });
    if (lookup.cached() != null) {
      log.debug("Serving cached document for invoice {}", invoiceId);
      return lookup.cached();
    }

    cancellationToken.throwIfCancellationRequested();
    var snapshot = lookup.snapshot();
    byte[] content = renderer.render(snapshot);
    cancellationToken.throwIfCancellationRequested();

    var artifact =
        new DocumentArtifact(
            content,
            fileName(snapshot.invoiceNumber(), renderer.fileExtension()),
            ContentHashes.sha256Hex(content),
            Instant.now().truncatedTo(ChronoUnit.MICROS));

    return writeTransaction.execute(
        status -> {
          var invoice = requireIssued(invoiceId);
          if (!forceRegenerate && invoice.getUnsignedDocument() != null) {
            log.debug("Invoice {} was rendered concurrently, keeping stored document", invoiceId);
            return invoice.getUnsignedDocument();
          }
          invoice.attachUnsignedDocument(artifact);
          invoiceRepository.saveAndFlush(invoice);
          log.info(
              "Stored document {} for invoice {} (sha256={}, {} bytes)",
              artifact.getFileName(),
              invoice.getInvoiceNumber(),
              artifact.getSha256(),
              artifact.getSize());
          return artifact;
        });
  }

  /** File name of a document for the given invoice number, e.g. {@code invoice-inv42.pdf}. */
  public static String fileName(String invoiceNumber, String extension) {
    return "invoice-" + slugify(invoiceNumber) + "." + extension;
  }

  InvoiceSnapshot buildSnapshot(Invoice invoice) {
    Company company =
        companyRepository
            .findById(invoice.getCompanyId())
            .orElseThrow(() -> new ResourceNotFoundException("Company", invoice.getCompanyId()));
    var customer = invoice.getCustomerSnapshot();

    List<InvoiceLine> lines = lineRepository.findByInvoiceIdOrderBySortOrder(invoice.getId());
    var snapshotLines = new ArrayList<InvoiceSnapshot.Line>(lines.size());
    int position = 1;
    for (var line : lines) {
      snapshotLines.add(
          new InvoiceSnapshot.Line(
              position++,
              line.getDescription(),
              line.getQuantity(),
              line.getUnitPrice(),
              line.getTaxRate(),
              line.getLineTotal(),
              line.getTaxAmount()));
    }

    return new InvoiceSnapshot(
        invoice.getInvoiceNumber(),
        invoice.getIssueDate(),
        invoice.getCurrency(),
        invoice.getLanguage(),
        invoice.getNotes(),
        new InvoiceSnapshot.Party(
            company.getName(),
            company.getAddress(),
            company.getVatNumber(),
            company.getEik(),
            company.getBankIban(),
            company.getBankBic()),
        new InvoiceSnapshot.Party(
            customer.name(), customer.address(), customer.vatNumber(), null, null, null),
        snapshotLines,
        invoice.getSubTotal(),
        invoice.getTaxTotal(),
        invoice.getTotal());
  }

  private Invoice requireIssued(UUID invoiceId) {
    var invoice =
        invoiceRepository
            .findOneById(invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    if (invoice.getStatus() != InvoiceStatus.ISSUED) {
      throw new InvalidStateException(
          "invoice.not_issued",
          "Invoice not issued",
          "Invoice " + invoiceId + " must be issued before its document can be produced");
    }
    return invoice;
  }

  private static String slugify(String text) {
    if (text == null || text.isBlank()) {
      return "document";
    }
    String slug =
        text.toLowerCase()
            .replaceAll("[\\s/]+", "-")
            .replaceAll("[^a-z0-9-]", "")
            .replaceAll("-+", "-")
            .replaceAll("^-|-$", "");
    return slug.isEmpty() ? "document" : slug;
  }

  private record CacheLookup(DocumentArtifact cached, InvoiceSnapshot snapshot) {}
}
