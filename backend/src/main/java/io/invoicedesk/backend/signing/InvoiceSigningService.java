package io.invoicedesk.backend.signing;

import io.invoicedesk.backend.document.ContentHashes;
import io.invoicedesk.backend.document.InvoiceDocumentService;
import io.invoicedesk.backend.exception.InvalidStateException;
import io.invoicedesk.backend.exception.OperationCancelledException;
import io.invoicedesk.backend.exception.ResourceConflictException;
import io.invoicedesk.backend.exception.ResourceNotFoundException;
import io.invoicedesk.backend.invoice.DocumentArtifact;
import io.invoicedesk.backend.invoice.Invoice;
import io.invoicedesk.backend.invoice.InvoiceRepository;
import io.invoicedesk.backend.invoice.InvoiceStatus;
import io.invoicedesk.backend.operations.CancellationToken;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.ErrorResponseException;

/**
 * Signs the cached unsigned document of an issued invoice and stores the result as the invoice's
 * signed document. The unsigned document is never modified.
 *
 * <p>Key selection and cryptography run outside any transaction. The write transaction checks
 * that the unsigned document is still the one that was signed; if it was regenerated meanwhile
 * the attempt fails with a retryable conflict.
 */
@Service
public class InvoiceSigningService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceSigningService.class);

  private final InvoiceRepository invoiceRepository;
  private final InvoiceDocumentService documentService;
  private final SigningKeySelector keySelector;
  private final PdfDocumentSigner documentSigner;
  private final SignedDocumentVerifier verifier;
  private final SigningProperties signingProperties;
  private final TransactionTemplate readTransaction;
  private final TransactionTemplate writeTransaction;

  public InvoiceSigningService(
      InvoiceRepository invoiceRepository,
      InvoiceDocumentService documentService,
      SigningKeySelector keySelector,
      PdfDocumentSigner documentSigner,
      SignedDocumentVerifier verifier,
      SigningProperties signingProperties,
      PlatformTransactionManager transactionManager) {
    this.invoiceRepository = invoiceRepository;
    this.documentService = documentService;
    this.keySelector = keySelector;
    this.documentSigner = documentSigner;
    this.verifier = verifier;
    this.signingProperties = signingProperties;
    this.readTransaction = new TransactionTemplate(transactionManager);
    this.readTransaction.setReadOnly(true);
    this.writeTransaction = new TransactionTemplate(transactionManager);
  }

  /**
   * Signs the invoice's document, rendering it first if it was never rendered.
   *
   * @return the stored signed document
   * @throws ResourceNotFoundException if the invoice is absent or belongs to another company
   * @throws InvalidStateException if the invoice is a draft
   * @throws OperationCancelledException if no key was selected or the token was cancelled
   * @throws SigningException if the key is unusable or signing fails
   * @throws ResourceConflictException if the unsigned document changed while signing
   */
  public DocumentArtifact sign(UUID invoiceId, CancellationToken cancellationToken) {
    readTransaction.executeWithoutResult(status -> requireIssued(invoiceId));

    DocumentArtifact unsigned =
        documentService.getOrRenderUnsigned(invoiceId, false, cancellationToken);
    cancellationToken.throwIfCancellationRequested();

    var capability =
        selectSigningKey()
            .orElseThrow(
                () ->
                    new OperationCancelledException(
                        "signing.cancelled", "No signing certificate was selected"));
    var family = KeyAlgorithmFamily.classify(capability);
    log.info("Signing invoice {} with {} ({})", invoiceId, capability.subject(), family);

    byte[] signedBytes =
        documentSigner.sign(
            unsigned.getContent(),
            capability,
            family,
            signingProperties.reason(),
            signingProperties.location());
    cancellationToken.throwIfCancellationRequested();

    var signed =
        new DocumentArtifact(
            signedBytes,
            signedFileName(unsigned.getFileName()),
            ContentHashes.sha256Hex(signedBytes),
            Instant.now().truncatedTo(ChronoUnit.MICROS));

    return writeTransaction.execute(
        status -> {
          var invoice = requireIssued(invoiceId);
          var current = invoice.getUnsignedDocument();
          if (current == null || !current.getSha256().equals(unsigned.getSha256())) {
            throw new ResourceConflictException(
                "signing.document_changed",
                "Document changed",
                "The document of invoice " + invoiceId + " was regenerated while signing");
          }
          var previous = invoice.attachSignedDocument(signed);
          invoiceRepository.saveAndFlush(invoice);
          if (previous != null) {
            log.info(
                "Replaced signed document of invoice {} (previous sha256={}, created {})",
                invoice.getInvoiceNumber(),
                previous.getSha256(),
                previous.getCreatedAt());
          }
          log.info(
              "Stored signed document {} for invoice {} (sha256={})",
              signed.getFileName(),
              invoice.getInvoiceNumber(),
              signed.getSha256());
          return signed;
        });
  }

  private Optional<SigningCapability> selectSigningKey() {
    try {
      return keySelector.selectSigningKey();
    } catch (ErrorResponseException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("Signing key selection failed", e);
      throw new SigningException(
          "signing.key_unavailable", "The signing key could not be obtained", e);
    }
  }

  /**
   * @throws ResourceNotFoundException if the invoice or its signed document does not exist
   */
  public DocumentArtifact getSignedDocument(UUID invoiceId) {
    return readTransaction.execute(
        status -> {
          var signed = requireInvoice(invoiceId).getSignedDocument();
          if (signed == null) {
            throw new ResourceNotFoundException("SignedDocument", invoiceId);
          }
          return signed;
        });
  }

  public SignatureVerification verify(UUID invoiceId) {
    var signed = getSignedDocument(invoiceId);
    var verification = verifier.verify(signed);
    log.info("Verified signed document of invoice {}: valid={}", invoiceId, verification.valid());
    return verification;
  }

  /** {@code invoice-inv1.pdf} becomes {@code invoice-inv1-signed.pdf}. */
  static String signedFileName(String unsignedFileName) {
    if (unsignedFileName == null || unsignedFileName.isBlank()) {
      return "signed-invoice.pdf";
    }
    int dot = unsignedFileName.lastIndexOf('.');
    String baseName = dot > 0 ? unsignedFileName.substring(0, dot) : unsignedFileName;
    return baseName + "-signed.pdf";
  }

  private Invoice requireInvoice(UUID invoiceId) {
    return invoiceRepository
        .findOneById(invoiceId)
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
  }

  private Invoice requireIssued(UUID invoiceId) {
    var invoice = requireInvoice(invoiceId);
    if (invoice.getStatus() != InvoiceStatus.ISSUED) {
      throw new InvalidStateException(
          "invoice.not_issued",
          "Invoice not issued",
          "Only issued invoices can be signed; invoice " + invoiceId + " is a draft");
    }
    return invoice;
  }
}
