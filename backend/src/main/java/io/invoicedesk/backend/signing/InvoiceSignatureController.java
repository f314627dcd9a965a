package io.invoicedesk.backend.signing;

import io.invoicedesk.backend.document.DocumentResponses;
import io.invoicedesk.backend.invoice.dto.InvoiceResponse.DocumentInfo;
import io.invoicedesk.backend.operations.CancellationToken;
import io.invoicedesk.backend.operations.InvoiceOperations;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/invoices/{id}")
public class InvoiceSignatureController {

  private final InvoiceOperations invoiceOperations;
  private final InvoiceSigningService signingService;

  public InvoiceSignatureController(
      InvoiceOperations invoiceOperations, InvoiceSigningService signingService) {
    this.invoiceOperations = invoiceOperations;
    this.signingService = signingService;
  }

  @PostMapping("/signature")
  public CompletableFuture<ResponseEntity<DocumentInfo>> signInvoice(@PathVariable UUID id) {
    return invoiceOperations
        .sign(id, CancellationToken.create())
        .thenApply(artifact -> ResponseEntity.ok(DocumentInfo.from(artifact)));
  }

  @GetMapping("/signed-document")
  public ResponseEntity<byte[]> getSignedDocument(
      @PathVariable UUID id,
      @RequestHeader(value = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
    return DocumentResponses.pdf(signingService.getSignedDocument(id), ifNoneMatch);
  }

  @GetMapping("/signature/verification")
  public ResponseEntity<SignatureVerification> verifySignature(@PathVariable UUID id) {
    return ResponseEntity.ok(signingService.verify(id));
  }
}
