package io.invoicedesk.backend.document;

import io.invoicedesk.backend.operations.CancellationToken;
import io.invoicedesk.backend.operations.InvoiceOperations;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/invoices/{id}/document")
public class InvoiceDocumentController {

  private final InvoiceOperations invoiceOperations;

  public InvoiceDocumentController(InvoiceOperations invoiceOperations) {
    this.invoiceOperations = invoiceOperations;
  }

  /** Serves the cached unsigned PDF; {@code regenerate=true} re-renders it first. */
  @GetMapping
  public CompletableFuture<ResponseEntity<byte[]>> getDocument(
      @PathVariable UUID id,
      @RequestParam(defaultValue = "false") boolean regenerate,
      @RequestHeader(value = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
    return invoiceOperations
        .exportUnsigned(id, regenerate, CancellationToken.create())
        .thenApply(artifact -> DocumentResponses.pdf(artifact, ifNoneMatch));
  }
}
