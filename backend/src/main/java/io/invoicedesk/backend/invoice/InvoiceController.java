package io.invoicedesk.backend.invoice;

import io.invoicedesk.backend.invoice.dto.CreateInvoiceRequest;
import io.invoicedesk.backend.invoice.dto.InvoiceResponse;
import io.invoicedesk.backend.invoice.dto.ReplaceLinesRequest;
import io.invoicedesk.backend.invoice.dto.UpdateInvoiceRequest;
import io.invoicedesk.backend.operations.CancellationToken;
import io.invoicedesk.backend.operations.InvoiceOperations;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {

  private final InvoiceService invoiceService;
  private final InvoiceOperations invoiceOperations;

  public InvoiceController(InvoiceService invoiceService, InvoiceOperations invoiceOperations) {
    this.invoiceService = invoiceService;
    this.invoiceOperations = invoiceOperations;
  }

  @PostMapping
  public ResponseEntity<InvoiceResponse> createInvoice(
      @Valid @RequestBody CreateInvoiceRequest request) {
    var response = invoiceService.createDraft(request);
    return ResponseEntity.created(URI.create("/api/invoices/" + response.id())).body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<InvoiceResponse> updateInvoice(
      @PathVariable UUID id, @Valid @RequestBody UpdateInvoiceRequest request) {
    return ResponseEntity.ok(invoiceService.updateDraft(id, request));
  }

  @PutMapping("/{id}/lines")
  public ResponseEntity<InvoiceResponse> replaceLines(
      @PathVariable UUID id, @Valid @RequestBody ReplaceLinesRequest request) {
    return ResponseEntity.ok(invoiceService.replaceLines(id, request.lines()));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteInvoice(@PathVariable UUID id) {
    invoiceService.deleteDraft(id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{id}")
  public ResponseEntity<InvoiceResponse> getInvoice(@PathVariable UUID id) {
    return ResponseEntity.ok(invoiceService.findById(id));
  }

  @GetMapping
  public ResponseEntity<List<InvoiceResponse>> listInvoices(
      @RequestParam(required = false) InvoiceStatus status) {
    return ResponseEntity.ok(invoiceService.findAll(status));
  }

  @PostMapping("/{id}/issue")
  public CompletableFuture<ResponseEntity<InvoiceResponse>> issueInvoice(@PathVariable UUID id) {
    return invoiceOperations.issue(id, CancellationToken.create()).thenApply(ResponseEntity::ok);
  }
}
