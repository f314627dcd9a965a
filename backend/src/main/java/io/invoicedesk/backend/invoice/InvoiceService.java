package io.invoicedesk.backend.invoice;

import io.invoicedesk.backend.customer.Customer;
import io.invoicedesk.backend.customer.CustomerRepository;
import io.invoicedesk.backend.exception.InvalidStateException;
import io.invoicedesk.backend.exception.ResourceNotFoundException;
import io.invoicedesk.backend.invoice.Invoice.CustomerSnapshot;
import io.invoicedesk.backend.invoice.dto.CreateInvoiceRequest;
import io.invoicedesk.backend.invoice.dto.InvoiceLineRequest;
import io.invoicedesk.backend.invoice.dto.InvoiceResponse;
import io.invoicedesk.backend.invoice.dto.UpdateInvoiceRequest;
import io.invoicedesk.backend.multitenancy.TenantContext;
import io.invoicedesk.backend.operations.CancellationToken;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class InvoiceService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceService.class);
  private static final String DEFAULT_CURRENCY = "BGN";

  private final InvoiceRepository invoiceRepository;
  private final InvoiceLineRepository lineRepository;
  private final CustomerRepository customerRepository;
  private final InvoiceNumberService invoiceNumberService;

  public InvoiceService(
      InvoiceRepository invoiceRepository,
      InvoiceLineRepository lineRepository,
      CustomerRepository customerRepository,
      InvoiceNumberService invoiceNumberService) {
    this.invoiceRepository = invoiceRepository;
    this.lineRepository = lineRepository;
    this.customerRepository = customerRepository;
    this.invoiceNumberService = invoiceNumberService;
  }

  @Transactional
  public InvoiceResponse createDraft(CreateInvoiceRequest request) {
    requireCustomer(request.customerId());

    var invoice =
        new Invoice(
            request.customerId(),
            currencyOrDefault(request.currency()),
            request.language(),
            request.notes(),
            request.issueDate());
    invoice = invoiceRepository.save(invoice);

    var lines = saveLines(invoice.getId(), request.lines() != null ? request.lines() : List.of());
    invoice.applyTotals(InvoiceTotalsCalculator.summarize(lines));
    invoice = invoiceRepository.save(invoice);

    log.info(
        "Created draft invoice {} for customer {} with {} line(s)",
        invoice.getId(),
        request.customerId(),
        lines.size());
    return InvoiceResponse.from(invoice, lines);
  }

  @Transactional
  public InvoiceResponse updateDraft(UUID invoiceId, UpdateInvoiceRequest request) {
    var invoice = requireInvoice(invoiceId);
    invoice.requireDraft("edit");
    requireCustomer(request.customerId());

    invoice.updateDraft(
        request.customerId(),
        currencyOrDefault(request.currency()),
        request.language(),
        request.notes(),
        request.issueDate());
    invoice = invoiceRepository.save(invoice);
    log.info("Updated draft invoice {}", invoiceId);
    return InvoiceResponse.from(invoice, lineRepository.findByInvoiceIdOrderBySortOrder(invoiceId));
  }

  /** Replaces all lines of a draft and recomputes its totals. */
  @Transactional
  public InvoiceResponse replaceLines(UUID invoiceId, List<InvoiceLineRequest> lineRequests) {
    var invoice = requireInvoice(invoiceId);
    invoice.requireDraft("change the lines of");

    lineRepository.deleteByInvoiceId(invoiceId);
    var lines = saveLines(invoiceId, lineRequests);
    invoice.applyTotals(InvoiceTotalsCalculator.summarize(lines));
    invoice = invoiceRepository.save(invoice);

    log.info("Replaced lines of draft invoice {} ({} line(s))", invoiceId, lines.size());
    return InvoiceResponse.from(invoice, lines);
  }

  @Transactional
  public void deleteDraft(UUID invoiceId) {
    var invoice = requireInvoice(invoiceId);
    invoice.requireDraft("delete");

    lineRepository.deleteByInvoiceId(invoiceId);
    invoiceRepository.delete(invoice);
    log.info("Deleted draft invoice {}", invoiceId);
  }

  @Transactional(readOnly = true)
  public InvoiceResponse findById(UUID invoiceId) {
    var invoice = requireInvoice(invoiceId);
    return InvoiceResponse.from(invoice, lineRepository.findByInvoiceIdOrderBySortOrder(invoiceId));
  }

  @Transactional(readOnly = true)
  public List<InvoiceResponse> findAll(InvoiceStatus status) {
    var invoices =
        status != null
            ? invoiceRepository.findByStatus(status)
            : invoiceRepository.findAllOrdered();
    return invoices.stream()
        .map(
            i -> InvoiceResponse.from(i, lineRepository.findByInvoiceIdOrderBySortOrder(i.getId())))
        .toList();
  }

  /**
   * Issues a draft in a single transaction: customer snapshot, final totals, invoice number and the
   * status flip commit together or not at all.
   *
   * <p>A concurrent issuance in the same company waits on the company row lock. Races the store
   * detects (version or unique number) surface at flush or commit as Spring data access
   * exceptions; callers translate them into a retryable conflict.
   *
   * @throws ResourceNotFoundException if the invoice is absent or belongs to another company
   * @throws InvalidStateException if it is already issued or has no lines
   */
  @Transactional
  public InvoiceResponse issue(UUID invoiceId, CancellationToken cancellationToken) {
    var invoice = requireInvoice(invoiceId);
    invoice.requireDraft("issue");

    var lines = lineRepository.findByInvoiceIdOrderBySortOrder(invoiceId);
    if (lines.isEmpty()) {
      throw new InvalidStateException(
          "invoice.no_lines",
          "No line items",
          "Invoice must have at least one line item before it is issued");
    }
    Customer customer = requireCustomer(invoice.getCustomerId());
    var snapshot =
        new CustomerSnapshot(customer.getName(), customer.getAddress(), customer.getVatNumber());
    var totals = InvoiceTotalsCalculator.summarize(lines);

    cancellationToken.throwIfCancellationRequested();
    String invoiceNumber = invoiceNumberService.allocate(TenantContext.requireCompanyId());
    invoice.issue(invoiceNumber, LocalDate.now(ZoneOffset.UTC), snapshot, totals);

    // Last point at which cancellation rolls everything back.
    cancellationToken.throwIfCancellationRequested();
    invoice = invoiceRepository.saveAndFlush(invoice);

    log.info("Issued invoice {} with number {}", invoiceId, invoiceNumber);
    return InvoiceResponse.from(invoice, lines);
  }

  private List<InvoiceLine> saveLines(UUID invoiceId, List<InvoiceLineRequest> requests) {
    var lines = new ArrayList<InvoiceLine>(requests.size());
    int sortOrder = 0;
    for (var request : requests) {
      lines.add(
          new InvoiceLine(
              invoiceId,
              request.description(),
              request.quantity(),
              request.unitPrice(),
              request.taxRate(),
              sortOrder++));
    }
    return lineRepository.saveAll(lines);
  }

  private Invoice requireInvoice(UUID invoiceId) {
    return invoiceRepository
        .findOneById(invoiceId)
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
  }

  private Customer requireCustomer(UUID customerId) {
    return customerRepository
        .findOneById(customerId)
        .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
  }

  private static String currencyOrDefault(String currency) {
    if (currency == null || currency.isBlank()) {
      return DEFAULT_CURRENCY;
    }
    return currency.trim().toUpperCase();
  }
}
