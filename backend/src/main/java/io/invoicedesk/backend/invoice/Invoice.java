package io.invoicedesk.backend.invoice;

import io.invoicedesk.backend.exception.InvalidStateException;
import io.invoicedesk.backend.invoice.InvoiceTotalsCalculator.InvoiceTotals;
import io.invoicedesk.backend.multitenancy.TenantAware;
import io.invoicedesk.backend.multitenancy.TenantAwareEntityListener;
import io.invoicedesk.backend.multitenancy.TenantFilterTransactionManager;
import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.hibernate.annotations.Filter;
import org.hibernate.annotations.FilterDef;
import org.hibernate.annotations.ParamDef;

/**
 * Invoice aggregate root.
 *
 * <p>Lifecycle: DRAFT (editable, no number, no documents) → ISSUED (numbered, frozen). Issuance
 * stamps the invoice number, issue date, customer snapshot and totals in one step. After that only
 * the two document artifacts can change: the unsigned rendering, and the signed copy which
 * requires the unsigned one.
 *
 * <p>{@code version} guards against two transactions issuing the same draft concurrently.
 */
@Entity
@Table(name = "invoices")
// Defined once here; Customer and InvoiceLine reuse it through @Filter.
@FilterDef(
    name = TenantFilterTransactionManager.FILTER_NAME,
    parameters = @ParamDef(name = TenantFilterTransactionManager.FILTER_PARAM, type = UUID.class))
@Filter(name = TenantFilterTransactionManager.FILTER_NAME, condition = "company_id = :companyId")
@EntityListeners(TenantAwareEntityListener.class)
public class Invoice implements TenantAware {

  public static final String DEFAULT_LANGUAGE = "en";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false, updatable = false)
  private UUID companyId;

  @Column(name = "customer_id", nullable = false)
  private UUID customerId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvoiceStatus status = InvoiceStatus.DRAFT;

  @Column(name = "invoice_number", length = 64)
  private String invoiceNumber;

  @Column(name = "issue_date")
  private LocalDate issueDate;

  @Column(name = "issued_at")
  private Instant issuedAt;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "language", nullable = false, length = 8)
  private String language = DEFAULT_LANGUAGE;

  @Column(name = "notes", length = 2000)
  private String notes;

  @Column(name = "sub_total", nullable = false, precision = 18, scale = 2)
  private BigDecimal subTotal = BigDecimal.ZERO;

  @Column(name = "tax_total", nullable = false, precision = 18, scale = 2)
  private BigDecimal taxTotal = BigDecimal.ZERO;

  @Column(name = "total", nullable = false, precision = 18, scale = 2)
  private BigDecimal total = BigDecimal.ZERO;

  @Column(name = "customer_name", length = 200)
  private String customerName;

  @Column(name = "customer_address", length = 400)
  private String customerAddress;

  @Column(name = "customer_vat_number", length = 50)
  private String customerVatNumber;

  @Embedded
  @AttributeOverrides({
    @AttributeOverride(name = "content", column = @Column(name = "unsigned_pdf")),
    @AttributeOverride(name = "fileName", column = @Column(name = "unsigned_file_name")),
    @AttributeOverride(name = "sha256", column = @Column(name = "unsigned_sha256")),
    @AttributeOverride(name = "createdAt", column = @Column(name = "unsigned_created_at"))
  })
  private DocumentArtifact unsignedDocument;

  @Embedded
  @AttributeOverrides({
    @AttributeOverride(name = "content", column = @Column(name = "signed_pdf")),
    @AttributeOverride(name = "fileName", column = @Column(name = "signed_file_name")),
    @AttributeOverride(name = "sha256", column = @Column(name = "signed_sha256")),
    @AttributeOverride(name = "createdAt", column = @Column(name = "signed_created_at"))
  })
  private DocumentArtifact signedDocument;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Invoice() {}

  public Invoice(
      UUID customerId, String currency, String language, String notes, LocalDate issueDate) {
    this.customerId = customerId;
    this.currency = currency;
    this.language = language != null ? language : DEFAULT_LANGUAGE;
    this.notes = notes;
    this.issueDate = issueDate;
    this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    this.updatedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
  }

  /**
   * Updates the editable header of a draft.
   *
   * @throws InvalidStateException if the invoice is already issued
   */
  public void updateDraft(
      UUID customerId, String currency, String language, String notes, LocalDate issueDate) {
    requireDraft("edit");
    this.customerId = customerId;
    this.currency = currency;
    this.language = language != null ? language : DEFAULT_LANGUAGE;
    this.notes = notes;
    this.issueDate = issueDate;
    this.updatedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
  }

  /** Stores draft totals recomputed from the current lines. */
  public void applyTotals(InvoiceTotals totals) {
    requireDraft("change the totals of");
    this.subTotal = totals.subTotal();
    this.taxTotal = totals.taxTotal();
    this.total = totals.total();
    this.updatedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
  }

  /**
   * Issues the invoice: DRAFT → ISSUED. Everything that makes up the legal document is fixed here.
   *
   * @param invoiceNumber number allocated by {@link InvoiceNumberService}
   * @param issueDate issue date to keep when the draft did not set one
   * @param snapshot customer data at the time of issuance
   * @param totals totals recomputed from the final lines
   * @throws InvalidStateException if the invoice is not a draft
   */
  public void issue(
      String invoiceNumber, LocalDate issueDate, CustomerSnapshot snapshot, InvoiceTotals totals) {
    if (!status.canTransitionTo(InvoiceStatus.ISSUED)) {
      throw alreadyIssued();
    }
    this.subTotal = totals.subTotal();
    this.taxTotal = totals.taxTotal();
    this.total = totals.total();
    this.customerName = snapshot.name();
    this.customerAddress = snapshot.address();
    this.customerVatNumber = snapshot.vatNumber();
    this.invoiceNumber = invoiceNumber;
    if (this.issueDate == null) {
      this.issueDate = issueDate;
    }
    this.issuedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    this.status = InvoiceStatus.ISSUED;
    this.updatedAt = this.issuedAt;
  }

  /**
   * Replaces the unsigned document.
   *
   * @throws InvalidStateException if the invoice is still a draft
   */
  public void attachUnsignedDocument(DocumentArtifact artifact) {
    if (status != InvoiceStatus.ISSUED) {
      throw new InvalidStateException(
          "invoice.not_issued",
          "Invoice not issued",
          "Invoice " + id + " must be issued before a document can be stored");
    }
    this.unsignedDocument = artifact;
    this.updatedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
  }

  /**
   * Replaces the signed document.
   *
   * @return the signed document that was replaced, or null
   * @throws InvalidStateException if there is no unsigned document to have signed
   */
  public DocumentArtifact attachSignedDocument(DocumentArtifact artifact) {
    if (status != InvoiceStatus.ISSUED || unsignedDocument == null) {
      throw new InvalidStateException(
          "invoice.document_missing",
          "Unsigned document missing",
          "Invoice " + id + " has no unsigned document to sign");
    }
    var previous = this.signedDocument;
    this.signedDocument = artifact;
    this.updatedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    return previous;
  }

  public boolean isDraft() {
    return status == InvoiceStatus.DRAFT;
  }

  /**
   * @throws InvalidStateException naming the rejected action if the invoice is issued
   */
  public void requireDraft(String action) {
    if (status != InvoiceStatus.DRAFT) {
      throw new InvalidStateException(
          "invoice.already_issued",
          "Invoice already issued",
          "Cannot " + action + " invoice " + invoiceNumber + ": it is already issued");
    }
  }

  private InvalidStateException alreadyIssued() {
    return new InvalidStateException(
        "invoice.already_issued",
        "Invoice already issued",
        "Invoice " + id + " was already issued as " + invoiceNumber);
  }

  public UUID getId() {
    return id;
  }

  @Override
  public UUID getCompanyId() {
    return companyId;
  }

  @Override
  public void setCompanyId(UUID companyId) {
    this.companyId = companyId;
  }

  public UUID getCustomerId() {
    return customerId;
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public LocalDate getIssueDate() {
    return issueDate;
  }

  public Instant getIssuedAt() {
    return issuedAt;
  }

  public String getCurrency() {
    return currency;
  }

  public String getLanguage() {
    return language;
  }

  public String getNotes() {
    return notes;
  }

  public BigDecimal getSubTotal() {
    return subTotal;
  }

  public BigDecimal getTaxTotal() {
    return taxTotal;
  }

  public BigDecimal getTotal() {
    return total;
  }

  public CustomerSnapshot getCustomerSnapshot() {
    return customerName == null
        ? null
        : new CustomerSnapshot(customerName, customerAddress, customerVatNumber);
  }

  public DocumentArtifact getUnsignedDocument() {
    return unsignedDocument;
  }

  public DocumentArtifact getSignedDocument() {
    return signedDocument;
  }

  public long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /** Customer details as printed on an issued invoice. */
  public record CustomerSnapshot(String name, String address, String vatNumber) {}
}
