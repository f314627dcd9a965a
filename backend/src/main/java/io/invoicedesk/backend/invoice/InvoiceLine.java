package io.invoicedesk.backend.invoice;

import io.invoicedesk.backend.multitenancy.TenantAware;
import io.invoicedesk.backend.multitenancy.TenantAwareEntityListener;
import io.invoicedesk.backend.multitenancy.TenantFilterTransactionManager;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.hibernate.annotations.Filter;

/** One priced line of an invoice. Amounts are computed on construction and never edited. */
@Entity
@Table(name = "invoice_lines")
@Filter(name = TenantFilterTransactionManager.FILTER_NAME, condition = "company_id = :companyId")
@EntityListeners(TenantAwareEntityListener.class)
public class InvoiceLine implements TenantAware, InvoiceTotalsCalculator.LineAmounts.Source {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false, updatable = false)
  private UUID companyId;

  @Column(name = "invoice_id", nullable = false, updatable = false)
  private UUID invoiceId;

  @Column(name = "description", nullable = false, length = 1000)
  private String description;

  @Column(name = "quantity", nullable = false, precision = 18, scale = 3)
  private BigDecimal quantity;

  @Column(name = "unit_price", nullable = false, precision = 18, scale = 4)
  private BigDecimal unitPrice;

  @Column(name = "tax_rate", nullable = false, precision = 7, scale = 4)
  private BigDecimal taxRate;

  @Column(name = "line_total", nullable = false, precision = 18, scale = 2)
  private BigDecimal lineTotal;

  @Column(name = "tax_amount", nullable = false, precision = 18, scale = 2)
  private BigDecimal taxAmount;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected InvoiceLine() {}

  public InvoiceLine(
      UUID invoiceId,
      String description,
      BigDecimal quantity,
      BigDecimal unitPrice,
      BigDecimal taxRate,
      int sortOrder) {
    this.invoiceId = invoiceId;
    this.description = description;
    this.quantity = quantity;
    this.unitPrice = unitPrice;
    this.taxRate = taxRate;
    this.sortOrder = sortOrder;
    var amounts = InvoiceTotalsCalculator.line(quantity, unitPrice, taxRate);
    this.lineTotal = amounts.lineTotal();
    this.taxAmount = amounts.taxAmount();
    this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
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

  public UUID getInvoiceId() {
    return invoiceId;
  }

  public String getDescription() {
    return description;
  }

  public BigDecimal getQuantity() {
    return quantity;
  }

  public BigDecimal getUnitPrice() {
    return unitPrice;
  }

  public BigDecimal getTaxRate() {
    return taxRate;
  }

  @Override
  public BigDecimal getLineTotal() {
    return lineTotal;
  }

  @Override
  public BigDecimal getTaxAmount() {
    return taxAmount;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
