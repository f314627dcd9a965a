package io.invoicedesk.backend.company;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Tenant root. Owns customers and invoices and the invoice number counter.
 *
 * <p>{@code nextInvoiceNumber} is only advanced by the invoice numbering service, inside the
 * issuance transaction, while the row is locked. The {@code version} column turns the counter
 * write into a compare-and-increment.
 */
@Entity
@Table(name = "companies")
public class Company {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "vat_number", length = 50)
  private String vatNumber;

  @Column(name = "eik", length = 13)
  private String eik;

  @Column(name = "country_code", nullable = false, length = 8)
  private String countryCode;

  @Column(name = "address", length = 400)
  private String address;

  @Column(name = "bank_iban", length = 64)
  private String bankIban;

  @Column(name = "bank_bic", length = 32)
  private String bankBic;

  @Column(name = "invoice_number_prefix", length = 32)
  private String invoiceNumberPrefix;

  @Column(name = "next_invoice_number", nullable = false)
  private long nextInvoiceNumber = 1;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Company() {}

  public Company(String name, String countryCode, String invoiceNumberPrefix) {
    this.name = name;
    this.countryCode = countryCode;
    this.invoiceNumberPrefix = invoiceNumberPrefix;
    this.nextInvoiceNumber = 1;
    this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    this.updatedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
  }

  /** Updates master data. The invoice counter is deliberately not part of this. */
  public void updateDetails(
      String name,
      String vatNumber,
      String eik,
      String countryCode,
      String address,
      String bankIban,
      String bankBic,
      String invoiceNumberPrefix) {
    this.name = name;
    this.vatNumber = vatNumber;
    this.eik = eik;
    this.countryCode = countryCode;
    this.address = address;
    this.bankIban = bankIban;
    this.bankBic = bankBic;
    this.invoiceNumberPrefix = invoiceNumberPrefix;
    this.updatedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
  }

  /**
   * Returns the current counter value and advances it by one.
   *
   * @return the counter value to use for the invoice being issued
   */
  public long advanceInvoiceCounter() {
    long current = this.nextInvoiceNumber;
    this.nextInvoiceNumber = current + 1;
    this.updatedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    return current;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getVatNumber() {
    return vatNumber;
  }

  public String getEik() {
    return eik;
  }

  public String getCountryCode() {
    return countryCode;
  }

  public String getAddress() {
    return address;
  }

  public String getBankIban() {
    return bankIban;
  }

  public String getBankBic() {
    return bankBic;
  }

  public String getInvoiceNumberPrefix() {
    return invoiceNumberPrefix;
  }

  public long getNextInvoiceNumber() {
    return nextInvoiceNumber;
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
}
