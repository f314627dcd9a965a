package io.invoicedesk.backend.customer;

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
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.hibernate.annotations.Filter;

/**
 * Customer master data. Freely editable: invoices copy name, address and VAT number at issuance, so
 * later edits never reach an issued invoice.
 */
@Entity
@Table(name = "customers")
@Filter(name = TenantFilterTransactionManager.FILTER_NAME, condition = "company_id = :companyId")
@EntityListeners(TenantAwareEntityListener.class)
public class Customer implements TenantAware {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false, updatable = false)
  private UUID companyId;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "address", length = 400)
  private String address;

  @Column(name = "vat_number", length = 50)
  private String vatNumber;

  @Column(name = "eik", length = 13)
  private String eik;

  @Column(name = "country_code", length = 8)
  private String countryCode;

  @Column(name = "vat_registered", nullable = false)
  private boolean vatRegistered;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "phone", length = 50)
  private String phone;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Customer() {}

  public Customer(String name, String address, String vatNumber) {
    this.name = name;
    this.address = address;
    this.vatNumber = vatNumber;
    this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    this.updatedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
  }

  public void update(
      String name,
      String address,
      String vatNumber,
      String eik,
      String countryCode,
      boolean vatRegistered,
      String email,
      String phone) {
    this.name = name;
    this.address = address;
    this.vatNumber = vatNumber;
    this.eik = eik;
    this.countryCode = countryCode;
    this.vatRegistered = vatRegistered;
    this.email = email;
    this.phone = phone;
    this.updatedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
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

  public String getName() {
    return name;
  }

  public String getAddress() {
    return address;
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

  public boolean isVatRegistered() {
    return vatRegistered;
  }

  public String getEmail() {
    return email;
  }

  public String getPhone() {
    return phone;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
