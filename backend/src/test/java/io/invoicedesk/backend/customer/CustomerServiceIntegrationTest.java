package io.invoicedesk.backend.customer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.invoicedesk.backend.TestFixtures;
import io.invoicedesk.backend.TestcontainersConfiguration;
import io.invoicedesk.backend.company.CompanyService;
import io.invoicedesk.backend.customer.dto.CustomerRequest;
import io.invoicedesk.backend.exception.ErrorKind;
import io.invoicedesk.backend.exception.InvalidStateException;
import io.invoicedesk.backend.exception.ResourceNotFoundException;
import io.invoicedesk.backend.invoice.InvoiceService;
import io.invoicedesk.backend.multitenancy.TenantContext;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class CustomerServiceIntegrationTest {

  @Autowired private CustomerService customerService;
  @Autowired private CompanyService companyService;
  @Autowired private InvoiceService invoiceService;

  private UUID companyId;
  private UUID otherCompanyId;

  @BeforeAll
  void setup() {
    companyId = TestFixtures.company(companyService, "CUS").getId();
    otherCompanyId = TestFixtures.company(companyService, "CUSX").getId();
  }

  @Test
  void createStampsTenantAndNormalizesCountry() throws Exception {
    var customer =
        TenantContext.callAs(
            companyId,
            () ->
                customerService.create(
                    new CustomerRequest(
                        "Beta OOD", null, null, "121212121", " bg ", false, null, null)));

    assertThat(customer.getCompanyId()).isEqualTo(companyId);
    assertThat(customer.getCountryCode()).isEqualTo("BG");
    assertThat(customer.isVatRegistered()).isFalse();
  }

  @Test
  void customerIsInvisibleToOtherCompanies() throws Exception {
    var customer = TestFixtures.customer(customerService, companyId, "Hidden Ltd");

    assertThatThrownBy(
            () ->
                TenantContext.callAs(
                    otherCompanyId, () -> customerService.getCustomer(customer.getId())))
        .isInstanceOf(ResourceNotFoundException.class);
    assertThat(TenantContext.callAs(otherCompanyId, customerService::findAll))
        .extracting(Customer::getId)
        .doesNotContain(customer.getId());
  }

  @Test
  void updateReplacesDetails() throws Exception {
    var customer = TestFixtures.customer(customerService, companyId, "Old Name");

    var updated =
        TenantContext.callAs(
            companyId,
            () ->
                customerService.update(
                    customer.getId(),
                    new CustomerRequest(
                        "New Name",
                        "2 Shipka St, Varna",
                        "BG111111111",
                        "111111111",
                        "BG",
                        true,
                        "ap@example.com",
                        null)));

    assertThat(updated.getName()).isEqualTo("New Name");
    assertThat(updated.getAddress()).isEqualTo("2 Shipka St, Varna");
    assertThat(updated.getEmail()).isEqualTo("ap@example.com");
  }

  @Test
  void customerReferencedByInvoiceCannotBeDeleted() throws Exception {
    var customer = TestFixtures.customer(customerService, companyId, "Busy Ltd");
    TestFixtures.draft(invoiceService, companyId, customer.getId());

    assertThatThrownBy(
            () ->
                TenantContext.runAs(companyId, () -> customerService.delete(customer.getId())))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            ex -> assertThat(ErrorKind.of(ex)).isEqualTo(ErrorKind.INVALID_STATE));
  }

  @Test
  void unusedCustomerIsDeleted() throws Exception {
    var customer = TestFixtures.customer(customerService, companyId, "Idle Ltd");

    TenantContext.runAs(companyId, () -> customerService.delete(customer.getId()));

    assertThatThrownBy(
            () ->
                TenantContext.callAs(
                    companyId, () -> customerService.getCustomer(customer.getId())))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
