package io.invoicedesk.backend;

import io.invoicedesk.backend.company.Company;
import io.invoicedesk.backend.company.CompanyService;
import io.invoicedesk.backend.company.dto.CompanyRequest;
import io.invoicedesk.backend.customer.Customer;
import io.invoicedesk.backend.customer.CustomerService;
import io.invoicedesk.backend.customer.dto.CustomerRequest;
import io.invoicedesk.backend.invoice.InvoiceService;
import io.invoicedesk.backend.invoice.dto.CreateInvoiceRequest;
import io.invoicedesk.backend.invoice.dto.InvoiceLineRequest;
import io.invoicedesk.backend.invoice.dto.InvoiceResponse;
import io.invoicedesk.backend.multitenancy.TenantContext;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/** Builders for companies, customers and drafts used across integration tests. */
public final class TestFixtures {

  private TestFixtures() {}

  public static Company company(CompanyService companyService, String prefix) {
    return companyService.create(
        new CompanyRequest(
            "Company " + prefix,
            "BG123456789",
            "123456789",
            "bg",
            "1 Vitosha Blvd, Sofia",
            "BG80BNBG96611020345678",
            "BNBGBGSD",
            prefix));
  }

  public static Customer customer(CustomerService customerService, UUID companyId, String name)
      throws Exception {
    return TenantContext.callAs(
        companyId,
        () ->
            customerService.create(
                new CustomerRequest(
                    name,
                    "5 Rakovski St, Plovdiv",
                    "BG987654321",
                    "987654321",
                    "BG",
                    true,
                    "billing@example.com",
                    "+359 2 000 000")));
  }

  public static InvoiceLineRequest line(
      String description, String quantity, String unitPrice, String taxRate) {
    return new InvoiceLineRequest(
        description, new BigDecimal(quantity), new BigDecimal(unitPrice), new BigDecimal(taxRate));
  }

  public static InvoiceResponse draft(
      InvoiceService invoiceService, UUID companyId, UUID customerId) throws Exception {
    return draft(
        invoiceService,
        companyId,
        customerId,
        List.of(line("Consulting", "2", "50.00", "0.20"), line("Hosting", "1", "100.00", "0")));
  }

  public static InvoiceResponse draft(
      InvoiceService invoiceService,
      UUID companyId,
      UUID customerId,
      List<InvoiceLineRequest> lines)
      throws Exception {
    return TenantContext.callAs(
        companyId,
        () ->
            invoiceService.createDraft(
                new CreateInvoiceRequest(customerId, "BGN", "en", null, null, lines)));
  }
}
