package io.invoicedesk.backend.invoice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.invoicedesk.backend.TestFixtures;
import io.invoicedesk.backend.TestcontainersConfiguration;
import io.invoicedesk.backend.company.CompanyService;
import io.invoicedesk.backend.customer.CustomerService;
import io.invoicedesk.backend.invoice.dto.InvoiceResponse;
import io.invoicedesk.backend.multitenancy.TenantContext;
import io.invoicedesk.backend.operations.CancellationToken;
import io.invoicedesk.backend.operations.InvoiceOperations;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class InvoiceNumberServiceIntegrationTest {

  private static final int CONCURRENT_ISSUES = 8;

  @Autowired private InvoiceNumberService invoiceNumberService;
  @Autowired private InvoiceService invoiceService;
  @Autowired private InvoiceOperations invoiceOperations;
  @Autowired private CompanyService companyService;
  @Autowired private CustomerService customerService;
  @Autowired private TransactionTemplate transactionTemplate;

  @Test
  void allocatesConsecutiveNumbersStartingAtOne() {
    UUID companyId = TestFixtures.company(companyService, "SEQ").getId();

    assertThat(allocate(companyId)).isEqualTo("SEQ1");
    assertThat(allocate(companyId)).isEqualTo("SEQ2");
    assertThat(allocate(companyId)).isEqualTo("SEQ3");
    assertThat(companyService.getCompany(companyId).getNextInvoiceNumber()).isEqualTo(4);
  }

  @Test
  void companiesHaveIndependentSequences() {
    UUID first = TestFixtures.company(companyService, "INDX").getId();
    UUID second = TestFixtures.company(companyService, "INDY").getId();

    assertThat(allocate(first)).isEqualTo("INDX1");
    assertThat(allocate(first)).isEqualTo("INDX2");
    assertThat(allocate(second)).isEqualTo("INDY1");
  }

  @Test
  void rolledBackAllocationDoesNotConsumeANumber() {
    UUID companyId = TestFixtures.company(companyService, "RB").getId();

    transactionTemplate.executeWithoutResult(
        status -> {
          invoiceNumberService.allocate(companyId);
          status.setRollbackOnly();
        });

    assertThat(allocate(companyId)).isEqualTo("RB1");
  }

  @Test
  void allocationOutsideATransactionIsRefused() {
    UUID companyId = TestFixtures.company(companyService, "NOTX").getId();

    assertThatThrownBy(() -> invoiceNumberService.allocate(companyId))
        .isInstanceOf(IllegalTransactionStateException.class);
  }

  @Test
  void concurrentIssuesProduceDistinctConsecutiveNumbers() throws Exception {
    UUID companyId = TestFixtures.company(companyService, "CONC").getId();
    UUID customerId = TestFixtures.customer(customerService, companyId, "Conc Ltd").getId();
    var drafts = new ArrayList<UUID>();
    for (int i = 0; i < CONCURRENT_ISSUES; i++) {
      drafts.add(TestFixtures.draft(invoiceService, companyId, customerId).id());
    }

    List<CompletableFuture<InvoiceResponse>> futures =
        TenantContext.callAs(
            companyId,
            () ->
                drafts.stream()
                    .map(id -> invoiceOperations.issue(id, CancellationToken.create()))
                    .toList());
    CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get(60, TimeUnit.SECONDS);

    var numbers = futures.stream().map(f -> f.join().invoiceNumber()).toList();
    var expected =
        IntStream.rangeClosed(1, CONCURRENT_ISSUES)
            .mapToObj(n -> "CONC" + n)
            .toArray(String[]::new);
    assertThat(numbers).containsExactlyInAnyOrder(expected);
    assertThat(companyService.getCompany(companyId).getNextInvoiceNumber())
        .isEqualTo(CONCURRENT_ISSUES + 1L);
  }

  private String allocate(UUID companyId) {
    return transactionTemplate.execute(tx -> invoiceNumberService.allocate(companyId));
  }
}
