package io.invoicedesk.backend.invoice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.invoicedesk.backend.company.Company;
import io.invoicedesk.backend.company.CompanyRepository;
import io.invoicedesk.backend.exception.ResourceNotFoundException;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InvoiceNumberServiceTest {

  private static final UUID COMPANY_ID = UUID.randomUUID();

  @Mock private CompanyRepository companyRepository;

  @Test
  void formatsWithoutPaddingByDefault() {
    var service = new InvoiceNumberService(companyRepository, new NumberingProperties(0));

    assertThat(service.format("INV", 1)).isEqualTo("INV1");
    assertThat(service.format("INV", 42)).isEqualTo("INV42");
  }

  @Test
  void zeroPadsToMinDigits() {
    var service = new InvoiceNumberService(companyRepository, new NumberingProperties(4));

    assertThat(service.format("INV-", 7)).isEqualTo("INV-0007");
    assertThat(service.format("INV-", 12345)).isEqualTo("INV-12345");
  }

  @Test
  void missingPrefixYieldsBareCounter() {
    var service = new InvoiceNumberService(companyRepository, new NumberingProperties(0));

    assertThat(service.format(null, 3)).isEqualTo("3");
  }

  @Test
  void allocateAdvancesTheLockedCounter() {
    var company = new Company("Acme", "BG", "INV");
    when(companyRepository.findByIdForUpdate(COMPANY_ID)).thenReturn(Optional.of(company));
    var service = new InvoiceNumberService(companyRepository, new NumberingProperties(0));

    assertThat(service.allocate(COMPANY_ID)).isEqualTo("INV1");
    assertThat(service.allocate(COMPANY_ID)).isEqualTo("INV2");
    assertThat(company.getNextInvoiceNumber()).isEqualTo(3);
    verify(companyRepository, times(2)).save(company);
  }

  @Test
  void allocateForUnknownCompanyFails() {
    when(companyRepository.findByIdForUpdate(COMPANY_ID)).thenReturn(Optional.empty());
    var service = new InvoiceNumberService(companyRepository, new NumberingProperties(0));

    assertThatThrownBy(() -> service.allocate(COMPANY_ID))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void rejectsOutOfRangeMinDigits() {
    assertThatThrownBy(() -> new NumberingProperties(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
