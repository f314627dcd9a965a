package io.invoicedesk.backend.invoice;

import io.invoicedesk.backend.company.CompanyRepository;
import io.invoicedesk.backend.exception.ResourceNotFoundException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Allocates invoice numbers from the per-company counter on the {@code companies} row.
 *
 * <ul>
 *   <li>Must join the issuance transaction: the counter increment commits or rolls back together
 *       with the status flip.
 *   <li>The company row is locked for the rest of that transaction, so concurrent issuances in one
 *       company take turns; the version column and the unique (company_id, invoice_number) index
 *       catch anything the lock does not.
 *   <li>Numbers are never reused. A rolled back attempt reverts the counter.
 *   <li>Format: prefix + counter, zero padded to {@code invoicedesk.numbering.min-digits}.
 * </ul>
 */
@Service
public class InvoiceNumberService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceNumberService.class);

  private final CompanyRepository companyRepository;
  private final NumberingProperties numberingProperties;

  public InvoiceNumberService(
      CompanyRepository companyRepository, NumberingProperties numberingProperties) {
    this.companyRepository = companyRepository;
    this.numberingProperties = numberingProperties;
  }

  /**
   * Reserves the next number for the given company.
   *
   * @return formatted invoice number, e.g. "INV42" or "INV0042" with min-digits 4
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public String allocate(UUID companyId) {
    var company =
        companyRepository
            .findByIdForUpdate(companyId)
            .orElseThrow(() -> new ResourceNotFoundException("Company", companyId));
    long counter = company.advanceInvoiceCounter();
    companyRepository.save(company);
    String number = format(company.getInvoiceNumberPrefix(), counter);
    log.debug("Allocated invoice number {} for company {}", number, companyId);
    return number;
  }

  String format(String prefix, long counter) {
    String digits = Long.toString(counter);
    int padding = numberingProperties.minDigits() - digits.length();
    if (padding > 0) {
      digits = "0".repeat(padding) + digits;
    }
    return (prefix == null ? "" : prefix) + digits;
  }
}
