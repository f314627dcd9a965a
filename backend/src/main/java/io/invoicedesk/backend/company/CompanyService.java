package io.invoicedesk.backend.company;

import io.invoicedesk.backend.company.dto.CompanyRequest;
import io.invoicedesk.backend.exception.ResourceNotFoundException;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CompanyService {

  private static final Logger log = LoggerFactory.getLogger(CompanyService.class);

  private final CompanyRepository companyRepository;

  public CompanyService(CompanyRepository companyRepository) {
    this.companyRepository = companyRepository;
  }

  @Transactional
  public Company create(CompanyRequest request) {
    var company =
        new Company(
            request.name(), normalizeCountry(request.countryCode()), request.invoiceNumberPrefix());
    company.updateDetails(
        request.name(),
        request.vatNumber(),
        request.eik(),
        normalizeCountry(request.countryCode()),
        request.address(),
        request.bankIban(),
        request.bankBic(),
        request.invoiceNumberPrefix());
    company = companyRepository.save(company);
    log.info("Created company {} ({})", company.getId(), company.getName());
    return company;
  }

  @Transactional
  public Company update(UUID companyId, CompanyRequest request) {
    var company = getCompany(companyId);
    company.updateDetails(
        request.name(),
        request.vatNumber(),
        request.eik(),
        normalizeCountry(request.countryCode()),
        request.address(),
        request.bankIban(),
        request.bankBic(),
        request.invoiceNumberPrefix());
    company = companyRepository.save(company);
    log.info("Updated company {}", companyId);
    return company;
  }

  @Transactional(readOnly = true)
  public Company getCompany(UUID companyId) {
    return companyRepository
        .findById(companyId)
        .orElseThrow(() -> new ResourceNotFoundException("Company", companyId));
  }

  @Transactional(readOnly = true)
  public List<Company> findAll() {
    return companyRepository.findAllOrdered();
  }

  private static String normalizeCountry(String countryCode) {
    return countryCode == null ? null : countryCode.trim().toUpperCase();
  }
}
