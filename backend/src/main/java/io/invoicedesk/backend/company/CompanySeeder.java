package io.invoicedesk.backend.company;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates a default company on first startup so a fresh installation can issue invoices. Does
 * nothing once any company exists.
 */
@Component
public class CompanySeeder implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(CompanySeeder.class);

  static final String DEFAULT_NAME = "Default Company";
  static final String DEFAULT_PREFIX = "INV";
  static final String DEFAULT_COUNTRY = "BG";

  private final CompanyRepository companyRepository;
  private final SeedProperties seedProperties;

  public CompanySeeder(CompanyRepository companyRepository, SeedProperties seedProperties) {
    this.companyRepository = companyRepository;
    this.seedProperties = seedProperties;
  }

  @Override
  @Transactional
  public void run(ApplicationArguments args) {
    if (!seedProperties.defaultCompany()) {
      return;
    }
    if (companyRepository.count() > 0) {
      log.debug("Companies present, skipping default company seed");
      return;
    }
    var company =
        companyRepository.save(new Company(DEFAULT_NAME, DEFAULT_COUNTRY, DEFAULT_PREFIX));
    log.info("Seeded default company {} with prefix {}", company.getId(), DEFAULT_PREFIX);
  }
}
