package io.invoicedesk.backend.company.dto;

import io.invoicedesk.backend.company.Company;
import java.time.Instant;
import java.util.UUID;

public record CompanyResponse(
    UUID id,
    String name,
    String vatNumber,
    String eik,
    String countryCode,
    String address,
    String bankIban,
    String bankBic,
    String invoiceNumberPrefix,
    long nextInvoiceNumber,
    Instant createdAt,
    Instant updatedAt) {

  public static CompanyResponse from(Company company) {
    return new CompanyResponse(
        company.getId(),
        company.getName(),
        company.getVatNumber(),
        company.getEik(),
        company.getCountryCode(),
        company.getAddress(),
        company.getBankIban(),
        company.getBankBic(),
        company.getInvoiceNumberPrefix(),
        company.getNextInvoiceNumber(),
        company.getCreatedAt(),
        company.getUpdatedAt());
  }
}
