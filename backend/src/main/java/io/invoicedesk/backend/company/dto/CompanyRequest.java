package io.invoicedesk.backend.company.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CompanyRequest(
    @NotBlank @Size(max = 200) String name,
    @Size(max = 50) String vatNumber,
    @Size(max = 13) String eik,
    @NotBlank @Size(max = 8) String countryCode,
    @Size(max = 400) String address,
    @Size(max = 64) String bankIban,
    @Size(max = 32) String bankBic,
    @Size(max = 32) String invoiceNumberPrefix) {}
