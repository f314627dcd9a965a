package io.invoicedesk.backend.customer.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CustomerRequest(
    @NotBlank @Size(max = 200) String name,
    @Size(max = 400) String address,
    @Size(max = 50) String vatNumber,
    @Size(max = 13) String eik,
    @Size(max = 8) String countryCode,
    boolean vatRegistered,
    @Email @Size(max = 255) String email,
    @Size(max = 50) String phone) {}
