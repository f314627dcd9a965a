package io.invoicedesk.backend.customer.dto;

import io.invoicedesk.backend.customer.Customer;
import java.time.Instant;
import java.util.UUID;

public record CustomerResponse(
    UUID id,
    String name,
    String address,
    String vatNumber,
    String eik,
    String countryCode,
    boolean vatRegistered,
    String email,
    String phone,
    Instant createdAt,
    Instant updatedAt) {

  public static CustomerResponse from(Customer customer) {
    return new CustomerResponse(
        customer.getId(),
        customer.getName(),
        customer.getAddress(),
        customer.getVatNumber(),
        customer.getEik(),
        customer.getCountryCode(),
        customer.isVatRegistered(),
        customer.getEmail(),
        customer.getPhone(),
        customer.getCreatedAt(),
        customer.getUpdatedAt());
  }
}
