package io.invoicedesk.backend.invoice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record CreateInvoiceRequest(
    @NotNull UUID customerId,
    @Pattern(regexp = "[A-Z]{3}") String currency,
    @Pattern(regexp = "[a-z]{2}") String language,
    @Size(max = 2000) String notes,
    LocalDate issueDate,
    @Valid List<InvoiceLineRequest> lines) {}
