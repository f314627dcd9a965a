package io.invoicedesk.backend.invoice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ReplaceLinesRequest(@NotNull @Valid List<InvoiceLineRequest> lines) {}
