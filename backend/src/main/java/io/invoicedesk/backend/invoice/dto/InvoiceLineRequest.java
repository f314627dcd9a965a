package io.invoicedesk.backend.invoice.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * @param taxRate fraction, e.g. 0.20 for 20 %
 */
public record InvoiceLineRequest(
    @NotBlank @Size(max = 1000) String description,
    @NotNull @DecimalMin(value = "0", inclusive = false) @Digits(integer = 15, fraction = 3)
        BigDecimal quantity,
    @NotNull @DecimalMin("0") @Digits(integer = 14, fraction = 4) BigDecimal unitPrice,
    @NotNull @DecimalMin("0") @DecimalMax("1") @Digits(integer = 1, fraction = 4)
        BigDecimal taxRate) {}
