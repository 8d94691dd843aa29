package com.example.orderdesk.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Request DTO for the quotation of an order. Omit {@code finalPrice} to have it derived as
 * base + urgency - discount + tax.
 */
public record QuoteRequest(
        @NotNull(message = "Base price is required")
        @PositiveOrZero(message = "Base price cannot be negative")
        BigDecimal basePrice,

        @PositiveOrZero(message = "Urgency charge cannot be negative")
        BigDecimal urgencyCharge,

        @PositiveOrZero(message = "Discount cannot be negative")
        BigDecimal discount,

        @PositiveOrZero(message = "Tax cannot be negative")
        BigDecimal tax,

        BigDecimal finalPrice,

        String notes
) {}
