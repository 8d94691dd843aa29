package com.example.orderdesk.application.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record QuotationView(
        String quotationId,
        String orderId,
        BigDecimal basePrice,
        BigDecimal urgencyCharge,
        BigDecimal discount,
        BigDecimal tax,
        BigDecimal finalPrice,
        String currency,
        String notes,
        String quotedBy,
        Instant acceptedAt,
        Instant updatedAt
) {}
