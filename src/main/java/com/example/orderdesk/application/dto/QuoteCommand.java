package com.example.orderdesk.application.dto;

import com.example.orderdesk.domain.exception.ValidationException;

import java.math.BigDecimal;

/**
 * Command for creating or updating the quotation of an order.
 * {@code finalPrice} may be null, in which case it is derived.
 */
public record QuoteCommand(
        String orderId,
        String actorId,
        BigDecimal basePrice,
        BigDecimal urgencyCharge,
        BigDecimal discount,
        BigDecimal tax,
        BigDecimal finalPrice,
        String notes
) {
    public QuoteCommand {
        if (orderId == null || orderId.isBlank()) {
            throw new ValidationException("Order id is required");
        }
        if (actorId == null || actorId.isBlank()) {
            throw new ValidationException("Actor id is required");
        }
        if (basePrice == null) {
            throw new ValidationException("Base price is required");
        }
    }
}
