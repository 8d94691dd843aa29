package com.example.orderdesk.application.dto;

import com.example.orderdesk.domain.model.OrderStatus;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read model of an order.
 */
public record OrderView(
        String orderId,
        String queryCode,
        String workCode,
        String clientId,
        String bdeId,
        String assignedWriterId,
        String topic,
        String subject,
        String service,
        String urgency,
        OrderStatus status,
        int statusCode,
        BigDecimal basicPrice,
        BigDecimal discount,
        BigDecimal totalPrice,
        Instant deadlineAt,
        long version,
        Instant createdAt,
        Instant updatedAt
) {}
