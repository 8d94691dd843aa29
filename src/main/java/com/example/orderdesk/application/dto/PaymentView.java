package com.example.orderdesk.application.dto;

import com.example.orderdesk.domain.model.PaymentState;

import java.math.BigDecimal;
import java.time.Instant;

public record PaymentView(
        String paymentId,
        String orderId,
        String payerId,
        BigDecimal amount,
        PaymentState state,
        Integer verifiedPercentage,
        String receiptReference,
        String rejectionReason,
        String workCode,
        Instant createdAt,
        Instant reviewedAt
) {}
