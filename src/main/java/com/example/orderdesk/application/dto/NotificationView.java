package com.example.orderdesk.application.dto;

import com.example.orderdesk.domain.model.NotificationSeverity;

import java.time.Instant;

public record NotificationView(
        String notificationId,
        String orderId,
        NotificationSeverity severity,
        String title,
        String message,
        String linkUrl,
        boolean read,
        Instant createdAt
) {}
