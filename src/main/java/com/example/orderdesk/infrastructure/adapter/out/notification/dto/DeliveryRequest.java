package com.example.orderdesk.infrastructure.adapter.out.notification.dto;

import com.example.orderdesk.application.port.out.NotificationDeliveryPort.DeliveryPayload;

/**
 * Request DTO for the notification delivery service.
 */
public record DeliveryRequest(
        String recipientId,
        String notificationId,
        String orderId,
        String severity,
        String title,
        String message,
        String link
) {
    public static DeliveryRequest of(String recipientId, DeliveryPayload payload) {
        return new DeliveryRequest(
                recipientId,
                payload.notificationId(),
                payload.orderId(),
                payload.severity().name(),
                payload.title(),
                payload.message(),
                payload.link());
    }
}
