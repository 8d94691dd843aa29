package com.example.orderdesk.application.port.out;

import com.example.orderdesk.domain.model.NotificationSeverity;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for real-time notification delivery (push, mail, SMS).
 * Best effort: implementations never fail the returned future.
 */
public interface NotificationDeliveryPort {

    CompletableFuture<DeliveryResult> deliver(String recipientId, DeliveryPayload payload);

    record DeliveryPayload(
            String notificationId,
            String orderId,
            NotificationSeverity severity,
            String title,
            String message,
            String link
    ) {}

    record DeliveryResult(
            boolean delivered,
            String detail
    ) {
        public static DeliveryResult delivered(String detail) {
            return new DeliveryResult(true, detail);
        }

        public static DeliveryResult skipped(String detail) {
            return new DeliveryResult(false, detail);
        }
    }
}
