package com.example.orderdesk.infrastructure.adapter.out.notification;

import com.example.orderdesk.application.port.out.NotificationDeliveryPort;
import com.example.orderdesk.infrastructure.adapter.out.notification.dto.DeliveryRequest;
import com.example.orderdesk.infrastructure.exception.NonRetryableServiceException;
import com.example.orderdesk.infrastructure.exception.RetryableServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Push adapter for the notification/mail/SMS service. Never fails the returned future:
 * timeouts and errors degrade to a skipped delivery, the persisted notification stays.
 * Decorator order: CircuitBreaker → TimeLimiter → HTTP call
 */
@Component
public class NotificationDeliveryAdapter implements NotificationDeliveryPort {

    private static final Logger log = LoggerFactory.getLogger(NotificationDeliveryAdapter.class);
    private static final String SERVICE_NAME = "notification";

    private final WebClient webClient;

    public NotificationDeliveryAdapter(@Qualifier("notificationWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @CircuitBreaker(name = "notificationCB", fallbackMethod = "deliverFallback")
    @TimeLimiter(name = "notificationTL")
    public CompletableFuture<DeliveryResult> deliver(String recipientId, DeliveryPayload payload) {
        log.debug("Pushing notification {} to {}", payload.notificationId(), recipientId);

        return webClient.post()
                .uri("/api/notifications/deliver")
                .bodyValue(DeliveryRequest.of(recipientId, payload))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, response ->
                        Mono.error(new NonRetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(),
                                "Notification service refused delivery to " + recipientId)))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        Mono.error(new RetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(),
                                "Notification service temporarily unavailable")))
                .toBodilessEntity()
                .map(response -> DeliveryResult.delivered("HTTP " + response.getStatusCode().value()))
                .toFuture();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<DeliveryResult> deliverFallback(
            String recipientId, DeliveryPayload payload, TimeoutException ex) {
        log.warn("Push of notification {} to {} timed out", payload.notificationId(), recipientId);
        return CompletableFuture.completedFuture(DeliveryResult.skipped("推播逾時，通知已保存"));
    }

    @SuppressWarnings("unused")
    private CompletableFuture<DeliveryResult> deliverFallback(
            String recipientId, DeliveryPayload payload, CallNotPermittedException ex) {
        log.warn("Notification circuit breaker is OPEN, push to {} skipped", recipientId);
        return CompletableFuture.completedFuture(DeliveryResult.skipped("推播服務暫時不可用，通知已保存"));
    }

    @SuppressWarnings("unused")
    private CompletableFuture<DeliveryResult> deliverFallback(
            String recipientId, DeliveryPayload payload, Throwable throwable) {
        log.warn("Push of notification {} to {} failed, cause: {}",
                payload.notificationId(), recipientId, throwable.getMessage());
        return CompletableFuture.completedFuture(DeliveryResult.skipped("推播失敗，通知已保存"));
    }
}
