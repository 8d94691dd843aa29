package com.example.orderdesk.application.service;

import com.example.orderdesk.application.dto.PaymentView;
import com.example.orderdesk.application.dto.TransactionOutcome;
import com.example.orderdesk.application.port.in.PaymentVerificationUseCase;
import com.example.orderdesk.application.port.out.WorkflowEventPublisher;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.persistence.PaymentPersistenceService;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Payment gate. Verification runs each attempt in a fresh transaction so a work code
 * collision or a lost order update can be retried by the {@code workCodeIssuance} instance.
 */
@Service
public class PaymentVerificationService implements PaymentVerificationUseCase {

    private static final Logger log = LoggerFactory.getLogger(PaymentVerificationService.class);

    private final PaymentPersistenceService persistenceService;
    private final ActorResolver actorResolver;
    private final WorkflowEventPublisher eventPublisher;

    public PaymentVerificationService(
            PaymentPersistenceService persistenceService,
            ActorResolver actorResolver,
            WorkflowEventPublisher eventPublisher) {
        this.persistenceService = persistenceService;
        this.actorResolver = actorResolver;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public PaymentView submitPayment(String orderId, String clientId, BigDecimal amount, String receiptReference) {
        Actor client = actorResolver.resolve(clientId, "submit payments", Role.CLIENT);
        TransactionOutcome<PaymentView> outcome =
                persistenceService.submit(orderId, client, amount, receiptReference);
        log.info("Payment {} of {} submitted for order {}", outcome.value().paymentId(), amount, orderId);
        return eventPublisher.publish(outcome);
    }

    @Override
    @Retry(name = "workCodeIssuance")
    public PaymentView verifyPayment(String paymentId, String adminId, int percentage) {
        Actor admin = actorResolver.resolve(adminId, "verify payments", Role.ADMIN);
        TransactionOutcome<PaymentView> outcome = persistenceService.verify(paymentId, admin, percentage);
        if (outcome.hasEvent()) {
            log.info("Payment {} verified at {}% by {}, work code {}",
                    paymentId, percentage, admin.id(), outcome.value().workCode());
        } else {
            log.info("Payment {} already verified, nothing changed", paymentId);
        }
        return eventPublisher.publish(outcome);
    }

    @Override
    public PaymentView rejectPayment(String paymentId, String adminId, String reason) {
        Actor admin = actorResolver.resolve(adminId, "reject payments", Role.ADMIN);
        TransactionOutcome<PaymentView> outcome = persistenceService.reject(paymentId, admin, reason);
        log.info("Payment {} rejected by {}", paymentId, admin.id());
        return eventPublisher.publish(outcome);
    }

    @Override
    public List<PaymentView> payments(String orderId) {
        return persistenceService.payments(orderId);
    }
}
