package com.example.orderdesk.infrastructure.outbox;

import com.example.orderdesk.application.dto.WorkflowEvent;
import com.example.orderdesk.application.port.out.WorkflowEventPublisher;
import com.example.orderdesk.infrastructure.audit.AuditTrail;
import com.example.orderdesk.infrastructure.notification.NotificationFanOut;
import com.example.orderdesk.infrastructure.persistence.entity.NotificationEntity;
import com.example.orderdesk.infrastructure.persistence.entity.OutboxEvent;
import com.example.orderdesk.infrastructure.persistence.entity.OutboxEventStatus;
import com.example.orderdesk.infrastructure.persistence.repository.OutboxRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Dispatches committed outbox events: one audit entry, the persisted notifications, then a
 * best-effort push. Called right after commit and again by {@link OutboxPoller} for events
 * that did not get through.
 */
@Component
public class WorkflowEventDispatcher implements WorkflowEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEventDispatcher.class);

    private static final Set<OutboxEventStatus> CLAIMABLE =
            EnumSet.of(OutboxEventStatus.PENDING, OutboxEventStatus.FAILED);

    private final OutboxRepository outboxRepository;
    private final AuditTrail auditTrail;
    private final NotificationFanOut notificationFanOut;
    private final ObjectMapper objectMapper;
    private final int maxRetries;

    public WorkflowEventDispatcher(
            OutboxRepository outboxRepository,
            AuditTrail auditTrail,
            NotificationFanOut notificationFanOut,
            ObjectMapper objectMapper,
            @Value("${outbox.poller.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.auditTrail = auditTrail;
        this.notificationFanOut = notificationFanOut;
        this.objectMapper = objectMapper;
        this.maxRetries = maxRetries;
    }

    @Override
    public void publish(String eventId) {
        try {
            if (outboxRepository.claim(eventId, CLAIMABLE, OutboxEventStatus.PROCESSING) == 0) {
                log.debug("Outbox event {} already claimed or processed", eventId);
                return;
            }
            dispatch(eventId);
        } catch (RuntimeException e) {
            log.error("Dispatch of outbox event {} failed", eventId, e);
        }
    }

    private void dispatch(String eventId) {
        OutboxEvent outboxEvent = outboxRepository.findById(eventId).orElse(null);
        if (outboxEvent == null) {
            log.warn("Outbox event {} disappeared before dispatch", eventId);
            return;
        }
        List<NotificationEntity> notifications = List.of();
        try {
            WorkflowEvent event = objectMapper.readValue(outboxEvent.getPayload(), WorkflowEvent.class);
            boolean audited = auditTrail.record(eventId, event);
            notifications = notificationFanOut.persist(eventId, event.orderId(), notificationFanOut.address(event));
            if (audited) {
                outboxEvent.markProcessed();
            } else {
                fail(outboxEvent, "Audit entry not written");
            }
        } catch (Exception e) {
            log.warn("Outbox event {} ({}) not dispatched: {}", eventId, outboxEvent.getEventType(), e.getMessage());
            fail(outboxEvent, e.getMessage());
        }
        outboxRepository.save(outboxEvent);
        notificationFanOut.push(notifications);
    }

    private void fail(OutboxEvent outboxEvent, String reason) {
        outboxEvent.markFailed(reason);
        if (outboxEvent.getRetryCount() >= maxRetries) {
            log.error("Outbox event {} ({}) gave up after {} attempts: {}",
                    outboxEvent.getId(), outboxEvent.getEventType(), outboxEvent.getRetryCount(), reason);
        }
    }
}
