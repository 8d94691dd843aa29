package com.example.orderdesk.infrastructure.audit;

import com.example.orderdesk.application.dto.WorkflowEvent;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.infrastructure.persistence.entity.AuditLogEntry;
import com.example.orderdesk.infrastructure.persistence.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Appends one audit entry per workflow event. Each write commits on its own. Best effort:
 * a failed write is logged and reported to the caller, never thrown.
 */
@Component
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    public AuditTrail(AuditLogRepository auditLogRepository, ObjectMapper objectMapper) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Records the event unless an entry for it already exists.
     *
     * @return true if the event is in the audit log after this call
     */
    public boolean record(String eventId, WorkflowEvent event) {
        try {
            if (auditLogRepository.existsByEventId(eventId)) {
                log.debug("Event {} already audited", eventId);
                return true;
            }
            auditLogRepository.save(AuditLogEntry.of(
                    eventId,
                    event.actorId(),
                    event.actorRole() != null ? event.actorRole().name() : null,
                    event.eventType(),
                    event.resourceType(),
                    event.resourceId(),
                    event.orderId(),
                    code(event.fromStatus()),
                    code(event.toStatus()),
                    details(event),
                    event.occurredAt()));
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Event {} audited concurrently", eventId);
            return true;
        } catch (RuntimeException e) {
            log.warn("Audit write for event {} ({}) failed: {}", eventId, event.eventType(), e.getMessage());
            return false;
        }
    }

    private String details(WorkflowEvent event) {
        if (event.details().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(event.details());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize audit details of {}: {}", event.eventType(), e.getMessage());
            return event.details().toString();
        }
    }

    private static Integer code(OrderStatus status) {
        return status != null ? status.getCode() : null;
    }
}
