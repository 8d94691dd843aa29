package com.example.orderdesk.infrastructure.persistence;

import com.example.orderdesk.application.dto.WorkflowEvent;
import com.example.orderdesk.infrastructure.persistence.entity.OutboxEvent;
import com.example.orderdesk.infrastructure.persistence.repository.OutboxRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes workflow events into the outbox inside the caller's transaction.
 */
@Component
public class OutboxWriter {

    private static final Logger log = LoggerFactory.getLogger(OutboxWriter.class);

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    public OutboxWriter(OutboxRepository outboxRepository, ObjectMapper objectMapper) {
        this.outboxRepository = outboxRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Appends an event to the outbox.
     *
     * @return the outbox event id, used to dispatch after commit
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String append(WorkflowEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.pending(
                event.eventType(), event.resourceType(), event.resourceId(), serialize(event));
        outboxRepository.save(outboxEvent);
        log.debug("Queued {} event {} for {} {}",
                event.eventType(), outboxEvent.getId(), event.resourceType(), event.resourceId());
        return outboxEvent.getId();
    }

    private String serialize(WorkflowEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize workflow event {}", event.eventType(), e);
            throw new IllegalStateException("Cannot serialize workflow event " + event.eventType(), e);
        }
    }
}
