package com.example.orderdesk.application.dto;

import com.example.orderdesk.domain.exception.ValidationException;

import java.time.Instant;

/**
 * Command for raising a new query (an order before it is priced).
 */
public record CreateQueryCommand(
        String clientId,
        String topic,
        String subject,
        String service,
        String urgency,
        String description,
        Instant deadline,
        String fileReference,
        String bdeId
) {
    public CreateQueryCommand {
        if (clientId == null || clientId.isBlank()) {
            throw new ValidationException("Client id is required");
        }
        if (topic == null || topic.isBlank()) {
            throw new ValidationException("Paper topic is required");
        }
        if (deadline == null) {
            throw new ValidationException("Deadline is required");
        }
    }
}
