package com.example.orderdesk.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * Request DTO for raising a query.
 */
public record CreateQueryRequest(
        @NotBlank(message = "Paper topic is required")
        @Size(max = 255, message = "Paper topic is limited to 255 characters")
        String topic,

        @NotBlank(message = "Subject is required")
        String subject,

        @NotBlank(message = "Service is required")
        String service,

        @NotBlank(message = "Urgency is required")
        String urgency,

        String description,

        @NotNull(message = "Deadline is required")
        @Future(message = "Deadline must be in the future")
        Instant deadline,

        String fileReference,

        String bdeId
) {}
