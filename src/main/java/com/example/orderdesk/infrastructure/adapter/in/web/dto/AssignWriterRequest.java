package com.example.orderdesk.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param expectedVersion order version the admin chose from; stale values are rejected with 409
 */
public record AssignWriterRequest(
        @NotBlank(message = "Writer id is required")
        String writerId,

        Long expectedVersion,

        String reason
) {}
