package com.example.orderdesk.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

public record SubmitWorkRequest(
        @NotBlank(message = "File reference is required")
        String fileReference,

        String notes
) {}
