package com.example.orderdesk.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;

public record TaskEvaluationRequest(
        @NotNull(message = "Doable flag is required")
        Boolean doable,

        String comment
) {}
