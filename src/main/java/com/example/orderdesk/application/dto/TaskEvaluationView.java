package com.example.orderdesk.application.dto;

import com.example.orderdesk.domain.model.TaskEvaluationState;

public record TaskEvaluationView(
        String orderId,
        String writerId,
        TaskEvaluationState state,
        String comment
) {}
