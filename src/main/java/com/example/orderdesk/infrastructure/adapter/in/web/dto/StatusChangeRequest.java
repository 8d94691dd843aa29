package com.example.orderdesk.infrastructure.adapter.in.web.dto;

import com.example.orderdesk.domain.model.OrderStatus;
import jakarta.validation.constraints.NotNull;

public record StatusChangeRequest(
        @NotNull(message = "Expected status is required")
        OrderStatus expectedStatus,

        @NotNull(message = "Target status is required")
        OrderStatus targetStatus,

        String reason
) {}
