package com.example.orderdesk.infrastructure.adapter.in.web.dto;

import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.Role;

public record TransitionCheckResponse(
        Role role,
        OrderStatus from,
        OrderStatus to,
        boolean allowed
) {}
