package com.example.orderdesk.application.dto;

import com.example.orderdesk.domain.model.WriterInterestState;

import java.time.Instant;

public record WriterInterestView(
        String orderId,
        String writerId,
        WriterInterestState state,
        String comment,
        Instant updatedAt
) {}
