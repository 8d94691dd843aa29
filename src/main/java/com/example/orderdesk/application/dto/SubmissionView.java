package com.example.orderdesk.application.dto;

import com.example.orderdesk.domain.model.SubmissionState;

import java.time.Instant;

public record SubmissionView(
        String submissionId,
        String orderId,
        String writerId,
        int sequenceNumber,
        String fileReference,
        SubmissionState state,
        String feedback,
        Integer revisionNumber,
        Instant createdAt,
        Instant reviewedAt
) {}
