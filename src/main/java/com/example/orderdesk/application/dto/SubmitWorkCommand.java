package com.example.orderdesk.application.dto;

import com.example.orderdesk.domain.exception.ValidationException;

public record SubmitWorkCommand(
        String orderId,
        String writerId,
        String fileReference,
        String notes
) {
    public SubmitWorkCommand {
        if (orderId == null || orderId.isBlank()) {
            throw new ValidationException("Order id is required");
        }
        if (writerId == null || writerId.isBlank()) {
            throw new ValidationException("Writer id is required");
        }
        if (fileReference == null || fileReference.isBlank()) {
            throw new ValidationException("File reference is required");
        }
    }
}
