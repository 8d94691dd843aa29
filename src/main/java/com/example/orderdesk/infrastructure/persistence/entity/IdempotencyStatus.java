package com.example.orderdesk.infrastructure.persistence.entity;

/**
 * Status of a keyed client request.
 */
public enum IdempotencyStatus {
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
