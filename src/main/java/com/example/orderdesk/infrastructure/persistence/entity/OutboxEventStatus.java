package com.example.orderdesk.infrastructure.persistence.entity;

/**
 * Dispatch status of a workflow event waiting in the outbox.
 */
public enum OutboxEventStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED
}
