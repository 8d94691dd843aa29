package com.example.orderdesk.application.dto;

/**
 * Result of a committed unit of work plus the outbox event it wrote, if any.
 */
public record TransactionOutcome<T>(T value, String eventId) {

    public static <T> TransactionOutcome<T> of(T value, String eventId) {
        return new TransactionOutcome<>(value, eventId);
    }

    /**
     * Outcome of a call that changed nothing, so nothing is published.
     */
    public static <T> TransactionOutcome<T> unchanged(T value) {
        return new TransactionOutcome<>(value, null);
    }

    public boolean hasEvent() {
        return eventId != null;
    }
}
