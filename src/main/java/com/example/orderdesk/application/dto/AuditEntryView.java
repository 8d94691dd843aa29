package com.example.orderdesk.application.dto;

import java.time.Instant;

/**
 * One audit log entry. Statuses are the numeric codes stored at the time of the action.
 */
public record AuditEntryView(
        String auditId,
        String eventType,
        String actorId,
        String actorRole,
        String resourceType,
        String resourceId,
        Integer beforeStatus,
        Integer afterStatus,
        String details,
        Instant occurredAt
) {}
