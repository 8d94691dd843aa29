package com.example.orderdesk.infrastructure.persistence.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit record. One entry per workflow event, never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "audit_log",
        uniqueConstraints = @UniqueConstraint(name = "uk_audit_event", columnNames = "event_id"),
        indexes = {
            @Index(name = "idx_audit_order", columnList = "order_id"),
            @Index(name = "idx_audit_actor", columnList = "actor_id"),
            @Index(name = "idx_audit_event_type", columnList = "event_type"),
            @Index(name = "idx_audit_created_at", columnList = "created_at")
        })
public class AuditLogEntry {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "event_id", length = 36, nullable = false, updatable = false)
    private String eventId;

    @Column(name = "actor_id", length = 64, nullable = false, updatable = false)
    private String actorId;

    @Column(name = "actor_role", length = 16, updatable = false)
    private String actorRole;

    @Column(name = "event_type", length = 64, nullable = false, updatable = false)
    private String eventType;

    @Column(name = "resource_type", length = 32, nullable = false, updatable = false)
    private String resourceType;

    @Column(name = "resource_id", length = 64, nullable = false, updatable = false)
    private String resourceId;

    @Column(name = "order_id", length = 36, updatable = false)
    private String orderId;

    @Column(name = "before_status", updatable = false)
    private Integer beforeStatus;

    @Column(name = "after_status", updatable = false)
    private Integer afterStatus;

    @Column(name = "details", columnDefinition = "TEXT", updatable = false)
    private String details;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected AuditLogEntry() {
    }

    public static AuditLogEntry of(String eventId, String actorId, String actorRole, String eventType,
                                   String resourceType, String resourceId, String orderId,
                                   Integer beforeStatus, Integer afterStatus, String details,
                                   Instant occurredAt) {
        AuditLogEntry entry = new AuditLogEntry();
        entry.id = UUID.randomUUID().toString();
        entry.eventId = eventId;
        entry.actorId = actorId;
        entry.actorRole = actorRole;
        entry.eventType = eventType;
        entry.resourceType = resourceType;
        entry.resourceId = resourceId;
        entry.orderId = orderId;
        entry.beforeStatus = beforeStatus;
        entry.afterStatus = afterStatus;
        entry.details = details;
        entry.occurredAt = occurredAt;
        return entry;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getEventId() {
        return eventId;
    }

    public String getActorId() {
        return actorId;
    }

    public String getActorRole() {
        return actorRole;
    }

    public String getEventType() {
        return eventType;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getOrderId() {
        return orderId;
    }

    public Integer getBeforeStatus() {
        return beforeStatus;
    }

    public Integer getAfterStatus() {
        return afterStatus;
    }

    public String getDetails() {
        return details;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
