package com.example.orderdesk.infrastructure.persistence.entity;

import com.example.orderdesk.domain.model.NotificationSeverity;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Persisted notification, the source of truth for whether a user was informed.
 * Only the read flag changes after insert.
 */
@Entity
@Table(name = "notifications",
        uniqueConstraints = @UniqueConstraint(name = "uk_notification_event_recipient",
                columnNames = {"event_id", "recipient_id"}),
        indexes = @Index(name = "idx_notifications_recipient", columnList = "recipient_id, is_read"))
public class NotificationEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "event_id", length = 36, nullable = false, updatable = false)
    private String eventId;

    @Column(name = "recipient_id", length = 64, nullable = false, updatable = false)
    private String recipientId;

    @Column(name = "order_id", length = 36, updatable = false)
    private String orderId;

    @Column(name = "severity", length = 16, nullable = false, updatable = false)
    @Enumerated(EnumType.STRING)
    private NotificationSeverity severity;

    @Column(name = "title", length = 255, nullable = false, updatable = false)
    private String title;

    @Column(name = "message", length = 2000, nullable = false, updatable = false)
    private String message;

    @Column(name = "link_url", length = 500, updatable = false)
    private String linkUrl;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "read_at")
    private Instant readAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getRecipientId() {
        return recipientId;
    }

    public void setRecipientId(String recipientId) {
        this.recipientId = recipientId;
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public NotificationSeverity getSeverity() {
        return severity;
    }

    public void setSeverity(NotificationSeverity severity) {
        this.severity = severity;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getLinkUrl() {
        return linkUrl;
    }

    public void setLinkUrl(String linkUrl) {
        this.linkUrl = linkUrl;
    }

    public boolean isRead() {
        return read;
    }

    public Instant getReadAt() {
        return readAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
