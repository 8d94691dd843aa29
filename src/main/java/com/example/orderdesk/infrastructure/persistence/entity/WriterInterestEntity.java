package com.example.orderdesk.infrastructure.persistence.entity;

import com.example.orderdesk.domain.model.WriterInterestState;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * One row per (order, candidate writer). Mutated only by the recruitment engine.
 */
@Entity
@Table(name = "writer_interests",
        uniqueConstraints = @UniqueConstraint(name = "uk_writer_interest_order_writer",
                columnNames = {"order_id", "writer_id"}),
        indexes = @Index(name = "idx_writer_interest_order_state", columnList = "order_id, state"))
public class WriterInterestEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "order_id", length = 36, nullable = false)
    private String orderId;

    @Column(name = "writer_id", length = 64, nullable = false)
    private String writerId;

    @Column(name = "state", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private WriterInterestState state;

    @Column(name = "writer_comment", length = 1000)
    private String comment;

    @Column(name = "invited_by", length = 64)
    private String invitedBy;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public String getWriterId() {
        return writerId;
    }

    public void setWriterId(String writerId) {
        this.writerId = writerId;
    }

    public WriterInterestState getState() {
        return state;
    }

    public void setState(WriterInterestState state) {
        this.state = state;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    public String getInvitedBy() {
        return invitedBy;
    }

    public void setInvitedBy(String invitedBy) {
        this.invitedBy = invitedBy;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
