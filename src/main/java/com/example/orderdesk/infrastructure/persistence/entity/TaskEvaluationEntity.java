package com.example.orderdesk.infrastructure.persistence.entity;

import com.example.orderdesk.domain.model.TaskEvaluationState;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Writer's verdict on an assignment, kept in step with the assigned writer interest.
 */
@Entity
@Table(name = "task_evaluations",
        uniqueConstraints = @UniqueConstraint(name = "uk_task_evaluation_order_writer",
                columnNames = {"order_id", "writer_id"}))
public class TaskEvaluationEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "order_id", length = 36, nullable = false)
    private String orderId;

    @Column(name = "writer_id", length = 64, nullable = false)
    private String writerId;

    @Column(name = "state", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private TaskEvaluationState state;

    @Column(name = "writer_comment", length = 1000)
    private String comment;

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

    public TaskEvaluationState getState() {
        return state;
    }

    public void setState(TaskEvaluationState state) {
        this.state = state;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
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
