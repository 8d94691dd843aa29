package com.example.orderdesk.infrastructure.persistence.entity;

import com.example.orderdesk.domain.model.OrderStatus;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for the order aggregate. The version column is the compare-and-set token
 * for every status, work code and assignment write.
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_client", columnList = "client_id"),
    @Index(name = "idx_orders_status", columnList = "status"),
    @Index(name = "idx_orders_writer", columnList = "assigned_writer_id")
})
public class OrderEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "query_code", length = 32, nullable = false, unique = true)
    private String queryCode;

    @Column(name = "work_code", length = 48, unique = true)
    private String workCode;

    @Column(name = "client_id", length = 64, nullable = false)
    private String clientId;

    @Column(name = "bde_id", length = 64)
    private String bdeId;

    @Column(name = "assigned_writer_id", length = 64)
    private String assignedWriterId;

    @Column(name = "paper_topic", length = 500, nullable = false)
    private String topic;

    @Column(name = "subject", length = 255)
    private String subject;

    @Column(name = "service", length = 255)
    private String service;

    @Column(name = "urgency", length = 64)
    private String urgency;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "file_reference", length = 1000)
    private String fileReference;

    @Column(name = "basic_price", precision = 12, scale = 2)
    private BigDecimal basicPrice;

    @Column(name = "discount", precision = 12, scale = 2)
    private BigDecimal discount;

    @Column(name = "total_price", precision = 12, scale = 2)
    private BigDecimal totalPrice;

    @Column(name = "status", nullable = false)
    private OrderStatus status;

    @Column(name = "deadline_at", nullable = false)
    private Instant deadlineAt;

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

    public String getQueryCode() {
        return queryCode;
    }

    public void setQueryCode(String queryCode) {
        this.queryCode = queryCode;
    }

    public String getWorkCode() {
        return workCode;
    }

    public void setWorkCode(String workCode) {
        this.workCode = workCode;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getBdeId() {
        return bdeId;
    }

    public void setBdeId(String bdeId) {
        this.bdeId = bdeId;
    }

    public String getAssignedWriterId() {
        return assignedWriterId;
    }

    public void setAssignedWriterId(String assignedWriterId) {
        this.assignedWriterId = assignedWriterId;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public String getService() {
        return service;
    }

    public void setService(String service) {
        this.service = service;
    }

    public String getUrgency() {
        return urgency;
    }

    public void setUrgency(String urgency) {
        this.urgency = urgency;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getFileReference() {
        return fileReference;
    }

    public void setFileReference(String fileReference) {
        this.fileReference = fileReference;
    }

    public BigDecimal getBasicPrice() {
        return basicPrice;
    }

    public void setBasicPrice(BigDecimal basicPrice) {
        this.basicPrice = basicPrice;
    }

    public BigDecimal getDiscount() {
        return discount;
    }

    public void setDiscount(BigDecimal discount) {
        this.discount = discount;
    }

    public BigDecimal getTotalPrice() {
        return totalPrice;
    }

    public void setTotalPrice(BigDecimal totalPrice) {
        this.totalPrice = totalPrice;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public void setStatus(OrderStatus status) {
        this.status = status;
    }

    public Instant getDeadlineAt() {
        return deadlineAt;
    }

    public void setDeadlineAt(Instant deadlineAt) {
        this.deadlineAt = deadlineAt;
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
