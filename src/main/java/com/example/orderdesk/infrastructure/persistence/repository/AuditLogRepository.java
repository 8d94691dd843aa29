package com.example.orderdesk.infrastructure.persistence.repository;

import com.example.orderdesk.infrastructure.persistence.entity.AuditLogEntry;
import org.springframework.data.repository.Repository;

import java.util.List;

/**
 * Append-only access to the audit log: no update or delete methods are exposed.
 */
@org.springframework.stereotype.Repository
public interface AuditLogRepository extends Repository<AuditLogEntry, String> {

    AuditLogEntry save(AuditLogEntry entry);

    boolean existsByEventId(String eventId);

    long countByOrderId(String orderId);

    List<AuditLogEntry> findByOrderIdOrderByOccurredAtAsc(String orderId);

    List<AuditLogEntry> findByResourceTypeAndResourceIdOrderByOccurredAtAsc(String resourceType, String resourceId);
}
