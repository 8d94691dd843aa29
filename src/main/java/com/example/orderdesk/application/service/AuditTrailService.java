package com.example.orderdesk.application.service;

import com.example.orderdesk.application.dto.AuditEntryView;
import com.example.orderdesk.application.port.in.AuditTrailUseCase;
import com.example.orderdesk.domain.exception.NotFoundException;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.persistence.entity.AuditLogEntry;
import com.example.orderdesk.infrastructure.persistence.mapper.WorkflowViewMapper;
import com.example.orderdesk.infrastructure.persistence.repository.AuditLogRepository;
import com.example.orderdesk.infrastructure.persistence.repository.OrderJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the audit log. Staff only; clients and writers see their notifications instead.
 */
@Service
public class AuditTrailService implements AuditTrailUseCase {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailService.class);

    private final AuditLogRepository auditLogRepository;
    private final OrderJpaRepository orderRepository;
    private final WorkflowViewMapper mapper;
    private final ActorResolver actorResolver;

    public AuditTrailService(
            AuditLogRepository auditLogRepository,
            OrderJpaRepository orderRepository,
            WorkflowViewMapper mapper,
            ActorResolver actorResolver) {
        this.auditLogRepository = auditLogRepository;
        this.orderRepository = orderRepository;
        this.mapper = mapper;
        this.actorResolver = actorResolver;
    }

    @Override
    public List<AuditEntryView> history(String orderId, String viewerId, String eventType, String actorId) {
        Actor viewer = actorResolver.resolve(viewerId, "read the audit trail", Role.ADMIN, Role.BDE);
        if (!orderRepository.existsById(orderId)) {
            throw new NotFoundException("Order", orderId);
        }
        List<AuditLogEntry> entries = auditLogRepository.findByOrderIdOrderByOccurredAtAsc(orderId);
        log.debug("{} read {} audit entries of order {}", viewer.id(), entries.size(), orderId);
        return entries.stream()
                .filter(entry -> isBlank(eventType) || entry.getEventType().equalsIgnoreCase(eventType.trim()))
                .filter(entry -> isBlank(actorId) || entry.getActorId().equals(actorId.trim()))
                .map(mapper::toView)
                .toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
