package com.example.orderdesk.application.service;

import com.example.orderdesk.application.dto.CreateQueryCommand;
import com.example.orderdesk.application.dto.OrderParticipants;
import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.TransactionOutcome;
import com.example.orderdesk.application.port.in.OrderIntakeUseCase;
import com.example.orderdesk.application.port.out.WorkflowEventPublisher;
import com.example.orderdesk.domain.exception.ValidationException;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.domain.model.StatusRegistry;
import com.example.orderdesk.infrastructure.persistence.OrderPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Application service for order intake and free status changes.
 * Persists through {@link OrderPersistenceService}, then publishes the committed event.
 */
@Service
public class OrderWorkflowService implements OrderIntakeUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderWorkflowService.class);

    private final OrderPersistenceService persistenceService;
    private final ActorResolver actorResolver;
    private final WorkflowEventPublisher eventPublisher;
    private final StatusRegistry statusRegistry;

    public OrderWorkflowService(
            OrderPersistenceService persistenceService,
            ActorResolver actorResolver,
            WorkflowEventPublisher eventPublisher,
            StatusRegistry statusRegistry) {
        this.persistenceService = persistenceService;
        this.actorResolver = actorResolver;
        this.eventPublisher = eventPublisher;
        this.statusRegistry = statusRegistry;
    }

    @Override
    public OrderView createQuery(CreateQueryCommand command) {
        Actor client = actorResolver.resolve(command.clientId(), "raise a query", Role.CLIENT);
        TransactionOutcome<OrderView> outcome = persistenceService.createQuery(command, client);
        log.info("Query {} raised by client {}", outcome.value().queryCode(), client.id());
        return eventPublisher.publish(outcome);
    }

    @Override
    public OrderView getOrder(String orderId) {
        return persistenceService.getOrder(orderId);
    }

    @Override
    public OrderParticipants participants(String orderId) {
        return persistenceService.participants(orderId);
    }

    @Override
    public OrderView changeStatus(String orderId, String actorId, OrderStatus expected, OrderStatus target,
                                  String reason) {
        if (expected == null || target == null) {
            throw new ValidationException("Expected and target status are required");
        }
        Actor actor = actorResolver.resolve(actorId, "change order status");
        TransactionOutcome<OrderView> outcome =
                persistenceService.changeStatus(orderId, actor, expected, target, reason);
        log.info("Order {} moved {} -> {} by {} {}", orderId, expected, target, actor.role(), actor.id());
        return eventPublisher.publish(outcome);
    }

    @Override
    public boolean canTransition(Role role, OrderStatus from, OrderStatus to) {
        return statusRegistry.canTransition(role, from, to);
    }
}
