package com.example.orderdesk.infrastructure.persistence;

import com.example.orderdesk.application.dto.CreateQueryCommand;
import com.example.orderdesk.application.dto.OrderParticipants;
import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.TransactionOutcome;
import com.example.orderdesk.application.dto.WorkflowEvent;
import com.example.orderdesk.domain.exception.ConflictException;
import com.example.orderdesk.domain.exception.InvalidTransitionException;
import com.example.orderdesk.domain.exception.ValidationException;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.NotificationSeverity;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.domain.model.StatusRegistry;
import com.example.orderdesk.infrastructure.persistence.entity.OrderEntity;
import com.example.orderdesk.infrastructure.persistence.mapper.WorkflowViewMapper;
import com.example.orderdesk.infrastructure.persistence.repository.OrderJpaRepository;
import com.example.orderdesk.infrastructure.service.ReferenceCodeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Order intake and plain status changes. Each write and its outbox event share one transaction.
 */
@Service
public class OrderPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(OrderPersistenceService.class);
    private static final int QUERY_CODE_ATTEMPTS = 5;

    private final OrderJpaRepository orderRepository;
    private final OrderStore orderStore;
    private final OutboxWriter outboxWriter;
    private final WorkflowViewMapper mapper;
    private final ReferenceCodeGenerator codeGenerator;
    private final StatusRegistry statusRegistry;
    private final Clock clock;

    public OrderPersistenceService(
            OrderJpaRepository orderRepository,
            OrderStore orderStore,
            OutboxWriter outboxWriter,
            WorkflowViewMapper mapper,
            ReferenceCodeGenerator codeGenerator,
            StatusRegistry statusRegistry,
            Clock clock) {
        this.orderRepository = orderRepository;
        this.orderStore = orderStore;
        this.outboxWriter = outboxWriter;
        this.mapper = mapper;
        this.codeGenerator = codeGenerator;
        this.statusRegistry = statusRegistry;
        this.clock = clock;
    }

    /**
     * Creates an order in PENDING_QUERY with a fresh query code.
     */
    @Transactional
    public TransactionOutcome<OrderView> createQuery(CreateQueryCommand command, Actor client) {
        if (!command.deadline().isAfter(clock.instant())) {
            throw new ValidationException("Deadline must be in the future: " + command.deadline());
        }

        OrderEntity order = new OrderEntity();
        order.setId(UUID.randomUUID().toString());
        order.setQueryCode(uniqueQueryCode());
        order.setClientId(client.id());
        order.setBdeId(command.bdeId());
        order.setTopic(command.topic().trim());
        order.setSubject(command.subject());
        order.setService(command.service());
        order.setUrgency(command.urgency());
        order.setDescription(command.description());
        order.setFileReference(command.fileReference());
        order.setDeadlineAt(command.deadline());
        order.setStatus(OrderStatus.PENDING_QUERY);
        orderRepository.saveAndFlush(order);
        log.debug("Saved query {} as order {}", order.getQueryCode(), order.getId());

        WorkflowEvent event = WorkflowEvent.builder("QUERY_CREATED", client)
                .order(order.getId())
                .transition(null, OrderStatus.PENDING_QUERY)
                .detail("queryCode", order.getQueryCode())
                .detail("topic", order.getTopic())
                .notifyRole(Role.ADMIN, NotificationSeverity.INFO, "New Query",
                        "New query " + order.getQueryCode() + ": " + order.getTopic())
                .notify(order.getBdeId(), NotificationSeverity.INFO, "New Query",
                        "A client raised query " + order.getQueryCode())
                .build();
        return TransactionOutcome.of(mapper.toView(order), outboxWriter.append(event));
    }

    /**
     * Moves an order to a status no dedicated operation owns. The write is a compare-and-set
     * on the status the caller expects.
     */
    @Transactional
    public TransactionOutcome<OrderView> changeStatus(String orderId, Actor actor, OrderStatus expected,
                                                      OrderStatus target, String reason) {
        OrderEntity order = orderStore.load(orderId);
        if (target.isGated()) {
            throw new InvalidTransitionException(target.describe()
                    + " can only be entered through its dedicated operation");
        }
        if (order.getStatus() != expected) {
            throw new ConflictException("Order " + orderId + " is in " + order.getStatus().describe()
                    + ", not " + expected.describe() + "; refresh and try again");
        }
        statusRegistry.check(actor.role(), expected, target);
        orderStore.requireOwner(order, actor);
        orderStore.requireAssignee(order, actor);

        int updated = orderRepository.compareAndSetStatus(orderId, expected, target, clock.instant());
        if (updated == 0) {
            throw new ConflictException("Order " + orderId + " left " + expected.describe()
                    + " concurrently; refresh and try again");
        }
        OrderEntity changed = orderStore.load(orderId);

        WorkflowEvent.Builder event = WorkflowEvent.builder("STATUS_CHANGED", actor)
                .order(orderId)
                .transition(expected, target)
                .detail("reason", reason);
        String message = "Order " + changed.getQueryCode() + " moved to " + target.describe()
                + (reason != null && !reason.isBlank() ? ": " + reason : "");
        NotificationSeverity severity = target.isClosed() ? NotificationSeverity.WARNING : NotificationSeverity.INFO;
        event.notify(changed.getClientId(), severity, "Order Status Updated", message)
                .notify(changed.getAssignedWriterId(), severity, "Order Status Updated", message);
        if (!actor.is(Role.ADMIN)) {
            event.notifyRole(Role.ADMIN, NotificationSeverity.INFO, "Order Status Updated", message);
        }
        log.debug("Order {} status {} -> {} by {}", orderId, expected, target, actor.id());
        return TransactionOutcome.of(mapper.toView(changed), outboxWriter.append(event.build()));
    }

    @Transactional(readOnly = true)
    public OrderView getOrder(String orderId) {
        return mapper.toView(orderStore.load(orderId));
    }

    @Transactional(readOnly = true)
    public OrderParticipants participants(String orderId) {
        return mapper.toParticipants(orderStore.load(orderId));
    }

    private String uniqueQueryCode() {
        for (int attempt = 0; attempt < QUERY_CODE_ATTEMPTS; attempt++) {
            String code = codeGenerator.nextQueryCode();
            if (orderRepository.findByQueryCode(code).isEmpty()) {
                return code;
            }
            log.warn("Query code collision on {}, generating another", code);
        }
        throw new IllegalStateException("Could not mint a unique query code");
    }
}
