package com.example.orderdesk.infrastructure.persistence;

import com.example.orderdesk.domain.exception.ConcurrentOrderUpdateException;
import com.example.orderdesk.domain.exception.InvalidTransitionException;
import com.example.orderdesk.domain.exception.NotFoundException;
import com.example.orderdesk.domain.exception.OrderClosedException;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.domain.model.StatusRegistry;
import com.example.orderdesk.infrastructure.persistence.entity.OrderEntity;
import com.example.orderdesk.infrastructure.persistence.repository.OrderJpaRepository;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Order access shared by the workflow persistence services: loading, guard checks and
 * version-checked writes. Must run inside the caller's transaction.
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class OrderStore {

    private final OrderJpaRepository orderRepository;
    private final StatusRegistry statusRegistry;

    public OrderStore(OrderJpaRepository orderRepository, StatusRegistry statusRegistry) {
        this.orderRepository = orderRepository;
        this.statusRegistry = statusRegistry;
    }

    public OrderEntity load(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new NotFoundException("Order", orderId));
    }

    /**
     * Loads an order that must still accept recruitment and QC actions.
     */
    public OrderEntity loadOpen(String orderId) {
        OrderEntity order = load(orderId);
        if (order.getStatus().isClosed()) {
            throw new OrderClosedException(order.getStatus());
        }
        return order;
    }

    /**
     * Applies a guarded status change in memory. Persisted by {@link #save(OrderEntity)}.
     */
    public OrderStatus moveTo(OrderEntity order, Role role, OrderStatus target) {
        OrderStatus from = order.getStatus();
        statusRegistry.check(role, from, target);
        order.setStatus(target);
        return from;
    }

    /**
     * Flushes the order so a concurrent writer is detected here rather than at commit.
     */
    public OrderEntity save(OrderEntity order) {
        try {
            return orderRepository.saveAndFlush(order);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrentOrderUpdateException(order.getId(), e);
        }
    }

    public void requireOwner(OrderEntity order, Actor actor) {
        if (actor.is(Role.CLIENT) && !actor.id().equals(order.getClientId())) {
            throw new InvalidTransitionException(
                    "Only the client who raised order " + order.getId() + " may do this");
        }
    }

    public void requireAssignee(OrderEntity order, Actor actor) {
        if (actor.is(Role.WRITER) && !actor.id().equals(order.getAssignedWriterId())) {
            throw new InvalidTransitionException(
                    "Only the writer assigned to order " + order.getId() + " may do this");
        }
    }
}
