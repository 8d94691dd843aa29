package com.example.orderdesk.domain.model;

import com.example.orderdesk.domain.exception.InvalidTransitionException;
import com.example.orderdesk.domain.exception.OrderClosedException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.orderdesk.domain.model.OrderStatus.*;

/**
 * The single transition table of the order lifecycle.
 * For each role and current status it lists the statuses that role may move the order to.
 */
public final class StatusRegistry {

    private final Map<Role, Map<OrderStatus, Set<OrderStatus>>> table;

    private StatusRegistry(Map<Role, Map<OrderStatus, Set<OrderStatus>>> table) {
        this.table = table;
    }

    /**
     * Builds the standard lifecycle table.
     *
     * @return the registry
     */
    public static StatusRegistry standard() {
        Builder builder = new Builder()
                .allow(Role.CLIENT, QUOTATION_SENT, ACCEPTED)
                .allow(Role.CLIENT, ACCEPTED, AWAITING_VERIFICATION)

                .allow(Role.BDE, PENDING_QUERY, QUOTATION_SENT)
                .allow(Role.BDE, QUOTATION_SENT, QUOTATION_SENT, PENDING_QUERY)

                .allow(Role.WRITER, WRITER_ASSIGNED, IN_PROGRESS, PENDING_QC)
                .allow(Role.WRITER, IN_PROGRESS, PENDING_QC)
                .allow(Role.WRITER, REVISION_REQUIRED, PENDING_QC)

                .allow(Role.ADMIN, PENDING_QUERY, QUOTATION_SENT, QUERY_REJECTED, CANCELLED)
                .allow(Role.ADMIN, QUOTATION_SENT,
                        QUOTATION_SENT, PENDING_QUERY, ACCEPTED, PAYMENT_VERIFIED, QUERY_REJECTED, CANCELLED)
                .allow(Role.ADMIN, ACCEPTED, QUOTATION_SENT, AWAITING_VERIFICATION, PAYMENT_VERIFIED, CANCELLED)
                .allow(Role.ADMIN, AWAITING_VERIFICATION, PAYMENT_VERIFIED, CANCELLED)
                .allow(Role.ADMIN, PAYMENT_VERIFIED, WRITER_ASSIGNED)
                .allow(Role.ADMIN, WRITER_ASSIGNED, WRITER_ASSIGNED, IN_PROGRESS, PAYMENT_VERIFIED)
                .allow(Role.ADMIN, IN_PROGRESS, WRITER_ASSIGNED, PAYMENT_VERIFIED, PENDING_QC)
                .allow(Role.ADMIN, PENDING_QC, APPROVED, REVISION_REQUIRED)
                .allow(Role.ADMIN, APPROVED, DELIVERED, COMPLETED, REVISION_REQUIRED)
                .allow(Role.ADMIN, REVISION_REQUIRED, WRITER_ASSIGNED, PAYMENT_VERIFIED, PENDING_QC)
                .allow(Role.ADMIN, DELIVERED, COMPLETED);
        return builder.build();
    }

    /**
     * Read-only query for reporting code.
     */
    public boolean canTransition(Role role, OrderStatus from, OrderStatus to) {
        return allowedTargets(role, from).contains(to);
    }

    public Set<OrderStatus> allowedTargets(Role role, OrderStatus from) {
        Objects.requireNonNull(role, "Role cannot be null");
        Objects.requireNonNull(from, "Status cannot be null");
        return table.getOrDefault(role, Map.of()).getOrDefault(from, Set.of());
    }

    /**
     * Verifies a transition and explains the denial when it is not allowed.
     *
     * @throws OrderClosedException       if the order is closed and nothing may leave it
     * @throws InvalidTransitionException if the role may not perform the move
     */
    public void check(Role role, OrderStatus from, OrderStatus to) {
        Set<OrderStatus> allowed = allowedTargets(role, from);
        if (allowed.contains(to)) {
            return;
        }
        if (from.isClosed() && allowed.isEmpty()) {
            throw new OrderClosedException(from);
        }
        throw new InvalidTransitionException(role, from, to, describe(allowed));
    }

    private static String describe(Set<OrderStatus> allowed) {
        if (allowed.isEmpty()) {
            return "none";
        }
        return allowed.stream()
                .map(OrderStatus::describe)
                .collect(Collectors.joining(", "));
    }

    private static final class Builder {

        private final Map<Role, Map<OrderStatus, Set<OrderStatus>>> table = new EnumMap<>(Role.class);

        Builder allow(Role role, OrderStatus from, OrderStatus first, OrderStatus... rest) {
            table.computeIfAbsent(role, r -> new EnumMap<>(OrderStatus.class))
                    .computeIfAbsent(from, f -> EnumSet.noneOf(OrderStatus.class))
                    .addAll(EnumSet.of(first, rest));
            return this;
        }

        StatusRegistry build() {
            Map<Role, Map<OrderStatus, Set<OrderStatus>>> frozen = new EnumMap<>(Role.class);
            table.forEach((role, rows) -> {
                Map<OrderStatus, Set<OrderStatus>> copy = new EnumMap<>(OrderStatus.class);
                rows.forEach((from, targets) -> copy.put(from, Collections.unmodifiableSet(EnumSet.copyOf(targets))));
                frozen.put(role, Collections.unmodifiableMap(copy));
            });
            return new StatusRegistry(Collections.unmodifiableMap(frozen));
        }
    }
}
