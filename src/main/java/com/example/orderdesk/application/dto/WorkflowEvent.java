package com.example.orderdesk.application.dto;

import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.NotificationSeverity;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.Role;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Describes one committed workflow action. Serialized into the outbox and fanned out
 * into exactly one audit entry plus the notifications it lists.
 */
public record WorkflowEvent(
        String eventType,
        String resourceType,
        String resourceId,
        String orderId,
        String actorId,
        Role actorRole,
        OrderStatus fromStatus,
        OrderStatus toStatus,
        Map<String, Object> details,
        List<NotificationMessage> notifications,
        Instant occurredAt
) {
    public WorkflowEvent {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(resourceType, "Resource type cannot be null");
        Objects.requireNonNull(resourceId, "Resource id cannot be null");
        Objects.requireNonNull(actorId, "Actor id cannot be null");
        details = details == null ? Map.of() : details;
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }

    public static Builder builder(String eventType, Actor actor) {
        return new Builder(eventType, actor);
    }

    /**
     * A notification addressed to explicit users and/or everyone holding a role.
     */
    public record NotificationMessage(
            List<String> recipientIds,
            Set<Role> broadcastRoles,
            NotificationSeverity severity,
            String title,
            String message,
            String link
    ) {
        public NotificationMessage {
            recipientIds = recipientIds == null ? List.of() : recipientIds.stream().filter(Objects::nonNull).toList();
            broadcastRoles = broadcastRoles == null ? Set.of() : Set.copyOf(broadcastRoles);
            Objects.requireNonNull(severity, "Severity cannot be null");
            Objects.requireNonNull(title, "Title cannot be null");
            Objects.requireNonNull(message, "Message cannot be null");
        }
    }

    public static final class Builder {

        private final String eventType;
        private final Actor actor;
        private String resourceType = "ORDER";
        private String resourceId;
        private String orderId;
        private OrderStatus fromStatus;
        private OrderStatus toStatus;
        private final Map<String, Object> details = new LinkedHashMap<>();
        private final List<NotificationMessage> notifications = new ArrayList<>();

        private Builder(String eventType, Actor actor) {
            this.eventType = eventType;
            this.actor = Objects.requireNonNull(actor, "Actor cannot be null");
        }

        public Builder order(String orderId) {
            this.orderId = orderId;
            if (resourceId == null) {
                this.resourceId = orderId;
            }
            return this;
        }

        public Builder resource(String resourceType, String resourceId) {
            this.resourceType = resourceType;
            this.resourceId = resourceId;
            return this;
        }

        public Builder transition(OrderStatus from, OrderStatus to) {
            this.fromStatus = from;
            this.toStatus = to;
            return this;
        }

        public Builder detail(String key, Object value) {
            if (value != null) {
                details.put(key, value);
            }
            return this;
        }

        public Builder notify(String recipientId, NotificationSeverity severity, String title, String message) {
            if (recipientId == null) {
                return this;
            }
            return notify(List.of(recipientId), Set.of(), severity, title, message);
        }

        public Builder notifyRole(Role role, NotificationSeverity severity, String title, String message) {
            return notify(List.of(), Set.of(role), severity, title, message);
        }

        public Builder notify(List<String> recipientIds, Set<Role> roles, NotificationSeverity severity,
                              String title, String message) {
            if ((recipientIds == null || recipientIds.isEmpty()) && (roles == null || roles.isEmpty())) {
                return this;
            }
            String link = orderId != null ? "/orders/" + orderId : null;
            notifications.add(new NotificationMessage(recipientIds, roles, severity, title, message, link));
            return this;
        }

        public WorkflowEvent build() {
            return new WorkflowEvent(eventType, resourceType, resourceId, orderId, actor.id(), actor.role(),
                    fromStatus, toStatus, Map.copyOf(details), notifications, Instant.now());
        }
    }
}
