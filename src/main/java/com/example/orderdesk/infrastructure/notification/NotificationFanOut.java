package com.example.orderdesk.infrastructure.notification;

import com.example.orderdesk.application.dto.WorkflowEvent;
import com.example.orderdesk.application.dto.WorkflowEvent.NotificationMessage;
import com.example.orderdesk.application.port.out.NotificationDeliveryPort;
import com.example.orderdesk.application.port.out.NotificationDeliveryPort.DeliveryPayload;
import com.example.orderdesk.application.port.out.UserDirectoryPort;
import com.example.orderdesk.application.port.out.UserDirectoryPort.UserAccount;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.persistence.entity.NotificationEntity;
import com.example.orderdesk.infrastructure.persistence.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Turns the notifications of a workflow event into one persisted row per recipient, then
 * pushes them through the delivery port. The rows are the record of what a user was told;
 * the push is best effort.
 */
@Component
public class NotificationFanOut {

    private static final Logger log = LoggerFactory.getLogger(NotificationFanOut.class);

    private final NotificationRepository notificationRepository;
    private final UserDirectoryPort userDirectory;
    private final NotificationDeliveryPort deliveryPort;

    public NotificationFanOut(
            NotificationRepository notificationRepository,
            UserDirectoryPort userDirectory,
            NotificationDeliveryPort deliveryPort) {
        this.notificationRepository = notificationRepository;
        this.userDirectory = userDirectory;
        this.deliveryPort = deliveryPort;
    }

    /**
     * Resolves who hears about the event. Role broadcasts go to the identity service, so this
     * runs before any transaction is opened. The acting user is never notified of their own
     * action, and a recipient is addressed at most once per event.
     */
    public List<AddressedNotification> address(WorkflowEvent event) {
        Set<String> seen = new HashSet<>();
        seen.add(event.actorId());
        List<AddressedNotification> addressed = new ArrayList<>();
        for (NotificationMessage message : event.notifications()) {
            for (String recipientId : recipients(message)) {
                if (seen.add(recipientId)) {
                    addressed.add(new AddressedNotification(recipientId, message));
                }
            }
        }
        return addressed;
    }

    /**
     * Persists the rows this event has not produced yet.
     *
     * @return the rows written by this call
     */
    @Transactional
    public List<NotificationEntity> persist(String eventId, String orderId, List<AddressedNotification> addressed) {
        List<NotificationEntity> written = new ArrayList<>();
        for (AddressedNotification target : addressed) {
            if (notificationRepository.existsByEventIdAndRecipientId(eventId, target.recipientId())) {
                continue;
            }
            NotificationMessage message = target.message();
            NotificationEntity notification = new NotificationEntity();
            notification.setId(UUID.randomUUID().toString());
            notification.setEventId(eventId);
            notification.setRecipientId(target.recipientId());
            notification.setOrderId(orderId);
            notification.setSeverity(message.severity());
            notification.setTitle(message.title());
            notification.setMessage(message.message());
            notification.setLinkUrl(message.link());
            written.add(notificationRepository.save(notification));
        }
        if (!written.isEmpty()) {
            log.debug("Event {} produced {} notifications", eventId, written.size());
        }
        return written;
    }

    /**
     * Attempts a real-time push for each row. Failures are logged only.
     */
    public void push(List<NotificationEntity> notifications) {
        for (NotificationEntity notification : notifications) {
            DeliveryPayload payload = new DeliveryPayload(
                    notification.getId(),
                    notification.getOrderId(),
                    notification.getSeverity(),
                    notification.getTitle(),
                    notification.getMessage(),
                    notification.getLinkUrl());
            try {
                deliveryPort.deliver(notification.getRecipientId(), payload)
                        .whenComplete((result, error) -> {
                            if (error != null) {
                                log.warn("Push of notification {} to {} failed: {}",
                                        notification.getId(), notification.getRecipientId(), error.getMessage());
                            } else if (!result.delivered()) {
                                log.debug("Push of notification {} skipped: {}", notification.getId(), result.detail());
                            }
                        });
            } catch (RuntimeException e) {
                log.warn("Push of notification {} to {} failed: {}",
                        notification.getId(), notification.getRecipientId(), e.getMessage());
            }
        }
    }

    private Set<String> recipients(NotificationMessage message) {
        Set<String> recipients = new LinkedHashSet<>(message.recipientIds());
        for (Role role : message.broadcastRoles()) {
            for (UserAccount account : userDirectory.findActiveUsers(role)) {
                recipients.add(account.id());
            }
        }
        return recipients;
    }

    public record AddressedNotification(String recipientId, NotificationMessage message) {
    }
}
