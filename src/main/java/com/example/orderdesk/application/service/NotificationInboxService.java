package com.example.orderdesk.application.service;

import com.example.orderdesk.application.dto.NotificationView;
import com.example.orderdesk.application.port.in.NotificationInboxUseCase;
import com.example.orderdesk.domain.exception.NotFoundException;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.infrastructure.persistence.entity.NotificationEntity;
import com.example.orderdesk.infrastructure.persistence.mapper.WorkflowViewMapper;
import com.example.orderdesk.infrastructure.persistence.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Reads a user's persisted notifications, the record of what they were told.
 */
@Service
public class NotificationInboxService implements NotificationInboxUseCase {

    private static final Logger log = LoggerFactory.getLogger(NotificationInboxService.class);

    private final NotificationRepository notificationRepository;
    private final WorkflowViewMapper mapper;
    private final ActorResolver actorResolver;
    private final Clock clock;

    public NotificationInboxService(
            NotificationRepository notificationRepository,
            WorkflowViewMapper mapper,
            ActorResolver actorResolver,
            Clock clock) {
        this.notificationRepository = notificationRepository;
        this.mapper = mapper;
        this.actorResolver = actorResolver;
        this.clock = clock;
    }

    @Override
    public List<NotificationView> notifications(String userId, boolean unreadOnly) {
        Actor user = actorResolver.resolve(userId, "read notifications");
        List<NotificationEntity> rows = unreadOnly
                ? notificationRepository.findByRecipientIdAndReadFalseOrderByCreatedAtDesc(user.id())
                : notificationRepository.findByRecipientIdOrderByCreatedAtDesc(user.id());
        return rows.stream().map(mapper::toView).toList();
    }

    @Override
    public void markRead(String notificationId, String userId) {
        Actor user = actorResolver.resolve(userId, "read notifications");
        NotificationEntity notification = notificationRepository.findById(notificationId)
                .filter(n -> n.getRecipientId().equals(user.id()))
                .orElseThrow(() -> new NotFoundException("Notification", notificationId));
        if (notification.isRead()) {
            return;
        }
        notificationRepository.markRead(notificationId, user.id(), clock.instant());
        log.debug("Notification {} read by {}", notificationId, user.id());
    }
}
