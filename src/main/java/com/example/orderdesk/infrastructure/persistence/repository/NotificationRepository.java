package com.example.orderdesk.infrastructure.persistence.repository;

import com.example.orderdesk.infrastructure.persistence.entity.NotificationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface NotificationRepository extends JpaRepository<NotificationEntity, String> {

    List<NotificationEntity> findByRecipientIdOrderByCreatedAtDesc(String recipientId);

    List<NotificationEntity> findByRecipientIdAndReadFalseOrderByCreatedAtDesc(String recipientId);

    List<NotificationEntity> findByOrderIdOrderByCreatedAtAsc(String orderId);

    boolean existsByEventIdAndRecipientId(String eventId, String recipientId);

    @Transactional
    @Modifying
    @Query("UPDATE NotificationEntity n SET n.read = true, n.readAt = :now "
            + "WHERE n.id = :id AND n.recipientId = :recipientId AND n.read = false")
    int markRead(@Param("id") String id, @Param("recipientId") String recipientId, @Param("now") Instant now);
}
