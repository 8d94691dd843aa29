package com.example.orderdesk.infrastructure.persistence.repository;

import com.example.orderdesk.infrastructure.persistence.entity.OutboxEvent;
import com.example.orderdesk.infrastructure.persistence.entity.OutboxEventStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * JPA Repository for OutboxEvent entities.
 */
@Repository
public interface OutboxRepository extends JpaRepository<OutboxEvent, String> {

    List<OutboxEvent> findByStatus(OutboxEventStatus status);

    List<OutboxEvent> findByAggregateId(String aggregateId);

    @Query("SELECT o FROM OutboxEvent o WHERE o.status = :status AND o.createdAt < :before "
            + "ORDER BY o.createdAt ASC LIMIT :limit")
    List<OutboxEvent> findStaleEvents(@Param("status") OutboxEventStatus status,
                                      @Param("before") Instant before,
                                      @Param("limit") int limit);

    @Query("SELECT o FROM OutboxEvent o WHERE o.status = :status AND o.retryCount < :maxRetries "
            + "ORDER BY o.createdAt ASC LIMIT :limit")
    List<OutboxEvent> findEventsForRetry(@Param("status") OutboxEventStatus status,
                                         @Param("maxRetries") int maxRetries,
                                         @Param("limit") int limit);

    /**
     * Claims an event for dispatch. Only one caller can move it to PROCESSING.
     */
    @Transactional
    @Modifying
    @Query("UPDATE OutboxEvent o SET o.status = :processing WHERE o.id = :id AND o.status IN :claimable")
    int claim(@Param("id") String id,
              @Param("claimable") Collection<OutboxEventStatus> claimable,
              @Param("processing") OutboxEventStatus processing);

    /**
     * Returns events stuck in PROCESSING, e.g. after a crash mid-dispatch, to PENDING.
     */
    @Transactional
    @Modifying
    @Query("UPDATE OutboxEvent o SET o.status = :pending WHERE o.status = :processing AND o.createdAt < :before")
    int releaseStuckEvents(@Param("processing") OutboxEventStatus processing,
                           @Param("pending") OutboxEventStatus pending,
                           @Param("before") Instant before);

    @Transactional
    @Modifying
    @Query("DELETE FROM OutboxEvent o WHERE o.status = :processed AND o.processedAt < :before")
    int deleteProcessedEventsBefore(@Param("processed") OutboxEventStatus processed,
                                    @Param("before") Instant before);
}
