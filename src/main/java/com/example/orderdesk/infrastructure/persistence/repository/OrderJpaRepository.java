package com.example.orderdesk.infrastructure.persistence.repository;

import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.infrastructure.persistence.entity.OrderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * JPA Repository for Order entities.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    Optional<OrderEntity> findByQueryCode(String queryCode);

    Optional<OrderEntity> findByWorkCode(String workCode);

    /**
     * Compare-and-set of the status column. Returns 0 when the stored status no longer
     * matches {@code expected}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :target, o.version = o.version + 1, o.updatedAt = :now "
            + "WHERE o.id = :id AND o.status = :expected")
    int compareAndSetStatus(@Param("id") String id,
                            @Param("expected") OrderStatus expected,
                            @Param("target") OrderStatus target,
                            @Param("now") Instant now);
}
