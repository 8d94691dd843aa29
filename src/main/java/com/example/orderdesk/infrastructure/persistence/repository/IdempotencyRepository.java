package com.example.orderdesk.infrastructure.persistence.repository;

import com.example.orderdesk.infrastructure.persistence.entity.IdempotencyRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Replay records for keyed client requests. A key is reserved globally; the service checks
 * that the operation and actor match before replaying.
 */
@Repository
public interface IdempotencyRepository extends JpaRepository<IdempotencyRecord, String> {

    @Query("SELECT i FROM IdempotencyRecord i WHERE i.idempotencyKey = :key AND i.expiresAt > :now")
    Optional<IdempotencyRecord> findUnexpired(@Param("key") String idempotencyKey, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM IdempotencyRecord i WHERE i.expiresAt <= :now")
    int purgeExpired(@Param("now") Instant now);
}
