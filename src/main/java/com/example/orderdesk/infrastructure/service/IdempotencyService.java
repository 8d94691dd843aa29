package com.example.orderdesk.infrastructure.service;

import com.example.orderdesk.domain.exception.ConflictException;
import com.example.orderdesk.domain.exception.ValidationException;
import com.example.orderdesk.infrastructure.persistence.entity.IdempotencyRecord;
import com.example.orderdesk.infrastructure.persistence.entity.IdempotencyStatus;
import com.example.orderdesk.infrastructure.persistence.repository.IdempotencyRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Replays client POSTs carrying an {@code X-Idempotency-Key}. Keys live in the
 * {@code idempotency_records} table until they expire.
 */
@Service
public class IdempotencyService {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyService.class);

    private final IdempotencyRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int expiryHours;

    public IdempotencyService(
            IdempotencyRepository repository,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${idempotency.expiry-hours:24}") int expiryHours) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.expiryHours = expiryHours;
    }

    /**
     * Runs the action once per key. A repeated key returns the stored result.
     *
     * @param idempotencyKey the client's key, or null to run without replay protection
     * @throws ConflictException   if the same key is still being processed
     * @throws ValidationException if the key was used for another operation or user
     */
    public <T> T execute(String idempotencyKey, String operation, String actorId, Class<T> resultType,
                         Supplier<T> action) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return action.get();
        }
        Optional<T> existing = getExistingResult(idempotencyKey, operation, actorId, resultType);
        if (existing.isPresent()) {
            log.info("Replaying {} for idempotency key {}", operation, idempotencyKey);
            return existing.get();
        }
        markInProgress(idempotencyKey, operation, actorId);
        try {
            T result = action.get();
            saveResult(idempotencyKey, result);
            return result;
        } catch (RuntimeException e) {
            markFailed(idempotencyKey);
            throw e;
        }
    }

    /**
     * @return the stored result of a completed request with this key
     */
    public <T> Optional<T> getExistingResult(String idempotencyKey, String operation, String actorId,
                                             Class<T> resultType) {
        Optional<IdempotencyRecord> found = repository.findUnexpired(idempotencyKey, clock.instant());
        if (found.isEmpty()) {
            return Optional.empty();
        }
        IdempotencyRecord record = found.get();
        if (!record.getOperation().equals(operation) || !record.getActorId().equals(actorId)) {
            throw new ValidationException("Idempotency key " + idempotencyKey + " was used for another request");
        }
        if (record.getStatus() == IdempotencyStatus.IN_PROGRESS) {
            throw new ConflictException("Request with idempotency key " + idempotencyKey + " is still in progress");
        }
        if (record.getStatus() != IdempotencyStatus.COMPLETED) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(record.getResponse(), resultType));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize idempotency response for key: {}", idempotencyKey, e);
            return Optional.empty();
        }
    }

    /**
     * Claims a key. Expired or failed records under the same key are taken over; the record's
     * version makes sure only one of two concurrent retries wins the takeover.
     *
     * @throws ConflictException if another request claimed the key first
     */
    public void markInProgress(String idempotencyKey, String operation, String actorId) {
        Instant now = clock.instant();
        Optional<IdempotencyRecord> found = repository.findById(idempotencyKey);
        if (found.isPresent() && found.get().getStatus() == IdempotencyStatus.IN_PROGRESS
                && found.get().getExpiresAt().isAfter(now)) {
            throw alreadyClaimed(idempotencyKey);
        }
        IdempotencyRecord record = found.orElseGet(() -> {
            IdempotencyRecord created = new IdempotencyRecord();
            created.setIdempotencyKey(idempotencyKey);
            return created;
        });
        record.setOperation(operation);
        record.setActorId(actorId);
        record.setResponse(null);
        record.setStatus(IdempotencyStatus.IN_PROGRESS);
        record.setExpiresAt(now.plus(expiryHours, ChronoUnit.HOURS));
        try {
            repository.saveAndFlush(record);
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            log.info("Idempotency key {} was claimed by a concurrent request", idempotencyKey);
            throw alreadyClaimed(idempotencyKey);
        }
        log.debug("Marked idempotency key as in progress: {}", idempotencyKey);
    }

    public void saveResult(String idempotencyKey, Object result) {
        repository.findById(idempotencyKey).ifPresentOrElse(
                record -> {
                    try {
                        record.setResponse(objectMapper.writeValueAsString(result));
                        record.setStatus(IdempotencyStatus.COMPLETED);
                        repository.save(record);
                        log.debug("Saved result for idempotency key: {}", idempotencyKey);
                    } catch (JsonProcessingException e) {
                        log.error("Failed to serialize result for idempotency key: {}", idempotencyKey, e);
                        markFailed(idempotencyKey);
                    }
                },
                () -> log.warn("No idempotency record found for key: {}", idempotencyKey));
    }

    /**
     * Releases a key after a failed request so the client can retry with it.
     */
    public void markFailed(String idempotencyKey) {
        repository.findById(idempotencyKey).ifPresent(record -> {
            record.setStatus(IdempotencyStatus.FAILED);
            repository.save(record);
            log.debug("Marked idempotency key as failed: {}", idempotencyKey);
        });
    }

    private static ConflictException alreadyClaimed(String idempotencyKey) {
        return new ConflictException("Request with idempotency key " + idempotencyKey + " is already being processed");
    }

    @Scheduled(fixedRate = 3600000)
    @Transactional
    public void cleanupExpiredRecords() {
        int deleted = repository.purgeExpired(clock.instant());
        if (deleted > 0) {
            log.info("Cleaned up {} expired idempotency records", deleted);
        }
    }
}
