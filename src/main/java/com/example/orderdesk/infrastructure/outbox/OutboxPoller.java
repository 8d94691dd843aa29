package com.example.orderdesk.infrastructure.outbox;

import com.example.orderdesk.infrastructure.persistence.entity.OutboxEvent;
import com.example.orderdesk.infrastructure.persistence.entity.OutboxEventStatus;
import com.example.orderdesk.infrastructure.persistence.repository.OutboxRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Re-dispatches outbox events the post-commit publish did not finish.
 */
@Component
@ConditionalOnProperty(value = "outbox.poller.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPoller {

    private static final Logger log = LoggerFactory.getLogger(OutboxPoller.class);

    private final OutboxRepository outboxRepository;
    private final WorkflowEventDispatcher dispatcher;
    private final Clock clock;
    private final int batchSize;
    private final int maxRetries;
    private final Duration staleAfter;
    private final Duration stuckAfter;
    private final Duration retention;

    public OutboxPoller(
            OutboxRepository outboxRepository,
            WorkflowEventDispatcher dispatcher,
            Clock clock,
            @Value("${outbox.poller.batch-size:100}") int batchSize,
            @Value("${outbox.poller.max-retries:5}") int maxRetries,
            @Value("${outbox.poller.stale-after:5s}") Duration staleAfter,
            @Value("${outbox.poller.stuck-after:5m}") Duration stuckAfter,
            @Value("${outbox.poller.retention:24h}") Duration retention) {
        this.outboxRepository = outboxRepository;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
        this.staleAfter = staleAfter;
        this.stuckAfter = stuckAfter;
        this.retention = retention;
    }

    /**
     * Picks up events still PENDING a while after commit, e.g. when the process died
     * between commit and publish.
     */
    @Scheduled(fixedDelayString = "${outbox.poller.interval-ms:1000}")
    public void pollAndProcess() {
        Instant before = clock.instant().minus(staleAfter);
        List<OutboxEvent> events = outboxRepository.findStaleEvents(OutboxEventStatus.PENDING, before, batchSize);
        if (!events.isEmpty()) {
            log.debug("Dispatching {} pending outbox events", events.size());
        }
        for (OutboxEvent event : events) {
            dispatcher.publish(event.getId());
        }
    }

    @Scheduled(fixedDelayString = "${outbox.poller.retry-interval-ms:30000}")
    public void retryFailedEvents() {
        List<OutboxEvent> failed =
                outboxRepository.findEventsForRetry(OutboxEventStatus.FAILED, maxRetries, batchSize);
        if (!failed.isEmpty()) {
            log.info("Retrying {} failed outbox events", failed.size());
        }
        for (OutboxEvent event : failed) {
            dispatcher.publish(event.getId());
        }
    }

    @Scheduled(fixedDelayString = "${outbox.poller.retry-interval-ms:30000}")
    public void releaseStuckEvents() {
        int released = outboxRepository.releaseStuckEvents(
                OutboxEventStatus.PROCESSING, OutboxEventStatus.PENDING, clock.instant().minus(stuckAfter));
        if (released > 0) {
            log.warn("Released {} outbox events stuck in PROCESSING", released);
        }
    }

    @Scheduled(fixedRate = 3600000)
    public void cleanupProcessedEvents() {
        int deleted = outboxRepository.deleteProcessedEventsBefore(
                OutboxEventStatus.PROCESSED, clock.instant().minus(retention));
        if (deleted > 0) {
            log.info("Cleaned up {} processed outbox events older than {}", deleted, retention);
        }
    }
}
