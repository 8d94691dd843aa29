package com.example.orderdesk.infrastructure.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Logs state changes of the collaborator circuit breakers, retries of identity lookups
 * and work code issuance, and notification push timeouts.
 */
@Configuration
public class ResilienceEventLogging {

    private static final Logger log = LoggerFactory.getLogger(ResilienceEventLogging.class);

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;

    public ResilienceEventLogging(
            CircuitBreakerRegistry circuitBreakerRegistry,
            RetryRegistry retryRegistry,
            TimeLimiterRegistry timeLimiterRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryRegistry = retryRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
    }

    @PostConstruct
    public void register() {
        circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::watch);
        circuitBreakerRegistry.getEventPublisher().onEntryAdded(event -> watch(event.getAddedEntry()));

        retryRegistry.getAllRetries().forEach(this::watch);
        retryRegistry.getEventPublisher().onEntryAdded(event -> watch(event.getAddedEntry()));

        timeLimiterRegistry.getAllTimeLimiters().forEach(this::watch);
        timeLimiterRegistry.getEventPublisher().onEntryAdded(event -> watch(event.getAddedEntry()));
    }

    private void watch(CircuitBreaker circuitBreaker) {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.info("[CB_STATE] name={}, transition={}",
                        event.getCircuitBreakerName(), event.getStateTransition()))
                .onCallNotPermitted(event -> log.warn("[CB_REJECTED] name={}, collaborator calls short-circuited",
                        event.getCircuitBreakerName()))
                .onError(event -> log.debug("[CB_ERROR] name={}, duration={}ms, error={}",
                        event.getCircuitBreakerName(), event.getElapsedDuration().toMillis(),
                        event.getThrowable().toString()));
    }

    private void watch(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> log.info("[RETRY] name={}, attempt={}, wait={}ms, cause={}",
                        event.getName(), event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                        describe(event.getLastThrowable())))
                .onError(event -> log.error("[RETRY_EXHAUSTED] name={}, attempts={}, cause={}",
                        event.getName(), event.getNumberOfRetryAttempts(), describe(event.getLastThrowable())))
                .onIgnoredError(event -> log.debug("[RETRY_IGNORED] name={}, cause={}",
                        event.getName(), describe(event.getLastThrowable())));
    }

    private void watch(TimeLimiter timeLimiter) {
        timeLimiter.getEventPublisher()
                .onTimeout(event -> log.warn("[TIMEOUT] name={}", event.getTimeLimiterName()))
                .onError(event -> log.warn("[TL_ERROR] name={}, cause={}",
                        event.getTimeLimiterName(), describe(event.getThrowable())));
    }

    private static String describe(Throwable throwable) {
        return throwable == null ? "n/a" : throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
