package com.example.orderdesk.infrastructure.adapter.out.identity;

import com.example.orderdesk.application.port.out.UserDirectoryPort;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.adapter.out.identity.dto.UserResponse;
import com.example.orderdesk.infrastructure.adapter.out.identity.mapper.UserAccountMapper;
import com.example.orderdesk.infrastructure.exception.NonRetryableServiceException;
import com.example.orderdesk.infrastructure.exception.RetryableServiceException;
import com.example.orderdesk.infrastructure.exception.ServiceUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Identity service adapter. Blocking by contract: callers run on worker threads,
 * never on the event loop.
 * Decorator order: CircuitBreaker → Retry → HTTP call
 */
@Component
public class UserDirectoryAdapter implements UserDirectoryPort {

    private static final Logger log = LoggerFactory.getLogger(UserDirectoryAdapter.class);
    private static final String SERVICE_NAME = "identity";

    private final WebClient webClient;
    private final UserAccountMapper mapper;

    public UserDirectoryAdapter(
            @Qualifier("identityWebClient") WebClient webClient,
            UserAccountMapper mapper) {
        this.webClient = webClient;
        this.mapper = mapper;
    }

    @Override
    @CircuitBreaker(name = "identityCB", fallbackMethod = "findUserFallback")
    @Retry(name = "identityRetry")
    public Optional<UserAccount> findUser(String userId) {
        log.debug("Looking up user {}", userId);

        return webClient.get()
                .uri("/api/users/{id}", userId)
                .retrieve()
                .onStatus(status -> status.is4xxClientError() && status.value() != 404, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new NonRetryableServiceException(
                                        SERVICE_NAME, response.statusCode().value(),
                                        "Identity service rejected lookup of " + userId + ": " + body))))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        Mono.error(new RetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(),
                                "Identity service temporarily unavailable")))
                .bodyToMono(UserResponse.class)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .blockOptional()
                .flatMap(mapper::toAccount);
    }

    @Override
    @CircuitBreaker(name = "identityCB", fallbackMethod = "findActiveUsersFallback")
    @Retry(name = "identityRetry")
    public List<UserAccount> findActiveUsers(Role role) {
        log.debug("Listing active {} users", role);

        List<UserResponse> users = webClient.get()
                .uri(uri -> uri.path("/api/users")
                        .queryParam("role", role.name())
                        .queryParam("active", true)
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, response ->
                        Mono.error(new NonRetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(),
                                "Identity service rejected listing of " + role + " users")))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        Mono.error(new RetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(),
                                "Identity service temporarily unavailable")))
                .bodyToFlux(UserResponse.class)
                .collectList()
                .block();

        return users == null ? List.of() : users.stream()
                .map(mapper::toAccount)
                .flatMap(Optional::stream)
                .filter(account -> account.active() && account.role() == role)
                .toList();
    }

    @SuppressWarnings("unused")
    private Optional<UserAccount> findUserFallback(String userId, CallNotPermittedException ex) {
        log.warn("Circuit breaker is OPEN for identity service, user: {}", userId);
        throw new ServiceUnavailableException(SERVICE_NAME, "身分服務暫時不可用，請稍後重試");
    }

    @SuppressWarnings("unused")
    private Optional<UserAccount> findUserFallback(String userId, Throwable throwable) {
        log.error("User lookup failed for {}, cause: {}", userId, throwable.getMessage());
        if (throwable instanceof NonRetryableServiceException) {
            throw (NonRetryableServiceException) throwable;
        }
        throw new ServiceUnavailableException(SERVICE_NAME, "身分服務暫時不可用，請稍後重試", throwable);
    }

    @SuppressWarnings("unused")
    private List<UserAccount> findActiveUsersFallback(Role role, Throwable throwable) {
        log.error("Listing {} users failed, cause: {}", role, throwable.getMessage());
        throw new ServiceUnavailableException(SERVICE_NAME, "身分服務暫時不可用，請稍後重試", throwable);
    }
}
