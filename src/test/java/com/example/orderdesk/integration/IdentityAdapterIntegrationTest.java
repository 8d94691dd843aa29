package com.example.orderdesk.integration;

import com.example.orderdesk.application.port.out.UserDirectoryPort;
import com.example.orderdesk.application.port.out.UserDirectoryPort.UserAccount;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.exception.NonRetryableServiceException;
import com.example.orderdesk.infrastructure.exception.ServiceUnavailableException;
import com.example.orderdesk.support.WireMockTestSupport;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.ActiveProfiles;

import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Identity service adapter under transient and permanent failures.
 *
 * BDD Scenarios:
 * - Given 身分服務前兩次返回 503, When 查詢使用者, Then 自動重試後成功
 * - Given 身分服務返回 404, When 查詢使用者, Then 回傳空值
 * - Given 身分服務返回 400, When 查詢使用者, Then 不重試直接失敗
 * - Given 斷路器開啟, When 查詢使用者, Then 快速失敗且不呼叫身分服務
 */
@ActiveProfiles("test")
@DisplayName("身分服務韌性 - Identity Adapter Integration Tests")
class IdentityAdapterIntegrationTest extends WireMockTestSupport {

    private static final String FLAKY_USER = "flaky-1";

    @Autowired
    private UserDirectoryPort userDirectory;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @Test
    @DisplayName("should_retry_and_succeed_on_transient_failure - 前兩次503後成功")
    void should_retry_and_succeed_on_transient_failure() {
        // Given: 身分服務前兩次返回 503、第三次成功
        identityServer.stubFor(get(urlPathEqualTo("/api/users/" + FLAKY_USER))
                .inScenario("flaky").whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(503))
                .willSetStateTo("second"));
        identityServer.stubFor(get(urlPathEqualTo("/api/users/" + FLAKY_USER))
                .inScenario("flaky").whenScenarioStateIs("second")
                .willReturn(aResponse().withStatus(503))
                .willSetStateTo("recovered"));
        identityServer.stubFor(get(urlPathEqualTo("/api/users/" + FLAKY_USER))
                .inScenario("flaky").whenScenarioStateIs("recovered")
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"id\": \"flaky-1\", \"role\": \"WRITER\", \"active\": true}")));

        // When
        Optional<UserAccount> account = userDirectory.findUser(FLAKY_USER);

        // Then
        assertThat(account).get().extracting(UserAccount::role).isEqualTo(Role.WRITER);
        assertThat(identityLookupCount(FLAKY_USER)).isEqualTo(3);
    }

    @Test
    @DisplayName("should_fail_after_retries_exhausted - 重試耗盡後回報服務不可用")
    void should_fail_after_retries_exhausted() {
        stubIdentityFailure(503);

        assertThatThrownBy(() -> userDirectory.findUser(WRITER))
                .isInstanceOf(ServiceUnavailableException.class);
        assertThat(identityLookupCount(WRITER)).isEqualTo(3);
    }

    @Test
    @DisplayName("should_return_empty_for_unknown_user - 404回傳空值")
    void should_return_empty_for_unknown_user() {
        assertThat(userDirectory.findUser("nobody")).isEmpty();
        assertThat(identityLookupCount("nobody")).isEqualTo(1);
    }

    @Test
    @DisplayName("should_not_retry_on_bad_request - 400不重試")
    void should_not_retry_on_bad_request() {
        stubIdentityFailure(400);

        assertThatThrownBy(() -> userDirectory.findUser(WRITER))
                .isInstanceOf(NonRetryableServiceException.class);
        assertThat(identityLookupCount(WRITER)).isEqualTo(1);
    }

    @Test
    @DisplayName("should_fail_fast_when_circuit_open - 斷路器開啟時快速失敗")
    void should_fail_fast_when_circuit_open() {
        circuitBreakerRegistry.circuitBreaker("identityCB").transitionToOpenState();

        assertThatThrownBy(() -> userDirectory.findUser(WRITER))
                .isInstanceOf(ServiceUnavailableException.class)
                .hasMessageContaining("身分服務暫時不可用");
        assertThat(identityLookupCount(WRITER)).isZero();
    }

    @Test
    @DisplayName("should_list_only_active_users_of_role - 只列出啟用中的角色使用者")
    void should_list_only_active_users_of_role() {
        stubUser("writer-9", "WRITER", false);

        assertThat(userDirectory.findActiveUsers(Role.WRITER))
                .extracting(UserAccount::id)
                .containsExactlyInAnyOrder(WRITER, WRITER_2, WRITER_3);
    }
}
