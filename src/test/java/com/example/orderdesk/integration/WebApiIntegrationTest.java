package com.example.orderdesk.integration;

import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.PaymentView;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.support.WorkflowTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HTTP surface: status codes and error bodies produced by the exception handler.
 */
@ActiveProfiles("test")
@DisplayName("HTTP API - Web API Integration Tests")
class WebApiIntegrationTest extends WorkflowTestSupport {

    @Autowired
    private WebTestClient webTestClient;

    private static String queryRequest(Instant deadline) {
        return """
                {
                    "topic": "Renewable energy subsidies in the EU",
                    "subject": "Economics",
                    "service": "Essay",
                    "urgency": "STANDARD",
                    "description": "3000 words, Harvard",
                    "deadline": "%s",
                    "bdeId": "bde-1"
                }
                """.formatted(deadline);
    }

    @Test
    @DisplayName("should_create_query_and_return_201 - 建立詢價回傳 201")
    void should_create_query_and_return_201() {
        webTestClient.post()
                .uri("/api/orders")
                .header("X-User-Id", CLIENT)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(queryRequest(Instant.now().plus(7, ChronoUnit.DAYS)))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.orderId").isNotEmpty()
                .jsonPath("$.status").isEqualTo("PENDING_QUERY")
                .jsonPath("$.statusCode").isEqualTo(26)
                .jsonPath("$.clientId").isEqualTo(CLIENT);
    }

    @Test
    @DisplayName("should_replay_same_order_for_same_idempotency_key - 相同冪等鍵回傳相同結果")
    void should_replay_same_order_for_same_idempotency_key() {
        // Given
        String idempotencyKey = UUID.randomUUID().toString();
        String body = queryRequest(Instant.now().plus(7, ChronoUnit.DAYS));

        // When
        OrderView first = webTestClient.post()
                .uri("/api/orders")
                .header("X-User-Id", CLIENT)
                .header("X-Idempotency-Key", idempotencyKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isCreated()
                .expectBody(OrderView.class)
                .returnResult().getResponseBody();
        OrderView second = webTestClient.post()
                .uri("/api/orders")
                .header("X-User-Id", CLIENT)
                .header("X-Idempotency-Key", idempotencyKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().is2xxSuccessful()
                .expectBody(OrderView.class)
                .returnResult().getResponseBody();

        // Then
        assertThat(first).isNotNull();
        assertThat(second).isNotNull();
        assertThat(second.orderId()).isEqualTo(first.orderId());
        assertThat(auditLogRepository.countByOrderId(first.orderId())).isEqualTo(1);
    }

    @Test
    @DisplayName("should_reject_reuse_of_key_by_another_user - 冪等鍵不可跨使用者")
    void should_reject_reuse_of_key_by_another_user() {
        String idempotencyKey = UUID.randomUUID().toString();
        String body = queryRequest(Instant.now().plus(7, ChronoUnit.DAYS));
        webTestClient.post()
                .uri("/api/orders")
                .header("X-User-Id", CLIENT)
                .header("X-Idempotency-Key", idempotencyKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isCreated();

        webTestClient.post()
                .uri("/api/orders")
                .header("X-User-Id", OTHER_CLIENT)
                .header("X-Idempotency-Key", idempotencyKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");
    }

    @Test
    @DisplayName("should_return_400_without_user_header - 缺少使用者標頭")
    void should_return_400_without_user_header() {
        webTestClient.post()
                .uri("/api/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(queryRequest(Instant.now().plus(7, ChronoUnit.DAYS)))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
    }

    @Test
    @DisplayName("should_return_400_on_bean_validation_failure - 參數驗證失敗")
    void should_return_400_on_bean_validation_failure() {
        webTestClient.post()
                .uri("/api/orders")
                .header("X-User-Id", CLIENT)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(queryRequest(Instant.now().minus(1, ChronoUnit.DAYS)))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR")
                .jsonPath("$.message").value(message ->
                        assertThat((String) message).contains("Deadline must be in the future"));
    }

    @Test
    @DisplayName("should_return_404_for_unknown_order - 訂單不存在")
    void should_return_404_for_unknown_order() {
        webTestClient.get()
                .uri("/api/orders/{id}", "missing-order")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND")
                .jsonPath("$.message").isEqualTo("Order not found: missing-order")
                .jsonPath("$.timestamp").isNotEmpty();
    }

    @Test
    @DisplayName("should_return_403_for_forbidden_transition - 不允許的狀態轉換")
    void should_return_403_for_forbidden_transition() {
        OrderView order = newQuery();

        webTestClient.post()
                .uri("/api/orders/{id}/status", order.orderId())
                .header("X-User-Id", BDE)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"expectedStatus": "PENDING_QUERY", "targetStatus": "QUERY_REJECTED"}
                        """)
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_TRANSITION");
    }

    @Test
    @DisplayName("should_return_409_for_stale_expected_status - 預期狀態已過期")
    void should_return_409_for_stale_expected_status() {
        OrderView order = quotedOrder();

        webTestClient.post()
                .uri("/api/orders/{id}/status", order.orderId())
                .header("X-User-Id", ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"expectedStatus": "PENDING_QUERY", "targetStatus": "CANCELLED", "reason": "dup"}
                        """)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("CONFLICT");
    }

    @Test
    @DisplayName("should_return_403_with_order_closed_code - 已關閉訂單")
    void should_return_403_with_order_closed_code() {
        OrderView order = newQuery();
        orderIntake.changeStatus(order.orderId(), ADMIN, OrderStatus.PENDING_QUERY,
                OrderStatus.CANCELLED, null);

        webTestClient.post()
                .uri("/api/orders/{id}/invitations", order.orderId())
                .header("X-User-Id", ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"writerIds": ["writer-1"]}
                        """)
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.error").isEqualTo("ORDER_CLOSED");
    }

    @Test
    @DisplayName("should_return_409_with_stale_order_code_on_outdated_assignment - 指派版本過期")
    void should_return_409_with_stale_order_code_on_outdated_assignment() {
        OrderView order = paidOrder();
        recruitment.showInterest(order.orderId(), WRITER, null);

        webTestClient.put()
                .uri("/api/orders/{id}/assignment", order.orderId())
                .header("X-User-Id", ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"writerId": "writer-1", "expectedVersion": %d}
                        """.formatted(order.version() + 5))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("STALE_ORDER");
    }

    @Test
    @DisplayName("should_verify_payment_over_http - 透過 API 驗證付款")
    void should_verify_payment_over_http() {
        OrderView order = acceptedOrder();
        PaymentView payment = submittedPayment(order.orderId());

        webTestClient.post()
                .uri("/api/payments/{id}/verify", payment.paymentId())
                .header("X-User-Id", ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"percentage\": 100}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.state").isEqualTo("VERIFIED")
                .jsonPath("$.workCode").value(code -> assertThat((String) code).startsWith("WORK_"));
    }

    @Test
    @DisplayName("should_return_503_when_identity_unavailable - 身分服務不可用")
    void should_return_503_when_identity_unavailable() {
        stubIdentityFailure(503);

        webTestClient.post()
                .uri("/api/orders")
                .header("X-User-Id", CLIENT)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(queryRequest(Instant.now().plus(7, ChronoUnit.DAYS)))
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("SERVICE_UNAVAILABLE");
    }

    @Test
    @DisplayName("should_answer_transition_check - 查詢狀態轉換")
    void should_answer_transition_check() {
        webTestClient.get()
                .uri("/api/orders/transitions?role=WRITER&from=IN_PROGRESS&to=PENDING_QC")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.allowed").isEqualTo(true);

        webTestClient.get()
                .uri("/api/orders/transitions?role=CLIENT&from=PENDING_QC&to=APPROVED")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.allowed").isEqualTo(false);
    }

    @Test
    @DisplayName("should_return_204_when_no_writer_assigned - 尚未指派寫手")
    void should_return_204_when_no_writer_assigned() {
        OrderView order = newQuery();

        webTestClient.get()
                .uri("/api/orders/{id}/assignment", order.orderId())
                .exchange()
                .expectStatus().isNoContent();
    }

    @Test
    @DisplayName("should_list_filtered_audit_trail - 查詢稽核紀錄")
    void should_list_filtered_audit_trail() {
        OrderView order = paidOrder();

        webTestClient.get()
                .uri("/api/orders/{id}/audit?eventType=PAYMENT_VERIFIED", order.orderId())
                .header("X-User-Id", ADMIN)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].eventType").isEqualTo("PAYMENT_VERIFIED")
                .jsonPath("$[0].actorId").isEqualTo(ADMIN);

        webTestClient.get()
                .uri("/api/orders/{id}/audit", order.orderId())
                .header("X-User-Id", CLIENT)
                .exchange()
                .expectStatus().isForbidden();
    }
}
