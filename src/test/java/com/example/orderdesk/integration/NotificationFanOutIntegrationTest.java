package com.example.orderdesk.integration;

import com.example.orderdesk.application.dto.NotificationView;
import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.PaymentView;
import com.example.orderdesk.application.port.in.NotificationInboxUseCase;
import com.example.orderdesk.domain.exception.NotFoundException;
import com.example.orderdesk.infrastructure.outbox.WorkflowEventDispatcher;
import com.example.orderdesk.infrastructure.persistence.entity.NotificationEntity;
import com.example.orderdesk.infrastructure.persistence.entity.OutboxEvent;
import com.example.orderdesk.infrastructure.persistence.entity.OutboxEventStatus;
import com.example.orderdesk.support.WorkflowTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Audit and notification fan-out after each committed workflow action.
 *
 * BDD Scenarios:
 * - Given 推播服務故障, When 工作流程動作提交, Then 動作成功且通知與稽核仍保存
 * - Given 身分服務無法列出管理員, When 事件分派, Then 事件標記失敗，之後重新分派只寫一次稽核
 * - Given 執行者本人, When 事件通知其角色, Then 不通知執行者自己
 */
@ActiveProfiles("test")
@DisplayName("稽核與通知分派 - Notification Fan-out Integration Tests")
class NotificationFanOutIntegrationTest extends WorkflowTestSupport {

    @Autowired
    private WorkflowEventDispatcher dispatcher;

    @Autowired
    private NotificationInboxUseCase inbox;

    @Test
    @DisplayName("should_push_each_persisted_notification - 每筆通知都推播")
    void should_push_each_persisted_notification() {
        // When
        OrderView order = quotedOrder();

        // Then: 報價通知客戶與 BDE
        List<NotificationEntity> rows = notificationRepository.findByOrderIdOrderByCreatedAtAsc(order.orderId());
        assertThat(rows)
                .filteredOn(n -> "Quotation Ready".equals(n.getTitle()))
                .extracting(NotificationEntity::getRecipientId)
                .containsExactlyInAnyOrder(CLIENT, BDE);
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                notificationServer.verify(postRequestedFor(urlEqualTo("/api/notifications/deliver"))
                        .withRequestBody(matchingJsonPath("$.recipientId", equalTo(CLIENT)))
                        .withRequestBody(matchingJsonPath("$.title", equalTo("Quotation Ready")))));
    }

    @Test
    @DisplayName("should_keep_action_and_records_when_push_fails - 推播失敗不影響動作")
    void should_keep_action_and_records_when_push_fails() {
        // Given
        stubPushFailure();

        // When
        OrderView order = quotedOrder();

        // Then
        assertThat(order.totalPrice()).isEqualByComparingTo("215.00");
        assertThat(auditLogRepository.countByOrderId(order.orderId())).isEqualTo(2);
        assertThat(notificationRepository.findByOrderIdOrderByCreatedAtAsc(order.orderId())).isNotEmpty();
        assertThat(outboxRepository.findByAggregateId(order.orderId()))
                .extracting(OutboxEvent::getStatus)
                .containsOnly(OutboxEventStatus.PROCESSED);
        await().atMost(Duration.ofSeconds(5)).until(() -> pushRequestCount() > 0);
    }

    @Test
    @DisplayName("should_not_notify_the_acting_user - 不通知執行者本人")
    void should_not_notify_the_acting_user() {
        // Given: 報價由管理員送出，接受報價通知所有管理員
        OrderView order = quotedOrder();
        stubUser("admin-2", "ADMIN", true);

        // When: 管理員代客戶接受報價
        quotations.acceptQuotation(order.orderId(), ADMIN);

        // Then
        List<NotificationEntity> accepted = notificationRepository.findByOrderIdOrderByCreatedAtAsc(order.orderId())
                .stream()
                .filter(n -> "Quotation Accepted".equals(n.getTitle()))
                .toList();
        assertThat(accepted)
                .extracting(NotificationEntity::getRecipientId)
                .containsExactlyInAnyOrder(BDE, CLIENT, "admin-2")
                .doesNotContain(ADMIN);
    }

    @Test
    @DisplayName("should_mark_event_failed_then_redispatch_once - 分派失敗後重新分派")
    void should_mark_event_failed_then_redispatch_once() {
        // Given: 管理員清單暫時無法取得
        OrderView order = acceptedOrder();
        identityServer.stubFor(get(urlPathEqualTo("/api/users"))
                .withQueryParam("role", equalTo("ADMIN"))
                .willReturn(aResponse().withStatus(503)));

        // When: 付款事件需要通知所有管理員
        PaymentView payment = submittedPayment(order.orderId());

        // Then: 動作已提交，事件失敗，稽核已寫入
        OutboxEvent event = outboxRepository.findByAggregateId(payment.paymentId()).get(0);
        assertThat(event.getStatus()).isEqualTo(OutboxEventStatus.FAILED);
        assertThat(event.getRetryCount()).isEqualTo(1);
        assertThat(auditLogRepository.findByResourceTypeAndResourceIdOrderByOccurredAtAsc("PAYMENT", payment.paymentId()))
                .hasSize(1);
        assertThat(notificationRepository.findByRecipientIdOrderByCreatedAtDesc(ADMIN))
                .noneMatch(n -> "Payment Awaiting Verification".equals(n.getTitle())
                        && order.orderId().equals(n.getOrderId()));

        // When: 身分服務恢復後重新分派
        stubUser(ADMIN, "ADMIN", true);
        dispatcher.publish(event.getId());

        // Then
        assertThat(outboxRepository.findById(event.getId()))
                .get().extracting(OutboxEvent::getStatus).isEqualTo(OutboxEventStatus.PROCESSED);
        assertThat(auditLogRepository.findByResourceTypeAndResourceIdOrderByOccurredAtAsc("PAYMENT", payment.paymentId()))
                .hasSize(1);
        assertThat(notificationRepository.findByRecipientIdOrderByCreatedAtDesc(ADMIN))
                .filteredOn(n -> order.orderId().equals(n.getOrderId()))
                .extracting(NotificationEntity::getTitle)
                .containsOnlyOnce("Payment Awaiting Verification");
    }

    @Test
    @DisplayName("should_ignore_redispatch_of_processed_event - 已處理事件不重複分派")
    void should_ignore_redispatch_of_processed_event() {
        OrderView order = newQuery();
        OutboxEvent event = outboxRepository.findByAggregateId(order.orderId()).get(0);
        long notifications = notificationRepository.count();

        dispatcher.publish(event.getId());

        assertThat(auditLogRepository.countByOrderId(order.orderId())).isEqualTo(1);
        assertThat(notificationRepository.count()).isEqualTo(notifications);
    }

    @Test
    @DisplayName("should_list_and_mark_notifications_read - 讀取與標記已讀")
    void should_list_and_mark_notifications_read() {
        // Given
        OrderView order = quotedOrder();
        List<NotificationView> unread = inbox.notifications(CLIENT, true);
        NotificationView quoteReady = unread.stream()
                .filter(n -> order.orderId().equals(n.orderId()))
                .findFirst()
                .orElseThrow();

        // When
        inbox.markRead(quoteReady.notificationId(), CLIENT);

        // Then
        assertThat(inbox.notifications(CLIENT, true))
                .extracting(NotificationView::notificationId)
                .doesNotContain(quoteReady.notificationId());
        assertThat(inbox.notifications(CLIENT, false))
                .filteredOn(n -> n.notificationId().equals(quoteReady.notificationId()))
                .singleElement()
                .satisfies(n -> assertThat(n.read()).isTrue());
    }

    @Test
    @DisplayName("should_hide_other_users_notifications - 不可標記他人通知")
    void should_hide_other_users_notifications() {
        OrderView order = quotedOrder();
        NotificationView clientNotice = inbox.notifications(CLIENT, false).stream()
                .filter(n -> order.orderId().equals(n.orderId()))
                .findFirst()
                .orElseThrow();

        assertThatThrownBy(() -> inbox.markRead(clientNotice.notificationId(), OTHER_CLIENT))
                .isInstanceOf(NotFoundException.class);
    }
}
