package com.example.orderdesk.integration;

import com.example.orderdesk.application.dto.CreateQueryCommand;
import com.example.orderdesk.application.dto.OrderParticipants;
import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.PaymentView;
import com.example.orderdesk.application.dto.QuotationView;
import com.example.orderdesk.application.dto.QuoteCommand;
import com.example.orderdesk.application.dto.SubmissionView;
import com.example.orderdesk.domain.exception.ConflictException;
import com.example.orderdesk.domain.exception.InvalidTransitionException;
import com.example.orderdesk.domain.exception.NotFoundException;
import com.example.orderdesk.domain.exception.OrderClosedException;
import com.example.orderdesk.domain.exception.ValidationException;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.domain.model.WriterInterestState;
import com.example.orderdesk.infrastructure.persistence.entity.AuditLogEntry;
import com.example.orderdesk.infrastructure.persistence.entity.OutboxEventStatus;
import com.example.orderdesk.infrastructure.persistence.entity.WriterInterestEntity;
import com.example.orderdesk.support.WorkflowTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Order intake, quotation and free status changes, plus one full happy path.
 *
 * BDD Scenarios:
 * - Given 客戶提出需求, When 截止日已過, Then 拒絕建立
 * - Given 報價已送出, When 非下單客戶接受報價, Then 拒絕
 * - Given 訂單已取消, When 任何角色嘗試變更, Then 回報訂單已關閉
 * - Given 完整流程, When 從需求走到完成, Then 每一步寫入一筆稽核且工作代碼不變
 */
@ActiveProfiles("test")
@DisplayName("訂單生命週期 - Order Lifecycle Integration Tests")
class OrderLifecycleIntegrationTest extends WorkflowTestSupport {

    @Nested
    @DisplayName("Query intake")
    class Intake {

        @Test
        @DisplayName("should_create_query_in_pending_query_with_query_code - 建立需求")
        void should_create_query_in_pending_query_with_query_code() {
            // When
            OrderView order = newQuery();

            // Then
            assertThat(order.status()).isEqualTo(OrderStatus.PENDING_QUERY);
            assertThat(order.statusCode()).isEqualTo(26);
            assertThat(order.queryCode()).matches("QUERY_[A-Z0-9]{8}");
            assertThat(order.workCode()).isNull();
            assertThat(order.clientId()).isEqualTo(CLIENT);
            assertThat(orderRepository.findByQueryCode(order.queryCode())).isPresent();
            assertThat(auditLogRepository.findByOrderIdOrderByOccurredAtAsc(order.orderId()))
                    .extracting(AuditLogEntry::getEventType)
                    .containsExactly("QUERY_CREATED");
        }

        @Test
        @DisplayName("should_reject_deadline_in_the_past - 截止日已過")
        void should_reject_deadline_in_the_past() {
            CreateQueryCommand command = new CreateQueryCommand(CLIENT, "Late topic", "History", "Essay",
                    "URGENT", null, Instant.now().minus(1, ChronoUnit.HOURS), null, null);

            assertThatThrownBy(() -> orderIntake.createQuery(command))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Deadline must be in the future");
        }

        @Test
        @DisplayName("should_only_let_clients_raise_queries - 只有客戶可提出需求")
        void should_only_let_clients_raise_queries() {
            CreateQueryCommand command = new CreateQueryCommand(WRITER, "Topic", "Law", "Essay",
                    "STANDARD", null, Instant.now().plus(3, ChronoUnit.DAYS), null, null);

            assertThatThrownBy(() -> orderIntake.createQuery(command))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessage("WRITER cannot raise a query; required role: CLIENT");
        }

        @Test
        @DisplayName("should_report_unknown_user - 未知使用者")
        void should_report_unknown_user() {
            CreateQueryCommand command = new CreateQueryCommand("ghost", "Topic", "Law", "Essay",
                    "STANDARD", null, Instant.now().plus(3, ChronoUnit.DAYS), null, null);

            assertThatThrownBy(() -> orderIntake.createQuery(command))
                    .isInstanceOf(NotFoundException.class)
                    .hasMessage("User not found: ghost");
        }

        @Test
        @DisplayName("should_refuse_inactive_user - 停用帳號不可操作")
        void should_refuse_inactive_user() {
            stubUser(CLIENT, "CLIENT", false);

            assertThatThrownBy(() -> newQuery())
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("inactive");
        }

        @Test
        @DisplayName("should_list_participants - 查詢訂單參與者")
        void should_list_participants() {
            OrderView order = assignedOrder(WRITER);

            OrderParticipants participants = orderIntake.participants(order.orderId());

            assertThat(participants.clientId()).isEqualTo(CLIENT);
            assertThat(participants.bdeId()).isEqualTo(BDE);
            assertThat(participants.writerId()).isEqualTo(WRITER);
        }
    }

    @Nested
    @DisplayName("Quotation")
    class Quotation {

        @Test
        @DisplayName("should_mirror_quote_onto_order - 報價同步至訂單")
        void should_mirror_quote_onto_order() {
            // When
            OrderView order = quotedOrder();

            // Then
            assertThat(order.status()).isEqualTo(OrderStatus.QUOTATION_SENT);
            assertThat(order.basicPrice()).isEqualByComparingTo("225.00");
            assertThat(order.discount()).isEqualByComparingTo("10.00");
            assertThat(order.totalPrice()).isEqualByComparingTo("215.00");
            QuotationView quotation = quotations.getQuotation(order.orderId());
            assertThat(quotation.finalPrice()).isEqualByComparingTo("215.00");
            assertThat(quotation.quotedBy()).isEqualTo(ADMIN);
        }

        @Test
        @DisplayName("should_update_single_quotation_in_place - 更新既有報價")
        void should_update_single_quotation_in_place() {
            // Given
            OrderView order = quotedOrder();
            String quotationId = quotations.getQuotation(order.orderId()).quotationId();

            // When: BDE 修改報價
            QuotationView updated = quotations.createOrUpdateQuotation(new QuoteCommand(order.orderId(), BDE,
                    new BigDecimal("180.00"), BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal("9.00"),
                    null, "Revised"));

            // Then
            assertThat(updated.quotationId()).isEqualTo(quotationId);
            assertThat(updated.finalPrice()).isEqualByComparingTo("189.00");
            assertThat(orderIntake.getOrder(order.orderId()).totalPrice()).isEqualByComparingTo("189.00");
            assertThat(auditLogRepository.findByOrderIdOrderByOccurredAtAsc(order.orderId()))
                    .extracting(AuditLogEntry::getEventType)
                    .contains("QUOTATION_SENT", "QUOTATION_UPDATED");
        }

        @Test
        @DisplayName("should_reject_discount_above_subtotal - 折扣超過小計")
        void should_reject_discount_above_subtotal() {
            OrderView order = newQuery();

            assertThatThrownBy(() -> quotations.createOrUpdateQuotation(new QuoteCommand(order.orderId(), ADMIN,
                    new BigDecimal("50.00"), BigDecimal.ZERO, new BigDecimal("60.00"), BigDecimal.ZERO, null, null)))
                    .isInstanceOf(ValidationException.class);
            assertThat(orderIntake.getOrder(order.orderId()).status()).isEqualTo(OrderStatus.PENDING_QUERY);
        }

        @Test
        @DisplayName("should_only_let_owner_accept - 只有下單客戶可接受報價")
        void should_only_let_owner_accept() {
            OrderView order = quotedOrder();

            assertThatThrownBy(() -> quotations.acceptQuotation(order.orderId(), OTHER_CLIENT))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(orderIntake.getOrder(order.orderId()).status()).isEqualTo(OrderStatus.QUOTATION_SENT);
        }

        @Test
        @DisplayName("should_not_accept_twice - 不可重複接受報價")
        void should_not_accept_twice() {
            OrderView order = acceptedOrder();

            assertThatThrownBy(() -> quotations.acceptQuotation(order.orderId(), CLIENT))
                    .isInstanceOf(InvalidTransitionException.class);
        }
    }

    @Nested
    @DisplayName("Free status changes")
    class StatusChanges {

        @Test
        @DisplayName("should_refuse_gated_target - 閘門狀態只能由專屬操作進入")
        void should_refuse_gated_target() {
            OrderView order = acceptedOrder();

            assertThatThrownBy(() -> orderIntake.changeStatus(order.orderId(), ADMIN,
                    OrderStatus.ACCEPTED, OrderStatus.PAYMENT_VERIFIED, "skip the gate"))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("dedicated operation");
            assertThat(orderIntake.getOrder(order.orderId()).workCode()).isNull();
        }

        @Test
        @DisplayName("should_cancel_and_then_treat_order_as_closed - 取消後訂單關閉")
        void should_cancel_and_then_treat_order_as_closed() {
            // Given
            OrderView order = newQuery();

            // When
            OrderView cancelled = orderIntake.changeStatus(order.orderId(), ADMIN,
                    OrderStatus.PENDING_QUERY, OrderStatus.CANCELLED, "Client withdrew");

            // Then
            assertThat(cancelled.status()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(cancelled.statusCode()).isEqualTo(45);
            assertThatThrownBy(() -> orderIntake.changeStatus(order.orderId(), ADMIN,
                    OrderStatus.PENDING_QUERY, OrderStatus.QUOTATION_SENT, null))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("refresh");
            assertThatThrownBy(() -> orderIntake.changeStatus(order.orderId(), ADMIN,
                    OrderStatus.CANCELLED, OrderStatus.PENDING_QUERY, null))
                    .isInstanceOf(OrderClosedException.class)
                    .hasMessage("Order already closed in status CANCELLED (45). Cannot be modified.");
        }

        @Test
        @DisplayName("should_let_only_admin_reject_query - 只有管理員可駁回需求")
        void should_let_only_admin_reject_query() {
            OrderView order = newQuery();

            assertThatThrownBy(() -> orderIntake.changeStatus(order.orderId(), BDE,
                    OrderStatus.PENDING_QUERY, OrderStatus.QUERY_REJECTED, null))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("BDE cannot move order from PENDING_QUERY (26) to QUERY_REJECTED (38)");

            OrderView rejected = orderIntake.changeStatus(order.orderId(), ADMIN,
                    OrderStatus.PENDING_QUERY, OrderStatus.QUERY_REJECTED, "Out of scope");
            assertThat(rejected.status()).isEqualTo(OrderStatus.QUERY_REJECTED);
        }

        @Test
        @DisplayName("should_answer_transition_lookup - 查詢角色可否轉換")
        void should_answer_transition_lookup() {
            assertThat(orderIntake.canTransition(Role.CLIENT,
                    OrderStatus.QUOTATION_SENT, OrderStatus.ACCEPTED)).isTrue();
            assertThat(orderIntake.canTransition(Role.WRITER,
                    OrderStatus.PENDING_QC, OrderStatus.APPROVED)).isFalse();
        }
    }

    @Test
    @DisplayName("should_run_full_workflow_with_one_audit_entry_per_step - 完整流程")
    void should_run_full_workflow_with_one_audit_entry_per_step() {
        // Given: 需求、報價、接受
        OrderView order = acceptedOrder();

        // When: 付款並驗證
        PaymentView payment = submittedPayment(order.orderId());
        String workCode = payments.verifyPayment(payment.paymentId(), ADMIN, 100).workCode();

        // And: 招募並開工
        recruitment.invite(order.orderId(), ADMIN, List.of(WRITER, WRITER_2));
        recruitment.showInterest(order.orderId(), WRITER, "Available");
        recruitment.assign(order.orderId(), ADMIN, WRITER, null);
        recruitment.evaluateTask(order.orderId(), WRITER, true, null);

        // And: 交稿、審核、交付、結案
        SubmissionView submission = submitted(order.orderId(), WRITER);
        qualityControl.approveSubmission(submission.submissionId(), ADMIN, null);
        qualityControl.deliverOrder(order.orderId(), ADMIN, "Sent by email");
        OrderView completed = qualityControl.completeOrder(order.orderId(), ADMIN);

        // Then
        assertThat(completed.status()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(completed.workCode()).isEqualTo(workCode);
        assertThat(completed.assignedWriterId()).isEqualTo(WRITER);
        assertThat(interestRepository.findByOrderIdAndWriterId(order.orderId(), WRITER_2))
                .get().extracting(WriterInterestEntity::getState).isEqualTo(WriterInterestState.INVITED);
        assertThat(auditLogRepository.findByOrderIdOrderByOccurredAtAsc(order.orderId()))
                .extracting(AuditLogEntry::getEventType)
                .containsExactlyInAnyOrder(
                        "QUERY_CREATED", "QUOTATION_SENT", "QUOTATION_ACCEPTED",
                        "PAYMENT_SUBMITTED", "PAYMENT_VERIFIED",
                        "WRITERS_INVITED", "WRITER_INTERESTED", "WRITER_ASSIGNED", "TASK_ACCEPTED",
                        "WORK_SUBMITTED", "SUBMISSION_APPROVED", "ORDER_DELIVERED", "ORDER_COMPLETED");
        assertThat(outboxRepository.findByStatus(OutboxEventStatus.FAILED)).isEmpty();
    }
}
