package com.example.orderdesk.integration;

import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.SubmissionView;
import com.example.orderdesk.application.dto.SubmitWorkCommand;
import com.example.orderdesk.domain.exception.InvalidTransitionException;
import com.example.orderdesk.domain.exception.OrderClosedException;
import com.example.orderdesk.domain.exception.ValidationException;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.SubmissionState;
import com.example.orderdesk.infrastructure.persistence.entity.NotificationEntity;
import com.example.orderdesk.support.WorkflowTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * QC and delivery pipeline.
 *
 * BDD Scenarios:
 * - Given 寫手已交稿, When 管理員要求修改, Then 寫手重新交稿且序號遞增
 * - Given 舊版稿件已被取代, When 審核舊稿, Then 拒絕
 * - Given 訂單已結案, When 寫手再交稿, Then 回報訂單已關閉
 */
@ActiveProfiles("test")
@DisplayName("品質審核與交付 - QC/Delivery Integration Tests")
class QualityControlIntegrationTest extends WorkflowTestSupport {

    @Test
    @DisplayName("should_move_order_to_pending_qc_on_submission - 交稿進入待審")
    void should_move_order_to_pending_qc_on_submission() {
        // Given
        OrderView order = inProgressOrder(WRITER);

        // When
        SubmissionView submission = submitted(order.orderId(), WRITER);

        // Then
        assertThat(submission.sequenceNumber()).isEqualTo(1);
        assertThat(submission.state()).isEqualTo(SubmissionState.PENDING_QC);
        assertThat(submission.revisionNumber()).isZero();
        assertThat(orderIntake.getOrder(order.orderId()).status()).isEqualTo(OrderStatus.PENDING_QC);
    }

    @Test
    @DisplayName("should_allow_submission_straight_from_writer_assigned - 指派後可直接交稿")
    void should_allow_submission_straight_from_writer_assigned() {
        OrderView order = assignedOrder(WRITER);

        submitted(order.orderId(), WRITER);

        assertThat(orderIntake.getOrder(order.orderId()).status()).isEqualTo(OrderStatus.PENDING_QC);
    }

    @Test
    @DisplayName("should_only_accept_work_from_assignee - 只有指派寫手可交稿")
    void should_only_accept_work_from_assignee() {
        OrderView order = inProgressOrder(WRITER);

        assertThatThrownBy(() -> submitted(order.orderId(), WRITER_2))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("Only the writer assigned");
        assertThat(qualityControl.submissions(order.orderId())).isEmpty();
    }

    @Test
    @DisplayName("should_refuse_second_submission_while_one_awaits_qc - 待審中不可再交稿")
    void should_refuse_second_submission_while_one_awaits_qc() {
        OrderView order = inProgressOrder(WRITER);
        submitted(order.orderId(), WRITER);

        assertThatThrownBy(() -> submitted(order.orderId(), WRITER))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("still awaiting QC");
    }

    @Test
    @DisplayName("should_run_revision_loop_until_completion - 修改循環直到結案")
    void should_run_revision_loop_until_completion() {
        // Given
        OrderView order = inProgressOrder(WRITER);
        SubmissionView first = submitted(order.orderId(), WRITER);

        // When: 要求修改
        SubmissionView revised = qualityControl.requestRevision(first.submissionId(), ADMIN, "Add citations");

        // Then
        assertThat(revised.state()).isEqualTo(SubmissionState.REVISION_REQUIRED);
        assertThat(revised.revisionNumber()).isEqualTo(1);
        assertThat(revised.feedback()).isEqualTo("Add citations");
        OrderView inRevision = orderIntake.getOrder(order.orderId());
        assertThat(inRevision.status()).isEqualTo(OrderStatus.REVISION_REQUIRED);
        assertThat(inRevision.assignedWriterId()).isEqualTo(WRITER);
        assertThat(inRevision.workCode()).isEqualTo(order.workCode());

        // When: 重新交稿
        SubmissionView second = qualityControl.submitWork(
                new SubmitWorkCommand(order.orderId(), WRITER, "files/final.docx", "With citations"));

        // Then
        assertThat(second.sequenceNumber()).isEqualTo(2);
        assertThat(second.revisionNumber()).isEqualTo(1);
        assertThat(qualityControl.latestSubmission(order.orderId()))
                .get().extracting(SubmissionView::submissionId).isEqualTo(second.submissionId());

        // When: 審核通過、交付、結案
        qualityControl.approveSubmission(second.submissionId(), ADMIN, "Good");
        OrderView delivered = qualityControl.deliverOrder(order.orderId(), ADMIN, null);
        OrderView completed = qualityControl.completeOrder(order.orderId(), ADMIN);

        // Then
        assertThat(delivered.status()).isEqualTo(OrderStatus.DELIVERED);
        assertThat(completed.status()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(qualityControl.submissions(order.orderId()))
                .extracting(SubmissionView::state)
                .containsExactly(SubmissionState.REVISION_REQUIRED, SubmissionState.COMPLETED);
    }

    @Test
    @DisplayName("should_refuse_review_of_superseded_submission - 舊稿不可審核")
    void should_refuse_review_of_superseded_submission() {
        OrderView order = inProgressOrder(WRITER);
        SubmissionView first = submitted(order.orderId(), WRITER);
        qualityControl.requestRevision(first.submissionId(), ADMIN, "Tighten the argument");
        submitted(order.orderId(), WRITER);

        assertThatThrownBy(() -> qualityControl.approveSubmission(first.submissionId(), ADMIN, null))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("superseded");
    }

    @Test
    @DisplayName("should_require_feedback_for_revision - 要求修改需附意見")
    void should_require_feedback_for_revision() {
        OrderView order = inProgressOrder(WRITER);
        SubmissionView submission = submitted(order.orderId(), WRITER);

        assertThatThrownBy(() -> qualityControl.requestRevision(submission.submissionId(), ADMIN, ""))
                .isInstanceOf(ValidationException.class);
        assertThat(orderIntake.getOrder(order.orderId()).status()).isEqualTo(OrderStatus.PENDING_QC);
    }

    @Test
    @DisplayName("should_allow_revision_after_approval - 審核通過後仍可要求修改")
    void should_allow_revision_after_approval() {
        OrderView order = approvedOrder(WRITER);
        SubmissionView latest = qualityControl.latestSubmission(order.orderId()).orElseThrow();

        SubmissionView revised = qualityControl.requestRevision(latest.submissionId(), ADMIN, "Client asked for more");

        assertThat(revised.state()).isEqualTo(SubmissionState.REVISION_REQUIRED);
        assertThat(orderIntake.getOrder(order.orderId()).status()).isEqualTo(OrderStatus.REVISION_REQUIRED);
    }

    @Test
    @DisplayName("should_require_approved_submission_to_deliver_or_complete - 交付與結案需審核通過")
    void should_require_approved_submission_to_deliver_or_complete() {
        OrderView order = inProgressOrder(WRITER);
        submitted(order.orderId(), WRITER);

        assertThatThrownBy(() -> qualityControl.deliverOrder(order.orderId(), ADMIN, null))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("APPROVED submission is required");
        assertThatThrownBy(() -> qualityControl.completeOrder(order.orderId(), ADMIN))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("should_complete_directly_from_approved - 審核通過可直接結案")
    void should_complete_directly_from_approved() {
        OrderView order = approvedOrder(WRITER);

        OrderView completed = qualityControl.completeOrder(order.orderId(), ADMIN);

        assertThat(completed.status()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(notificationRepository.findByOrderIdOrderByCreatedAtAsc(order.orderId()))
                .filteredOn(n -> "Order Completed".equals(n.getTitle()))
                .extracting(NotificationEntity::getRecipientId)
                .containsExactlyInAnyOrder(CLIENT, WRITER, BDE);
    }

    @Test
    @DisplayName("should_freeze_order_after_completion - 結案後不可再變更")
    void should_freeze_order_after_completion() {
        OrderView order = approvedOrder(WRITER);
        qualityControl.completeOrder(order.orderId(), ADMIN);

        assertThatThrownBy(() -> submitted(order.orderId(), WRITER))
                .isInstanceOf(OrderClosedException.class);
        assertThatThrownBy(() -> qualityControl.completeOrder(order.orderId(), ADMIN))
                .isInstanceOf(OrderClosedException.class);
        assertThatThrownBy(() -> recruitment.revoke(order.orderId(), ADMIN, null))
                .isInstanceOf(OrderClosedException.class);
    }

    @Test
    @DisplayName("should_notify_writer_of_approval - 審核通過通知寫手")
    void should_notify_writer_of_approval() {
        OrderView order = approvedOrder(WRITER);

        assertThat(notificationRepository.findByRecipientIdOrderByCreatedAtDesc(WRITER))
                .filteredOn(n -> order.orderId().equals(n.getOrderId()))
                .extracting(NotificationEntity::getTitle)
                .contains("Order Assigned", "Submission Approved");
    }
}
