package com.example.orderdesk.support;

import com.example.orderdesk.application.dto.CreateQueryCommand;
import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.PaymentView;
import com.example.orderdesk.application.dto.QuoteCommand;
import com.example.orderdesk.application.dto.SubmissionView;
import com.example.orderdesk.application.dto.SubmitWorkCommand;
import com.example.orderdesk.application.port.in.OrderIntakeUseCase;
import com.example.orderdesk.application.port.in.PaymentVerificationUseCase;
import com.example.orderdesk.application.port.in.QualityControlUseCase;
import com.example.orderdesk.application.port.in.QuotationUseCase;
import com.example.orderdesk.application.port.in.WriterRecruitmentUseCase;
import com.example.orderdesk.infrastructure.persistence.repository.AuditLogRepository;
import com.example.orderdesk.infrastructure.persistence.repository.NotificationRepository;
import com.example.orderdesk.infrastructure.persistence.repository.OrderJpaRepository;
import com.example.orderdesk.infrastructure.persistence.repository.OutboxRepository;
import com.example.orderdesk.infrastructure.persistence.repository.TaskEvaluationRepository;
import com.example.orderdesk.infrastructure.persistence.repository.WriterInterestRepository;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Drives orders through the workflow up to a requested stage.
 */
public abstract class WorkflowTestSupport extends WireMockTestSupport {

    @Autowired
    protected OrderIntakeUseCase orderIntake;

    @Autowired
    protected QuotationUseCase quotations;

    @Autowired
    protected PaymentVerificationUseCase payments;

    @Autowired
    protected WriterRecruitmentUseCase recruitment;

    @Autowired
    protected QualityControlUseCase qualityControl;

    @Autowired
    protected OrderJpaRepository orderRepository;

    @Autowired
    protected AuditLogRepository auditLogRepository;

    @Autowired
    protected NotificationRepository notificationRepository;

    @Autowired
    protected OutboxRepository outboxRepository;

    @Autowired
    protected WriterInterestRepository interestRepository;

    @Autowired
    protected TaskEvaluationRepository evaluationRepository;

    protected OrderView newQuery() {
        return orderIntake.createQuery(new CreateQueryCommand(
                CLIENT,
                "Impact of monetary policy on housing markets",
                "Economics",
                "Essay",
                "STANDARD",
                "2000 words, APA",
                Instant.now().plus(10, ChronoUnit.DAYS),
                "files/brief.pdf",
                BDE));
    }

    protected OrderView quotedOrder() {
        OrderView order = newQuery();
        quotations.createOrUpdateQuotation(new QuoteCommand(order.orderId(), ADMIN,
                new BigDecimal("200.00"), new BigDecimal("25.00"), new BigDecimal("10.00"), BigDecimal.ZERO,
                null, "First quote"));
        return orderIntake.getOrder(order.orderId());
    }

    protected OrderView acceptedOrder() {
        OrderView order = quotedOrder();
        quotations.acceptQuotation(order.orderId(), CLIENT);
        return orderIntake.getOrder(order.orderId());
    }

    protected PaymentView submittedPayment(String orderId) {
        return payments.submitPayment(orderId, CLIENT, new BigDecimal("215.00"), "receipts/r-1.png");
    }

    protected OrderView paidOrder() {
        OrderView order = acceptedOrder();
        PaymentView payment = submittedPayment(order.orderId());
        payments.verifyPayment(payment.paymentId(), ADMIN, 100);
        return orderIntake.getOrder(order.orderId());
    }

    protected OrderView assignedOrder(String writerId) {
        OrderView order = paidOrder();
        recruitment.invite(order.orderId(), ADMIN, List.of(writerId));
        recruitment.showInterest(order.orderId(), writerId, "Happy to take it");
        return recruitment.assign(order.orderId(), ADMIN, writerId, null);
    }

    protected OrderView inProgressOrder(String writerId) {
        OrderView order = assignedOrder(writerId);
        recruitment.evaluateTask(order.orderId(), writerId, true, null);
        return orderIntake.getOrder(order.orderId());
    }

    protected SubmissionView submitted(String orderId, String writerId) {
        return qualityControl.submitWork(new SubmitWorkCommand(orderId, writerId, "files/draft.docx", "Draft"));
    }

    protected OrderView approvedOrder(String writerId) {
        OrderView order = inProgressOrder(writerId);
        SubmissionView submission = submitted(order.orderId(), writerId);
        qualityControl.approveSubmission(submission.submissionId(), ADMIN, "Looks good");
        return orderIntake.getOrder(order.orderId());
    }
}
