package com.example.orderdesk.infrastructure.persistence;

import com.example.orderdesk.application.dto.PaymentView;
import com.example.orderdesk.application.dto.TransactionOutcome;
import com.example.orderdesk.application.dto.WorkflowEvent;
import com.example.orderdesk.domain.exception.ConcurrentOrderUpdateException;
import com.example.orderdesk.domain.exception.ConflictException;
import com.example.orderdesk.domain.exception.InvalidTransitionException;
import com.example.orderdesk.domain.exception.NotFoundException;
import com.example.orderdesk.domain.exception.OrderClosedException;
import com.example.orderdesk.domain.exception.ValidationException;
import com.example.orderdesk.domain.exception.WorkCodeCollisionException;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.Money;
import com.example.orderdesk.domain.model.NotificationSeverity;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.PaymentState;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.persistence.entity.OrderEntity;
import com.example.orderdesk.infrastructure.persistence.entity.PaymentEntity;
import com.example.orderdesk.infrastructure.persistence.mapper.WorkflowViewMapper;
import com.example.orderdesk.infrastructure.persistence.repository.OrderJpaRepository;
import com.example.orderdesk.infrastructure.persistence.repository.PaymentRepository;
import com.example.orderdesk.infrastructure.service.ReferenceCodeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Payment verification gate. The work code is minted exactly once, when a payment is
 * first verified at 100%.
 */
@Service
public class PaymentPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(PaymentPersistenceService.class);

    static final int FULL_PAYMENT = 100;

    private static final Set<OrderStatus> PAYABLE = EnumSet.of(
            OrderStatus.QUOTATION_SENT, OrderStatus.ACCEPTED, OrderStatus.AWAITING_VERIFICATION);

    private final PaymentRepository paymentRepository;
    private final OrderJpaRepository orderRepository;
    private final OrderStore orderStore;
    private final OutboxWriter outboxWriter;
    private final WorkflowViewMapper mapper;
    private final ReferenceCodeGenerator codeGenerator;

    public PaymentPersistenceService(
            PaymentRepository paymentRepository,
            OrderJpaRepository orderRepository,
            OrderStore orderStore,
            OutboxWriter outboxWriter,
            WorkflowViewMapper mapper,
            ReferenceCodeGenerator codeGenerator) {
        this.paymentRepository = paymentRepository;
        this.orderRepository = orderRepository;
        this.orderStore = orderStore;
        this.outboxWriter = outboxWriter;
        this.mapper = mapper;
        this.codeGenerator = codeGenerator;
    }

    /**
     * Records a client payment awaiting verification. Moves an ACCEPTED order to
     * AWAITING_VERIFICATION.
     */
    @Transactional
    public TransactionOutcome<PaymentView> submit(String orderId, Actor payer, BigDecimal amount, String receipt) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Payment amount must be positive");
        }
        OrderEntity order = orderStore.load(orderId);
        orderStore.requireOwner(order, payer);
        OrderStatus from = order.getStatus();
        if (!PAYABLE.contains(from)) {
            throw new InvalidTransitionException("Payments cannot be recorded for an order in " + from.describe());
        }
        OrderStatus to = from;
        if (from == OrderStatus.ACCEPTED) {
            orderStore.moveTo(order, payer.role(), OrderStatus.AWAITING_VERIFICATION);
            orderStore.save(order);
            to = OrderStatus.AWAITING_VERIFICATION;
        }

        PaymentEntity payment = new PaymentEntity();
        payment.setId(UUID.randomUUID().toString());
        payment.setOrderId(orderId);
        payment.setPayerId(payer.id());
        payment.setAmount(Money.of(amount).getAmount());
        payment.setState(PaymentState.PENDING);
        payment.setReceiptReference(receipt);
        paymentRepository.saveAndFlush(payment);

        String message = "Payment of " + Money.of(amount) + " received for " + order.getQueryCode();
        WorkflowEvent event = WorkflowEvent.builder("PAYMENT_SUBMITTED", payer)
                .order(orderId)
                .resource("PAYMENT", payment.getId())
                .transition(from, to)
                .detail("amount", payment.getAmount())
                .notifyRole(Role.ADMIN, NotificationSeverity.INFO, "Payment Awaiting Verification", message)
                .build();
        return TransactionOutcome.of(mapper.toView(payment, order.getWorkCode()), outboxWriter.append(event));
    }

    /**
     * Verifies a payment at the given percentage. Re-verifying at the same or a lower
     * percentage changes nothing.
     *
     * @throws WorkCodeCollisionException if the minted work code is already taken
     * @throws ConcurrentOrderUpdateException if the order changed underneath this verification
     */
    @Transactional
    public TransactionOutcome<PaymentView> verify(String paymentId, Actor admin, int percentage) {
        if (percentage < 1 || percentage > FULL_PAYMENT) {
            throw new ValidationException("Verified percentage must be between 1 and 100, got " + percentage);
        }
        PaymentEntity payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new NotFoundException("Payment", paymentId));
        OrderEntity order = orderStore.load(payment.getOrderId());

        if (payment.getState() == PaymentState.REJECTED) {
            throw new ConflictException("Payment " + paymentId + " was rejected and cannot be verified");
        }
        if (payment.getState() == PaymentState.VERIFIED && payment.getVerifiedPercentage() != null
                && payment.getVerifiedPercentage() >= percentage) {
            log.debug("Payment {} already verified at {}%", paymentId, payment.getVerifiedPercentage());
            return TransactionOutcome.unchanged(mapper.toView(payment, order.getWorkCode()));
        }

        OrderStatus from = order.getStatus();
        OrderStatus to = from;
        String mintedCode = null;
        if (percentage == FULL_PAYMENT && order.getWorkCode() == null) {
            orderStore.moveTo(order, admin.role(), OrderStatus.PAYMENT_VERIFIED);
            mintedCode = codeGenerator.nextWorkCode();
            order.setWorkCode(mintedCode);
            to = OrderStatus.PAYMENT_VERIFIED;
        } else if (order.getStatus().isClosed()) {
            throw new OrderClosedException(from);
        }
        payment.markVerified(admin.id(), percentage);

        try {
            orderRepository.saveAndFlush(order);
            paymentRepository.saveAndFlush(payment);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrentOrderUpdateException(order.getId(), e);
        } catch (DataIntegrityViolationException e) {
            throw new WorkCodeCollisionException(mintedCode, e);
        }

        String message = mintedCode != null
                ? "Payment verified for " + order.getQueryCode() + ". Work code " + mintedCode + " issued"
                : "Payment for " + order.getQueryCode() + " verified at " + percentage + "%";
        WorkflowEvent event = WorkflowEvent.builder("PAYMENT_VERIFIED", admin)
                .order(order.getId())
                .resource("PAYMENT", paymentId)
                .transition(from, to)
                .detail("percentage", percentage)
                .detail("workCode", mintedCode)
                .notify(payment.getPayerId(), NotificationSeverity.SUCCESS, "Payment Verified", message)
                .notify(order.getBdeId(), NotificationSeverity.INFO, "Payment Verified", message)
                .notifyRole(Role.ADMIN, NotificationSeverity.INFO, "Payment Verified", message)
                .build();
        if (mintedCode != null) {
            log.info("Issued work code {} for order {}", mintedCode, order.getId());
        }
        return TransactionOutcome.of(mapper.toView(payment, order.getWorkCode()), outboxWriter.append(event));
    }

    @Transactional
    public TransactionOutcome<PaymentView> reject(String paymentId, Actor admin, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A rejection reason is required");
        }
        PaymentEntity payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new NotFoundException("Payment", paymentId));
        if (payment.getState() != PaymentState.PENDING) {
            throw new ConflictException("Payment " + paymentId + " is already " + payment.getState());
        }
        OrderEntity order = orderStore.load(payment.getOrderId());
        payment.markRejected(admin.id(), reason.trim());
        try {
            paymentRepository.saveAndFlush(payment);
        } catch (OptimisticLockingFailureException e) {
            throw new ConflictException("Payment " + paymentId + " was reviewed concurrently");
        }

        WorkflowEvent event = WorkflowEvent.builder("PAYMENT_REJECTED", admin)
                .order(order.getId())
                .resource("PAYMENT", paymentId)
                .detail("reason", payment.getRejectionReason())
                .notify(payment.getPayerId(), NotificationSeverity.WARNING, "Payment Rejected",
                        "Payment for " + order.getQueryCode() + " was rejected: " + payment.getRejectionReason())
                .build();
        return TransactionOutcome.of(mapper.toView(payment, order.getWorkCode()), outboxWriter.append(event));
    }

    @Transactional(readOnly = true)
    public List<PaymentView> payments(String orderId) {
        OrderEntity order = orderStore.load(orderId);
        return paymentRepository.findByOrderIdOrderByCreatedAtAsc(orderId).stream()
                .map(payment -> mapper.toView(payment, order.getWorkCode()))
                .toList();
    }
}
