package com.example.orderdesk.infrastructure.persistence;

import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.SubmissionView;
import com.example.orderdesk.application.dto.SubmitWorkCommand;
import com.example.orderdesk.application.dto.TransactionOutcome;
import com.example.orderdesk.application.dto.WorkflowEvent;
import com.example.orderdesk.domain.exception.ConflictException;
import com.example.orderdesk.domain.exception.InvalidTransitionException;
import com.example.orderdesk.domain.exception.NotFoundException;
import com.example.orderdesk.domain.exception.ValidationException;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.NotificationSeverity;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.domain.model.SubmissionState;
import com.example.orderdesk.infrastructure.persistence.entity.OrderEntity;
import com.example.orderdesk.infrastructure.persistence.entity.SubmissionEntity;
import com.example.orderdesk.infrastructure.persistence.mapper.WorkflowViewMapper;
import com.example.orderdesk.infrastructure.persistence.repository.SubmissionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * QC and delivery. Only the latest submission of an order drives the order's status.
 */
@Service
public class QualityControlPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(QualityControlPersistenceService.class);

    private final SubmissionRepository submissionRepository;
    private final OrderStore orderStore;
    private final OutboxWriter outboxWriter;
    private final WorkflowViewMapper mapper;

    public QualityControlPersistenceService(
            SubmissionRepository submissionRepository,
            OrderStore orderStore,
            OutboxWriter outboxWriter,
            WorkflowViewMapper mapper) {
        this.submissionRepository = submissionRepository;
        this.orderStore = orderStore;
        this.outboxWriter = outboxWriter;
        this.mapper = mapper;
    }

    @Transactional
    public TransactionOutcome<SubmissionView> submitWork(SubmitWorkCommand command, Actor writer) {
        OrderEntity order = orderStore.loadOpen(command.orderId());
        orderStore.requireAssignee(order, writer);
        Optional<SubmissionEntity> latest = submissionRepository.findFirstByOrderIdOrderBySequenceNumberDesc(order.getId());
        if (latest.isPresent() && latest.get().getState() == SubmissionState.PENDING_QC) {
            throw new InvalidTransitionException("Submission " + latest.get().getSequenceNumber()
                    + " of order " + order.getId() + " is still awaiting QC");
        }
        OrderStatus from = orderStore.moveTo(order, writer.role(), OrderStatus.PENDING_QC);

        SubmissionEntity submission = new SubmissionEntity();
        submission.setId(UUID.randomUUID().toString());
        submission.setOrderId(order.getId());
        submission.setWriterId(writer.id());
        submission.setSequenceNumber(latest.map(SubmissionEntity::getSequenceNumber).orElse(0) + 1);
        submission.setFileReference(command.fileReference());
        submission.setNotes(command.notes());
        submission.setState(SubmissionState.PENDING_QC);
        submission.setRevisionNumber(latest.map(SubmissionEntity::getRevisionNumber).orElse(0));
        try {
            submissionRepository.saveAndFlush(submission);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Another submission for order " + order.getId() + " was recorded concurrently");
        }
        orderStore.save(order);

        WorkflowEvent event = WorkflowEvent.builder("WORK_SUBMITTED", writer)
                .order(order.getId())
                .resource("SUBMISSION", submission.getId())
                .transition(from, OrderStatus.PENDING_QC)
                .detail("sequence", submission.getSequenceNumber())
                .detail("fileReference", submission.getFileReference())
                .notifyRole(Role.ADMIN, NotificationSeverity.INFO, "Work Submitted",
                        "Submission " + submission.getSequenceNumber() + " for " + order.getWorkCode() + " awaits QC")
                .build();
        return TransactionOutcome.of(mapper.toView(submission), outboxWriter.append(event));
    }

    @Transactional
    public TransactionOutcome<SubmissionView> approve(String submissionId, Actor admin, String feedback) {
        SubmissionEntity submission = loadLatest(submissionId);
        OrderEntity order = orderStore.loadOpen(submission.getOrderId());
        if (submission.getState() != SubmissionState.PENDING_QC) {
            throw new InvalidTransitionException("Submission " + submissionId + " is " + submission.getState()
                    + "; only PENDING_QC submissions can be approved");
        }
        OrderStatus from = orderStore.moveTo(order, admin.role(), OrderStatus.APPROVED);
        submission.review(SubmissionState.APPROVED, admin.id(), feedback);
        saveReview(submission, order);

        WorkflowEvent event = WorkflowEvent.builder("SUBMISSION_APPROVED", admin)
                .order(order.getId())
                .resource("SUBMISSION", submissionId)
                .transition(from, OrderStatus.APPROVED)
                .detail("sequence", submission.getSequenceNumber())
                .detail("feedback", feedback)
                .notify(submission.getWriterId(), NotificationSeverity.SUCCESS, "Submission Approved",
                        "Your submission for " + order.getWorkCode() + " passed QC")
                .build();
        return TransactionOutcome.of(mapper.toView(submission), outboxWriter.append(event));
    }

    /**
     * Sends the latest submission back to the writer. Work code and assignment stay as they are.
     */
    @Transactional
    public TransactionOutcome<SubmissionView> requestRevision(String submissionId, Actor admin, String feedback) {
        if (feedback == null || feedback.isBlank()) {
            throw new ValidationException("Revision feedback is required");
        }
        SubmissionEntity submission = loadLatest(submissionId);
        OrderEntity order = orderStore.loadOpen(submission.getOrderId());
        if (submission.getState() != SubmissionState.PENDING_QC && submission.getState() != SubmissionState.APPROVED) {
            throw new InvalidTransitionException("Submission " + submissionId + " is " + submission.getState()
                    + "; revisions can be requested on PENDING_QC or APPROVED submissions");
        }
        OrderStatus from = orderStore.moveTo(order, admin.role(), OrderStatus.REVISION_REQUIRED);
        submission.review(SubmissionState.REVISION_REQUIRED, admin.id(), feedback.trim());
        submission.setRevisionNumber(submission.getRevisionNumber() + 1);
        saveReview(submission, order);

        WorkflowEvent event = WorkflowEvent.builder("REVISION_REQUESTED", admin)
                .order(order.getId())
                .resource("SUBMISSION", submissionId)
                .transition(from, OrderStatus.REVISION_REQUIRED)
                .detail("sequence", submission.getSequenceNumber())
                .detail("revision", submission.getRevisionNumber())
                .detail("feedback", submission.getFeedback())
                .notify(submission.getWriterId(), NotificationSeverity.WARNING, "Revision Required",
                        "Revision " + submission.getRevisionNumber() + " requested for " + order.getWorkCode()
                                + ": " + submission.getFeedback())
                .build();
        return TransactionOutcome.of(mapper.toView(submission), outboxWriter.append(event));
    }

    @Transactional
    public TransactionOutcome<OrderView> deliver(String orderId, Actor admin, String notes) {
        OrderEntity order = orderStore.loadOpen(orderId);
        requireApprovedLatest(orderId);
        OrderStatus from = orderStore.moveTo(order, admin.role(), OrderStatus.DELIVERED);
        orderStore.save(order);

        WorkflowEvent event = WorkflowEvent.builder("ORDER_DELIVERED", admin)
                .order(orderId)
                .transition(from, OrderStatus.DELIVERED)
                .detail("notes", notes)
                .notify(order.getClientId(), NotificationSeverity.SUCCESS, "Order Delivered",
                        "Your order " + order.getWorkCode() + " has been delivered")
                .notify(order.getAssignedWriterId(), NotificationSeverity.INFO, "Order Delivered",
                        "Order " + order.getWorkCode() + " was delivered to the client")
                .build();
        return TransactionOutcome.of(mapper.toView(order), outboxWriter.append(event));
    }

    /**
     * Terminal step from APPROVED or DELIVERED. The latest submission is marked completed.
     */
    @Transactional
    public TransactionOutcome<OrderView> complete(String orderId, Actor admin) {
        OrderEntity order = orderStore.load(orderId);
        OrderStatus from = orderStore.moveTo(order, admin.role(), OrderStatus.COMPLETED);
        SubmissionEntity latest = requireApprovedLatest(orderId);
        latest.setState(SubmissionState.COMPLETED);
        saveReview(latest, order);

        String message = "Order " + order.getWorkCode() + " is complete";
        WorkflowEvent event = WorkflowEvent.builder("ORDER_COMPLETED", admin)
                .order(orderId)
                .transition(from, OrderStatus.COMPLETED)
                .notify(order.getClientId(), NotificationSeverity.SUCCESS, "Order Completed", message)
                .notify(order.getAssignedWriterId(), NotificationSeverity.SUCCESS, "Order Completed", message)
                .notify(order.getBdeId(), NotificationSeverity.INFO, "Order Completed", message)
                .build();
        log.debug("Order {} closed from {}", orderId, from);
        return TransactionOutcome.of(mapper.toView(order), outboxWriter.append(event));
    }

    @Transactional(readOnly = true)
    public Optional<SubmissionView> latest(String orderId) {
        orderStore.load(orderId);
        return submissionRepository.findFirstByOrderIdOrderBySequenceNumberDesc(orderId).map(mapper::toView);
    }

    @Transactional(readOnly = true)
    public List<SubmissionView> submissions(String orderId) {
        orderStore.load(orderId);
        return submissionRepository.findByOrderIdOrderBySequenceNumberAsc(orderId).stream()
                .map(mapper::toView)
                .toList();
    }

    private SubmissionEntity loadLatest(String submissionId) {
        SubmissionEntity submission = submissionRepository.findById(submissionId)
                .orElseThrow(() -> new NotFoundException("Submission", submissionId));
        SubmissionEntity latest = submissionRepository
                .findFirstByOrderIdOrderBySequenceNumberDesc(submission.getOrderId())
                .orElseThrow(() -> new NotFoundException("Submission", submissionId));
        if (!latest.getId().equals(submission.getId())) {
            throw new InvalidTransitionException("Submission " + submissionId + " was superseded by submission "
                    + latest.getSequenceNumber() + "; only the latest submission can be reviewed");
        }
        return submission;
    }

    private SubmissionEntity requireApprovedLatest(String orderId) {
        SubmissionEntity latest = submissionRepository.findFirstByOrderIdOrderBySequenceNumberDesc(orderId)
                .orElseThrow(() -> new InvalidTransitionException("Order " + orderId + " has no submission"));
        if (latest.getState() != SubmissionState.APPROVED) {
            throw new InvalidTransitionException("Latest submission of order " + orderId + " is "
                    + latest.getState() + "; an APPROVED submission is required");
        }
        return latest;
    }

    private void saveReview(SubmissionEntity submission, OrderEntity order) {
        submissionRepository.save(submission);
        // flushes the submission too, so a concurrent review surfaces as a stale order
        orderStore.save(order);
    }
}
