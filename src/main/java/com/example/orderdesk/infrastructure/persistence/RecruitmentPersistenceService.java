package com.example.orderdesk.infrastructure.persistence;

import com.example.orderdesk.application.dto.InviteResult;
import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.TaskEvaluationView;
import com.example.orderdesk.application.dto.TransactionOutcome;
import com.example.orderdesk.application.dto.WorkflowEvent;
import com.example.orderdesk.application.dto.WriterInterestView;
import com.example.orderdesk.domain.exception.ConcurrentOrderUpdateException;
import com.example.orderdesk.domain.exception.ConflictException;
import com.example.orderdesk.domain.exception.DuplicateInterestException;
import com.example.orderdesk.domain.exception.InvalidTransitionException;
import com.example.orderdesk.domain.exception.NotFoundException;
import com.example.orderdesk.domain.exception.ValidationException;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.NotificationSeverity;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.domain.model.TaskEvaluationState;
import com.example.orderdesk.domain.model.WriterInterestState;
import com.example.orderdesk.infrastructure.persistence.entity.OrderEntity;
import com.example.orderdesk.infrastructure.persistence.entity.TaskEvaluationEntity;
import com.example.orderdesk.infrastructure.persistence.entity.WriterInterestEntity;
import com.example.orderdesk.infrastructure.persistence.mapper.WorkflowViewMapper;
import com.example.orderdesk.infrastructure.persistence.repository.TaskEvaluationRepository;
import com.example.orderdesk.infrastructure.persistence.repository.WriterInterestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Writer recruitment state machine over (order, writer) interest rows.
 * <p>
 * Invariant: at most one row per order is ASSIGNED, and it names the order's assigned writer.
 * Assign, revoke and reassign all rewrite the order row, so its version serializes them.
 */
@Service
public class RecruitmentPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(RecruitmentPersistenceService.class);

    private final WriterInterestRepository interestRepository;
    private final TaskEvaluationRepository evaluationRepository;
    private final OrderStore orderStore;
    private final OutboxWriter outboxWriter;
    private final WorkflowViewMapper mapper;

    public RecruitmentPersistenceService(
            WriterInterestRepository interestRepository,
            TaskEvaluationRepository evaluationRepository,
            OrderStore orderStore,
            OutboxWriter outboxWriter,
            WorkflowViewMapper mapper) {
        this.interestRepository = interestRepository;
        this.evaluationRepository = evaluationRepository;
        this.orderStore = orderStore;
        this.outboxWriter = outboxWriter;
        this.mapper = mapper;
    }

    /**
     * Invites writers. Already invited writers count as invited again and are re-notified;
     * writers holding a stronger stance are skipped.
     */
    @Transactional
    public TransactionOutcome<InviteResult> invite(String orderId, Actor admin, List<String> writerIds) {
        OrderEntity order = orderStore.loadOpen(orderId);
        List<String> invited = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (String writerId : new LinkedHashSet<>(writerIds)) {
            Optional<WriterInterestEntity> existing = interestRepository.findByOrderIdAndWriterId(orderId, writerId);
            if (existing.isEmpty()) {
                interestRepository.save(newInterest(orderId, writerId, WriterInterestState.INVITED, admin.id()));
                invited.add(writerId);
                continue;
            }
            WriterInterestEntity interest = existing.get();
            if (interest.getState() == WriterInterestState.INVITED) {
                invited.add(writerId);
            } else if (interest.getState().isReinvitable()) {
                interest.setState(WriterInterestState.INVITED);
                interest.setInvitedBy(admin.id());
                invited.add(writerId);
            } else {
                log.debug("Writer {} is {} on order {}, not re-inviting", writerId, interest.getState(), orderId);
                skipped.add(writerId);
            }
        }
        flushInterests(orderId, "Writer invitations changed concurrently on order " + orderId);

        InviteResult result = new InviteResult(orderId, List.copyOf(invited), List.copyOf(skipped));
        if (invited.isEmpty()) {
            return TransactionOutcome.unchanged(result);
        }
        WorkflowEvent event = WorkflowEvent.builder("WRITERS_INVITED", admin)
                .order(orderId)
                .detail("invited", result.invited())
                .detail("skipped", result.skipped())
                .notify(result.invited(), null, NotificationSeverity.INFO, "New Order Invitation",
                        "You are invited to work on " + reference(order) + ": " + order.getTopic())
                .build();
        return TransactionOutcome.of(result, outboxWriter.append(event));
    }

    /**
     * Records a writer's interest. A writer who was never invited gets an open-interest row.
     */
    @Transactional
    public TransactionOutcome<WriterInterestView> showInterest(String orderId, Actor writer, String comment) {
        OrderEntity order = orderStore.loadOpen(orderId);
        WriterInterestEntity interest = interestRepository.findByOrderIdAndWriterId(orderId, writer.id())
                .orElse(null);
        WriterInterestState before = interest != null ? interest.getState() : null;

        if (interest == null) {
            interest = newInterest(orderId, writer.id(), WriterInterestState.INTERESTED, null);
        } else if (before.isAssignable()) {
            throw new DuplicateInterestException(orderId, writer.id());
        } else if (before != WriterInterestState.INVITED) {
            throw new InvalidTransitionException("Writer " + writer.id() + " is " + before
                    + " on order " + orderId + "; interest can only follow an invitation");
        }
        interest.setState(WriterInterestState.INTERESTED);
        interest.setComment(comment);
        try {
            interestRepository.saveAndFlush(interest);
        } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
            throw new DuplicateInterestException(orderId, writer.id());
        }

        WorkflowEvent event = WorkflowEvent.builder("WRITER_INTERESTED", writer)
                .order(orderId)
                .resource("WRITER_INTEREST", interest.getId())
                .detail("previousState", before)
                .detail("comment", comment)
                .notifyRole(Role.ADMIN, NotificationSeverity.INFO, "Writer Interested",
                        "Writer " + writer.id() + " is interested in " + reference(order))
                .build();
        return TransactionOutcome.of(mapper.toView(interest), outboxWriter.append(event));
    }

    @Transactional
    public TransactionOutcome<WriterInterestView> decline(String orderId, Actor writer, String reason) {
        OrderEntity order = orderStore.loadOpen(orderId);
        WriterInterestEntity interest = interestRepository.findByOrderIdAndWriterId(orderId, writer.id())
                .orElseThrow(() -> new NotFoundException("Invitation", orderId + "/" + writer.id()));
        if (interest.getState() != WriterInterestState.INVITED) {
            throw new InvalidTransitionException("Only an open invitation can be declined; writer "
                    + writer.id() + " is " + interest.getState() + " on order " + orderId);
        }
        interest.setState(WriterInterestState.REJECTED);
        interest.setComment(reason);
        flushInterests(orderId, "Invitation for writer " + writer.id() + " changed concurrently");

        WorkflowEvent event = WorkflowEvent.builder("WRITER_DECLINED", writer)
                .order(orderId)
                .resource("WRITER_INTEREST", interest.getId())
                .detail("reason", reason)
                .notifyRole(Role.ADMIN, NotificationSeverity.WARNING, "Invitation Declined",
                        "Writer " + writer.id() + " declined " + reference(order)
                                + (reason != null && !reason.isBlank() ? ": " + reason : ""))
                .build();
        return TransactionOutcome.of(mapper.toView(interest), outboxWriter.append(event));
    }

    /**
     * Assigns an interested writer. Any writer assigned before is released in the same transaction.
     *
     * @param expectedVersion the order version the admin decided on, or null
     */
    @Transactional
    public TransactionOutcome<OrderView> assign(String orderId, Actor admin, String writerId, Long expectedVersion) {
        OrderEntity order = orderStore.loadOpen(orderId);
        requireVersion(order, expectedVersion);
        OrderStatus from = order.getStatus();

        List<String> displaced = assignWriter(order, admin, writerId);
        flushAssignment(order);

        WorkflowEvent.Builder event = WorkflowEvent.builder("WRITER_ASSIGNED", admin)
                .order(orderId)
                .transition(from, order.getStatus())
                .detail("writerId", writerId)
                .detail("releasedWriters", displaced.isEmpty() ? null : displaced);
        notifyAssignment(event, order, writerId, displaced, "Another writer was selected for " + reference(order));
        log.debug("Order {} assigned to {}, released {}", orderId, writerId, displaced);
        return TransactionOutcome.of(mapper.toView(order), outboxWriter.append(event.build()));
    }

    /**
     * Takes the order away from its writer and sends it back to PAYMENT_VERIFIED.
     */
    @Transactional
    public TransactionOutcome<OrderView> revoke(String orderId, Actor admin, String reason) {
        OrderEntity order = orderStore.loadOpen(orderId);
        OrderStatus from = order.getStatus();
        String revoked = revokeWriter(order, admin);
        flushAssignment(order);

        String message = "Your assignment on " + reference(order) + " was revoked"
                + (reason != null && !reason.isBlank() ? ": " + reason : "");
        WorkflowEvent event = WorkflowEvent.builder("WRITER_REVOKED", admin)
                .order(orderId)
                .transition(from, order.getStatus())
                .detail("writerId", revoked)
                .detail("reason", reason)
                .notify(revoked, NotificationSeverity.WARNING, "Assignment Revoked", message)
                .notify(order.getClientId(), NotificationSeverity.INFO, "Writer Changed",
                        "The writer on " + reference(order) + " was withdrawn; a new writer will be assigned")
                .build();
        return TransactionOutcome.of(mapper.toView(order), outboxWriter.append(event));
    }

    /**
     * Revoke followed by assign, committed and audited as one admin action.
     */
    @Transactional
    public TransactionOutcome<OrderView> reassign(String orderId, Actor admin, String newWriterId, String reason) {
        OrderEntity order = orderStore.loadOpen(orderId);
        if (newWriterId.equals(order.getAssignedWriterId())) {
            throw new ValidationException("Writer " + newWriterId + " already holds order " + orderId);
        }
        OrderStatus from = order.getStatus();
        String previous = revokeWriter(order, admin);
        flushAssignment(order);
        List<String> displaced = new ArrayList<>(assignWriter(order, admin, newWriterId));
        displaced.add(0, previous);
        flushAssignment(order);

        WorkflowEvent.Builder event = WorkflowEvent.builder("WRITER_REASSIGNED", admin)
                .order(orderId)
                .transition(from, order.getStatus())
                .detail("previousWriterId", previous)
                .detail("writerId", newWriterId)
                .detail("reason", reason);
        notifyAssignment(event, order, newWriterId, displaced, "You have been replaced on " + reference(order)
                + (reason != null && !reason.isBlank() ? ": " + reason : ""));
        return TransactionOutcome.of(mapper.toView(order), outboxWriter.append(event.build()));
    }

    /**
     * The assignee's one-time feasibility verdict on the work.
     */
    @Transactional
    public TransactionOutcome<TaskEvaluationView> evaluateTask(String orderId, Actor writer, boolean doable,
                                                               String comment) {
        OrderEntity order = orderStore.loadOpen(orderId);
        orderStore.requireAssignee(order, writer);
        TaskEvaluationEntity evaluation = evaluationRepository.findByOrderIdAndWriterId(orderId, writer.id())
                .orElseThrow(() -> new NotFoundException("TaskEvaluation", orderId + "/" + writer.id()));
        if (evaluation.getState() != TaskEvaluationState.PENDING) {
            throw new InvalidTransitionException("Task on order " + orderId + " was already evaluated as "
                    + evaluation.getState());
        }
        if (!doable && (comment == null || comment.isBlank())) {
            throw new ValidationException("A comment is required when the task is not doable");
        }

        OrderStatus from = order.getStatus();
        evaluation.setState(doable ? TaskEvaluationState.DOABLE : TaskEvaluationState.NOT_DOABLE);
        evaluation.setComment(comment);
        if (doable && from == OrderStatus.WRITER_ASSIGNED) {
            orderStore.moveTo(order, writer.role(), OrderStatus.IN_PROGRESS);
        }
        orderStore.save(order);

        WorkflowEvent.Builder event = WorkflowEvent.builder(doable ? "TASK_ACCEPTED" : "TASK_DECLINED", writer)
                .order(orderId)
                .resource("TASK_EVALUATION", evaluation.getId())
                .transition(from, order.getStatus())
                .detail("comment", comment);
        if (doable) {
            event.notifyRole(Role.ADMIN, NotificationSeverity.SUCCESS, "Work Started",
                    "Writer " + writer.id() + " started " + reference(order));
        } else {
            event.notifyRole(Role.ADMIN, NotificationSeverity.CRITICAL, "Writer Cannot Do Task",
                    "Writer " + writer.id() + " marked " + reference(order) + " not doable: " + comment);
        }
        return TransactionOutcome.of(mapper.toView(evaluation), outboxWriter.append(event.build()));
    }

    @Transactional(readOnly = true)
    public Optional<String> currentAssignee(String orderId) {
        return Optional.ofNullable(orderStore.load(orderId).getAssignedWriterId());
    }

    @Transactional(readOnly = true)
    public List<WriterInterestView> interests(String orderId) {
        orderStore.load(orderId);
        return interestRepository.findByOrderIdOrderByCreatedAtAsc(orderId).stream()
                .map(mapper::toView)
                .toList();
    }

    /**
     * Reads every row the assignment touches before changing any of them, so no query
     * auto-flushes a half-applied assignment outside {@link #flushAssignment(OrderEntity)}.
     */
    private List<String> assignWriter(OrderEntity order, Actor admin, String writerId) {
        String orderId = order.getId();
        WriterInterestEntity candidate = interestRepository.findByOrderIdAndWriterId(orderId, writerId)
                .orElseThrow(() -> new InvalidTransitionException("Writer " + writerId
                        + " has not shown interest in order " + orderId + "; required state: INTERESTED"));
        if (candidate.getState() == WriterInterestState.ASSIGNED) {
            throw new InvalidTransitionException("Writer " + writerId + " is already assigned to order " + orderId);
        }
        if (!candidate.getState().isAssignable()) {
            throw new InvalidTransitionException("Writer " + writerId + " is " + candidate.getState()
                    + " on order " + orderId + "; required state: INTERESTED or ACCEPTED");
        }
        List<WriterInterestEntity> holders =
                interestRepository.findByOrderIdAndState(orderId, WriterInterestState.ASSIGNED);
        Map<String, TaskEvaluationEntity> evaluations = evaluationsByWriter(orderId);

        orderStore.moveTo(order, admin.role(), OrderStatus.WRITER_ASSIGNED);
        List<String> displaced = new ArrayList<>();
        for (WriterInterestEntity holder : holders) {
            holder.setState(WriterInterestState.RELEASED);
            release(evaluations.get(holder.getWriterId()));
            displaced.add(holder.getWriterId());
        }
        candidate.setState(WriterInterestState.ASSIGNED);
        order.setAssignedWriterId(writerId);

        TaskEvaluationEntity evaluation = evaluations.get(writerId);
        if (evaluation == null) {
            evaluation = new TaskEvaluationEntity();
            evaluation.setId(UUID.randomUUID().toString());
            evaluation.setOrderId(orderId);
            evaluation.setWriterId(writerId);
        }
        evaluation.setState(TaskEvaluationState.PENDING);
        evaluation.setComment(null);
        evaluationRepository.save(evaluation);
        return displaced;
    }

    private String revokeWriter(OrderEntity order, Actor admin) {
        String writerId = order.getAssignedWriterId();
        if (writerId == null) {
            throw new InvalidTransitionException("Order " + order.getId() + " has no assigned writer to revoke");
        }
        List<WriterInterestEntity> holders =
                interestRepository.findByOrderIdAndState(order.getId(), WriterInterestState.ASSIGNED);
        Map<String, TaskEvaluationEntity> evaluations = evaluationsByWriter(order.getId());

        orderStore.moveTo(order, admin.role(), OrderStatus.PAYMENT_VERIFIED);
        for (WriterInterestEntity holder : holders) {
            holder.setState(holder.getWriterId().equals(writerId)
                    ? WriterInterestState.REVOKED : WriterInterestState.RELEASED);
            release(evaluations.get(holder.getWriterId()));
        }
        order.setAssignedWriterId(null);
        return writerId;
    }

    private Map<String, TaskEvaluationEntity> evaluationsByWriter(String orderId) {
        Map<String, TaskEvaluationEntity> byWriter = new HashMap<>();
        for (TaskEvaluationEntity evaluation : evaluationRepository.findByOrderId(orderId)) {
            byWriter.put(evaluation.getWriterId(), evaluation);
        }
        return byWriter;
    }

    private static void release(TaskEvaluationEntity evaluation) {
        if (evaluation != null) {
            evaluation.setState(TaskEvaluationState.RELEASED);
        }
    }

    /**
     * Writes the order, interest and evaluation rows of an assignment change in one flush.
     * A lost race on any of them, stale version or duplicate evaluation row, is a stale order.
     */
    private void flushAssignment(OrderEntity order) {
        try {
            interestRepository.flush();
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            log.warn("Assignment on order {} lost a race: {}", order.getId(), e.getMessage());
            throw ConcurrentOrderUpdateException.assignmentChanged(order.getId(), e);
        }
    }

    private void notifyAssignment(WorkflowEvent.Builder event, OrderEntity order, String writerId,
                                  List<String> displaced, String displacedMessage) {
        String work = reference(order);
        event.notify(writerId, NotificationSeverity.SUCCESS, "Order Assigned",
                        "You have been assigned " + work + ": " + order.getTopic())
                .notify(displaced, null, NotificationSeverity.WARNING, "Order Reassigned", displacedMessage)
                .notify(order.getClientId(), NotificationSeverity.INFO, "Writer Assigned",
                        "A writer is now working on " + work)
                .notifyRole(Role.ADMIN, NotificationSeverity.INFO, "Writer Assigned",
                        "Writer " + writerId + " assigned to " + work);
    }

    private void requireVersion(OrderEntity order, Long expectedVersion) {
        if (expectedVersion != null && !expectedVersion.equals(order.getVersion())) {
            throw new ConcurrentOrderUpdateException(order.getId(), expectedVersion,
                    order.getVersion() != null ? order.getVersion() : 0L);
        }
    }

    private void flushInterests(String orderId, String conflictMessage) {
        try {
            interestRepository.flush();
        } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
            log.warn("Writer interest write on order {} lost a race: {}", orderId, e.getMessage());
            throw new ConflictException(conflictMessage);
        }
    }

    private static WriterInterestEntity newInterest(String orderId, String writerId, WriterInterestState state,
                                                    String invitedBy) {
        WriterInterestEntity interest = new WriterInterestEntity();
        interest.setId(UUID.randomUUID().toString());
        interest.setOrderId(orderId);
        interest.setWriterId(writerId);
        interest.setState(state);
        interest.setInvitedBy(invitedBy);
        return interest;
    }

    private static String reference(OrderEntity order) {
        return order.getWorkCode() != null ? order.getWorkCode() : order.getQueryCode();
    }
}
