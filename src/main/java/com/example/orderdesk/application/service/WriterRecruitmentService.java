package com.example.orderdesk.application.service;

import com.example.orderdesk.application.dto.InviteResult;
import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.TaskEvaluationView;
import com.example.orderdesk.application.dto.TransactionOutcome;
import com.example.orderdesk.application.dto.WriterInterestView;
import com.example.orderdesk.application.port.in.WriterRecruitmentUseCase;
import com.example.orderdesk.application.port.out.WorkflowEventPublisher;
import com.example.orderdesk.domain.exception.ConcurrentOrderUpdateException;
import com.example.orderdesk.domain.exception.ValidationException;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.persistence.RecruitmentPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Application service of the writer recruitment engine.
 * Writers are checked against the identity service before they are invited or assigned.
 */
@Service
public class WriterRecruitmentService implements WriterRecruitmentUseCase {

    private static final Logger log = LoggerFactory.getLogger(WriterRecruitmentService.class);

    private final RecruitmentPersistenceService persistenceService;
    private final ActorResolver actorResolver;
    private final WorkflowEventPublisher eventPublisher;

    public WriterRecruitmentService(
            RecruitmentPersistenceService persistenceService,
            ActorResolver actorResolver,
            WorkflowEventPublisher eventPublisher) {
        this.persistenceService = persistenceService;
        this.actorResolver = actorResolver;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public InviteResult invite(String orderId, String adminId, List<String> writerIds) {
        Actor admin = actorResolver.resolve(adminId, "invite writers", Role.ADMIN);
        List<String> writers = actorResolver.requireActiveWriters(writerIds);
        TransactionOutcome<InviteResult> outcome = persistenceService.invite(orderId, admin, writers);
        log.info("Order {}: invited {}, skipped {}", orderId, outcome.value().invited(), outcome.value().skipped());
        return eventPublisher.publish(outcome);
    }

    @Override
    public WriterInterestView showInterest(String orderId, String writerId, String comment) {
        Actor writer = actorResolver.resolve(writerId, "show interest in orders", Role.WRITER);
        TransactionOutcome<WriterInterestView> outcome = persistenceService.showInterest(orderId, writer, comment);
        log.info("Writer {} interested in order {}", writerId, orderId);
        return eventPublisher.publish(outcome);
    }

    @Override
    public WriterInterestView decline(String orderId, String writerId, String reason) {
        Actor writer = actorResolver.resolve(writerId, "decline invitations", Role.WRITER);
        TransactionOutcome<WriterInterestView> outcome = persistenceService.decline(orderId, writer, reason);
        log.info("Writer {} declined order {}", writerId, orderId);
        return eventPublisher.publish(outcome);
    }

    @Override
    public OrderView assign(String orderId, String adminId, String writerId, Long expectedVersion) {
        Actor admin = actorResolver.resolve(adminId, "assign writers", Role.ADMIN);
        String writer = requireWriter(writerId);
        TransactionOutcome<OrderView> outcome = guarded(orderId,
                () -> persistenceService.assign(orderId, admin, writer, expectedVersion));
        log.info("Order {} assigned to writer {} by {}", orderId, writer, admin.id());
        return eventPublisher.publish(outcome);
    }

    @Override
    public OrderView revoke(String orderId, String adminId, String reason) {
        Actor admin = actorResolver.resolve(adminId, "revoke assignments", Role.ADMIN);
        TransactionOutcome<OrderView> outcome = guarded(orderId,
                () -> persistenceService.revoke(orderId, admin, reason));
        log.info("Assignment on order {} revoked by {}", orderId, admin.id());
        return eventPublisher.publish(outcome);
    }

    @Override
    public OrderView reassign(String orderId, String adminId, String newWriterId, String reason) {
        Actor admin = actorResolver.resolve(adminId, "reassign writers", Role.ADMIN);
        String writer = requireWriter(newWriterId);
        TransactionOutcome<OrderView> outcome = guarded(orderId,
                () -> persistenceService.reassign(orderId, admin, writer, reason));
        log.info("Order {} reassigned to writer {} by {}", orderId, writer, admin.id());
        return eventPublisher.publish(outcome);
    }

    @Override
    public TaskEvaluationView evaluateTask(String orderId, String writerId, boolean doable, String comment) {
        Actor writer = actorResolver.resolve(writerId, "evaluate tasks", Role.WRITER);
        TransactionOutcome<TaskEvaluationView> outcome =
                persistenceService.evaluateTask(orderId, writer, doable, comment);
        if (doable) {
            log.info("Writer {} accepted the task on order {}", writerId, orderId);
        } else {
            log.warn("Writer {} marked order {} not doable", writerId, orderId);
        }
        return eventPublisher.publish(outcome);
    }

    @Override
    public Optional<String> currentAssignee(String orderId) {
        return persistenceService.currentAssignee(orderId);
    }

    @Override
    public List<WriterInterestView> interests(String orderId) {
        return persistenceService.interests(orderId);
    }

    /**
     * A write that still loses its race at commit surfaces as a stale order, never as a raw lock failure.
     */
    private static <T> TransactionOutcome<T> guarded(String orderId, Supplier<TransactionOutcome<T>> unit) {
        try {
            return unit.get();
        } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
            log.warn("Assignment on order {} lost a race at commit: {}", orderId, e.getMessage());
            throw ConcurrentOrderUpdateException.assignmentChanged(orderId, e);
        }
    }

    private String requireWriter(String writerId) {
        if (writerId == null || writerId.isBlank()) {
            throw new ValidationException("Writer id is required");
        }
        return actorResolver.requireActiveWriters(List.of(writerId)).get(0);
    }
}
