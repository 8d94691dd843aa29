package com.example.orderdesk.application.service;

import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.SubmissionView;
import com.example.orderdesk.application.dto.SubmitWorkCommand;
import com.example.orderdesk.application.dto.TransactionOutcome;
import com.example.orderdesk.application.port.in.QualityControlUseCase;
import com.example.orderdesk.application.port.out.WorkflowEventPublisher;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.persistence.QualityControlPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class QualityControlService implements QualityControlUseCase {

    private static final Logger log = LoggerFactory.getLogger(QualityControlService.class);

    private final QualityControlPersistenceService persistenceService;
    private final ActorResolver actorResolver;
    private final WorkflowEventPublisher eventPublisher;

    public QualityControlService(
            QualityControlPersistenceService persistenceService,
            ActorResolver actorResolver,
            WorkflowEventPublisher eventPublisher) {
        this.persistenceService = persistenceService;
        this.actorResolver = actorResolver;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public SubmissionView submitWork(SubmitWorkCommand command) {
        Actor writer = actorResolver.resolve(command.writerId(), "submit work", Role.WRITER);
        TransactionOutcome<SubmissionView> outcome = persistenceService.submitWork(command, writer);
        log.info("Writer {} submitted #{} for order {}",
                writer.id(), outcome.value().sequenceNumber(), command.orderId());
        return eventPublisher.publish(outcome);
    }

    @Override
    public SubmissionView approveSubmission(String submissionId, String adminId, String feedback) {
        Actor admin = actorResolver.resolve(adminId, "approve submissions", Role.ADMIN);
        TransactionOutcome<SubmissionView> outcome = persistenceService.approve(submissionId, admin, feedback);
        log.info("Submission {} approved by {}", submissionId, admin.id());
        return eventPublisher.publish(outcome);
    }

    @Override
    public SubmissionView requestRevision(String submissionId, String adminId, String feedback) {
        Actor admin = actorResolver.resolve(adminId, "request revisions", Role.ADMIN);
        TransactionOutcome<SubmissionView> outcome = persistenceService.requestRevision(submissionId, admin, feedback);
        log.info("Revision {} requested on submission {} by {}",
                outcome.value().revisionNumber(), submissionId, admin.id());
        return eventPublisher.publish(outcome);
    }

    @Override
    public OrderView deliverOrder(String orderId, String adminId, String notes) {
        Actor admin = actorResolver.resolve(adminId, "deliver orders", Role.ADMIN);
        TransactionOutcome<OrderView> outcome = persistenceService.deliver(orderId, admin, notes);
        log.info("Order {} delivered by {}", orderId, admin.id());
        return eventPublisher.publish(outcome);
    }

    @Override
    public OrderView completeOrder(String orderId, String adminId) {
        Actor admin = actorResolver.resolve(adminId, "complete orders", Role.ADMIN);
        TransactionOutcome<OrderView> outcome = persistenceService.complete(orderId, admin);
        log.info("Order {} completed by {}", orderId, admin.id());
        return eventPublisher.publish(outcome);
    }

    @Override
    public Optional<SubmissionView> latestSubmission(String orderId) {
        return persistenceService.latest(orderId);
    }

    @Override
    public List<SubmissionView> submissions(String orderId) {
        return persistenceService.submissions(orderId);
    }
}
