package com.example.orderdesk.application.service;

import com.example.orderdesk.application.dto.QuotationView;
import com.example.orderdesk.application.dto.QuoteCommand;
import com.example.orderdesk.application.dto.TransactionOutcome;
import com.example.orderdesk.application.port.in.QuotationUseCase;
import com.example.orderdesk.application.port.out.WorkflowEventPublisher;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.persistence.QuotationPersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class QuotationService implements QuotationUseCase {

    private static final Logger log = LoggerFactory.getLogger(QuotationService.class);

    private final QuotationPersistenceService persistenceService;
    private final ActorResolver actorResolver;
    private final WorkflowEventPublisher eventPublisher;

    public QuotationService(
            QuotationPersistenceService persistenceService,
            ActorResolver actorResolver,
            WorkflowEventPublisher eventPublisher) {
        this.persistenceService = persistenceService;
        this.actorResolver = actorResolver;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public QuotationView createOrUpdateQuotation(QuoteCommand command) {
        Actor actor = actorResolver.resolve(command.actorId(), "quote orders", Role.ADMIN, Role.BDE);
        TransactionOutcome<QuotationView> outcome = persistenceService.upsert(command, actor);
        log.info("Quotation for order {} set to {} by {}",
                command.orderId(), outcome.value().finalPrice(), actor.id());
        return eventPublisher.publish(outcome);
    }

    @Override
    public QuotationView acceptQuotation(String orderId, String actorId) {
        Actor actor = actorResolver.resolve(actorId, "accept quotations", Role.CLIENT, Role.ADMIN);
        TransactionOutcome<QuotationView> outcome = persistenceService.accept(orderId, actor);
        log.info("Quotation for order {} accepted by {}", orderId, actor.id());
        return eventPublisher.publish(outcome);
    }

    @Override
    public QuotationView getQuotation(String orderId) {
        return persistenceService.find(orderId);
    }
}
