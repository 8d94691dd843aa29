package com.example.orderdesk.infrastructure.persistence;

import com.example.orderdesk.application.dto.QuotationView;
import com.example.orderdesk.application.dto.QuoteCommand;
import com.example.orderdesk.application.dto.TransactionOutcome;
import com.example.orderdesk.application.dto.WorkflowEvent;
import com.example.orderdesk.domain.exception.InvalidTransitionException;
import com.example.orderdesk.domain.exception.NotFoundException;
import com.example.orderdesk.domain.exception.ValidationException;
import com.example.orderdesk.domain.model.Actor;
import com.example.orderdesk.domain.model.NotificationSeverity;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.Quote;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.persistence.entity.OrderEntity;
import com.example.orderdesk.infrastructure.persistence.entity.QuotationEntity;
import com.example.orderdesk.infrastructure.persistence.mapper.WorkflowViewMapper;
import com.example.orderdesk.infrastructure.persistence.repository.QuotationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Quotation gate: one quotation row per order, mirrored onto the order's price fields.
 */
@Service
public class QuotationPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(QuotationPersistenceService.class);

    private final QuotationRepository quotationRepository;
    private final OrderStore orderStore;
    private final OutboxWriter outboxWriter;
    private final WorkflowViewMapper mapper;
    private final Clock clock;

    public QuotationPersistenceService(
            QuotationRepository quotationRepository,
            OrderStore orderStore,
            OutboxWriter outboxWriter,
            WorkflowViewMapper mapper,
            Clock clock) {
        this.quotationRepository = quotationRepository;
        this.orderStore = orderStore;
        this.outboxWriter = outboxWriter;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Transactional
    public TransactionOutcome<QuotationView> upsert(QuoteCommand command, Actor actor) {
        Quote quote;
        try {
            quote = Quote.of(command.basePrice(), command.urgencyCharge(), command.discount(),
                    command.tax(), command.finalPrice());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }

        OrderEntity order = orderStore.load(command.orderId());
        OrderStatus from = orderStore.moveTo(order, actor.role(), OrderStatus.QUOTATION_SENT);
        if (actor.is(Role.BDE) && order.getBdeId() == null) {
            order.setBdeId(actor.id());
        }

        Optional<QuotationEntity> existing = quotationRepository.findByOrderId(order.getId());
        QuotationEntity quotation = existing.orElseGet(() -> {
            QuotationEntity created = new QuotationEntity();
            created.setId(UUID.randomUUID().toString());
            created.setOrderId(order.getId());
            return created;
        });
        quotation.setBasePrice(quote.getBasePrice().getAmount());
        quotation.setUrgencyCharge(quote.getUrgencyCharge().getAmount());
        quotation.setDiscount(quote.getDiscount().getAmount());
        quotation.setTax(quote.getTax().getAmount());
        quotation.setFinalPrice(quote.getFinalPrice().getAmount());
        quotation.setNotes(command.notes());
        quotation.setQuotedBy(actor.id());
        quotation.setAcceptedAt(null);
        QuotationEntity saved = quotationRepository.saveAndFlush(quotation);

        order.setBasicPrice(quote.basicPrice().getAmount());
        order.setDiscount(quote.getDiscount().getAmount());
        order.setTotalPrice(quote.getFinalPrice().getAmount());
        orderStore.save(order);

        boolean update = existing.isPresent();
        String message = (update ? "Updated quotation for " : "Quotation for ") + order.getQueryCode()
                + ": " + quote.getFinalPrice();
        WorkflowEvent event = WorkflowEvent.builder(update ? "QUOTATION_UPDATED" : "QUOTATION_SENT", actor)
                .order(order.getId())
                .resource("QUOTATION", saved.getId())
                .transition(from, OrderStatus.QUOTATION_SENT)
                .detail("finalPrice", quote.getFinalPrice().getAmount())
                .detail("discount", quote.getDiscount().getAmount())
                .notify(order.getClientId(), NotificationSeverity.INFO, "Quotation Ready", message)
                .notify(order.getBdeId(), NotificationSeverity.INFO, "Quotation Ready", message)
                .build();
        log.debug("Quotation {} {} for order {}", saved.getId(), update ? "updated" : "created", order.getId());
        return TransactionOutcome.of(mapper.toView(saved), outboxWriter.append(event));
    }

    @Transactional
    public TransactionOutcome<QuotationView> accept(String orderId, Actor actor) {
        OrderEntity order = orderStore.load(orderId);
        orderStore.requireOwner(order, actor);
        QuotationEntity quotation = quotationRepository.findByOrderId(orderId)
                .orElseThrow(() -> new NotFoundException("Quotation", orderId));
        if (quotation.getAcceptedAt() != null) {
            throw new InvalidTransitionException("Quotation for order " + orderId + " was already accepted");
        }
        OrderStatus from = orderStore.moveTo(order, actor.role(), OrderStatus.ACCEPTED);
        quotation.setAcceptedAt(clock.instant());
        quotationRepository.saveAndFlush(quotation);
        orderStore.save(order);

        String message = "Quotation for " + order.getQueryCode() + " accepted";
        WorkflowEvent event = WorkflowEvent.builder("QUOTATION_ACCEPTED", actor)
                .order(orderId)
                .resource("QUOTATION", quotation.getId())
                .transition(from, OrderStatus.ACCEPTED)
                .detail("finalPrice", quotation.getFinalPrice())
                .notify(order.getBdeId(), NotificationSeverity.SUCCESS, "Quotation Accepted", message)
                .notify(order.getClientId(), NotificationSeverity.SUCCESS, "Quotation Accepted", message)
                .notifyRole(Role.ADMIN, NotificationSeverity.SUCCESS, "Quotation Accepted", message)
                .build();
        return TransactionOutcome.of(mapper.toView(quotation), outboxWriter.append(event));
    }

    @Transactional(readOnly = true)
    public QuotationView find(String orderId) {
        orderStore.load(orderId);
        return quotationRepository.findByOrderId(orderId)
                .map(mapper::toView)
                .orElseThrow(() -> new NotFoundException("Quotation", orderId));
    }
}
