package com.example.orderdesk.infrastructure.persistence.mapper;

import com.example.orderdesk.application.dto.AuditEntryView;
import com.example.orderdesk.application.dto.NotificationView;
import com.example.orderdesk.application.dto.OrderParticipants;
import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.PaymentView;
import com.example.orderdesk.application.dto.QuotationView;
import com.example.orderdesk.application.dto.SubmissionView;
import com.example.orderdesk.application.dto.TaskEvaluationView;
import com.example.orderdesk.application.dto.WriterInterestView;
import com.example.orderdesk.infrastructure.persistence.entity.AuditLogEntry;
import com.example.orderdesk.infrastructure.persistence.entity.NotificationEntity;
import com.example.orderdesk.infrastructure.persistence.entity.OrderEntity;
import com.example.orderdesk.infrastructure.persistence.entity.PaymentEntity;
import com.example.orderdesk.infrastructure.persistence.entity.QuotationEntity;
import com.example.orderdesk.infrastructure.persistence.entity.SubmissionEntity;
import com.example.orderdesk.infrastructure.persistence.entity.TaskEvaluationEntity;
import com.example.orderdesk.infrastructure.persistence.entity.WriterInterestEntity;
import org.springframework.stereotype.Component;

/**
 * Maps workflow entities to the read models handed out by the application layer.
 */
@Component
public class WorkflowViewMapper {

    public OrderView toView(OrderEntity entity) {
        return new OrderView(
                entity.getId(),
                entity.getQueryCode(),
                entity.getWorkCode(),
                entity.getClientId(),
                entity.getBdeId(),
                entity.getAssignedWriterId(),
                entity.getTopic(),
                entity.getSubject(),
                entity.getService(),
                entity.getUrgency(),
                entity.getStatus(),
                entity.getStatus().getCode(),
                entity.getBasicPrice(),
                entity.getDiscount(),
                entity.getTotalPrice(),
                entity.getDeadlineAt(),
                entity.getVersion() != null ? entity.getVersion() : 0L,
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    public OrderParticipants toParticipants(OrderEntity entity) {
        return new OrderParticipants(entity.getId(), entity.getClientId(),
                entity.getAssignedWriterId(), entity.getBdeId());
    }

    public QuotationView toView(QuotationEntity entity) {
        return new QuotationView(
                entity.getId(),
                entity.getOrderId(),
                entity.getBasePrice(),
                entity.getUrgencyCharge(),
                entity.getDiscount(),
                entity.getTax(),
                entity.getFinalPrice(),
                entity.getCurrency(),
                entity.getNotes(),
                entity.getQuotedBy(),
                entity.getAcceptedAt(),
                entity.getUpdatedAt()
        );
    }

    public PaymentView toView(PaymentEntity entity, String workCode) {
        return new PaymentView(
                entity.getId(),
                entity.getOrderId(),
                entity.getPayerId(),
                entity.getAmount(),
                entity.getState(),
                entity.getVerifiedPercentage(),
                entity.getReceiptReference(),
                entity.getRejectionReason(),
                workCode,
                entity.getCreatedAt(),
                entity.getReviewedAt()
        );
    }

    public WriterInterestView toView(WriterInterestEntity entity) {
        return new WriterInterestView(
                entity.getOrderId(),
                entity.getWriterId(),
                entity.getState(),
                entity.getComment(),
                entity.getUpdatedAt()
        );
    }

    public TaskEvaluationView toView(TaskEvaluationEntity entity) {
        return new TaskEvaluationView(
                entity.getOrderId(),
                entity.getWriterId(),
                entity.getState(),
                entity.getComment()
        );
    }

    public SubmissionView toView(SubmissionEntity entity) {
        return new SubmissionView(
                entity.getId(),
                entity.getOrderId(),
                entity.getWriterId(),
                entity.getSequenceNumber(),
                entity.getFileReference(),
                entity.getState(),
                entity.getFeedback(),
                entity.getRevisionNumber(),
                entity.getCreatedAt(),
                entity.getReviewedAt()
        );
    }

    public NotificationView toView(NotificationEntity entity) {
        return new NotificationView(
                entity.getId(),
                entity.getOrderId(),
                entity.getSeverity(),
                entity.getTitle(),
                entity.getMessage(),
                entity.getLinkUrl(),
                entity.isRead(),
                entity.getCreatedAt()
        );
    }

    public AuditEntryView toView(AuditLogEntry entry) {
        return new AuditEntryView(
                entry.getId(),
                entry.getEventType(),
                entry.getActorId(),
                entry.getActorRole(),
                entry.getResourceType(),
                entry.getResourceId(),
                entry.getBeforeStatus(),
                entry.getAfterStatus(),
                entry.getDetails(),
                entry.getOccurredAt()
        );
    }
}
