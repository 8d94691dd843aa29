package com.example.orderdesk.infrastructure.adapter.in.web.mapper;

import com.example.orderdesk.application.dto.CreateQueryCommand;
import com.example.orderdesk.application.dto.QuoteCommand;
import com.example.orderdesk.application.dto.SubmitWorkCommand;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.CreateQueryRequest;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.QuoteRequest;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.SubmitWorkRequest;
import org.springframework.stereotype.Component;

/**
 * Maps web request bodies plus the acting user to application commands.
 */
@Component
public class OrderWebMapper {

    public CreateQueryCommand toCommand(String clientId, CreateQueryRequest request) {
        return new CreateQueryCommand(
                clientId,
                request.topic().trim(),
                request.subject(),
                request.service(),
                request.urgency(),
                request.description(),
                request.deadline(),
                request.fileReference(),
                request.bdeId()
        );
    }

    public QuoteCommand toCommand(String orderId, String actorId, QuoteRequest request) {
        return new QuoteCommand(
                orderId,
                actorId,
                request.basePrice(),
                request.urgencyCharge(),
                request.discount(),
                request.tax(),
                request.finalPrice(),
                request.notes()
        );
    }

    public SubmitWorkCommand toCommand(String orderId, String writerId, SubmitWorkRequest request) {
        return new SubmitWorkCommand(orderId, writerId, request.fileReference(), request.notes());
    }
}
