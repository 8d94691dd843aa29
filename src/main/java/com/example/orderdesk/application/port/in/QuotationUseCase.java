package com.example.orderdesk.application.port.in;

import com.example.orderdesk.application.dto.QuotationView;
import com.example.orderdesk.application.dto.QuoteCommand;

public interface QuotationUseCase {

    /**
     * Upserts the single quotation of an order and moves it to QUOTATION_SENT.
     */
    QuotationView createOrUpdateQuotation(QuoteCommand command);

    QuotationView acceptQuotation(String orderId, String actorId);

    QuotationView getQuotation(String orderId);
}
