package com.example.orderdesk.application.port.in;

import com.example.orderdesk.application.dto.AuditEntryView;

import java.util.List;

public interface AuditTrailUseCase {

    /**
     * Returns an order's audit history, oldest first.
     *
     * @param eventType only entries of this type, or null for all
     * @param actorId   only entries recorded for this actor, or null for all
     */
    List<AuditEntryView> history(String orderId, String viewerId, String eventType, String actorId);
}
