package com.example.orderdesk.application.port.out;

import com.example.orderdesk.application.dto.TransactionOutcome;

/**
 * Publishes a committed workflow event to the audit log and notification fan-out.
 * Never throws: failures are left for the background retry.
 */
public interface WorkflowEventPublisher {

    void publish(String eventId);

    /**
     * Publishes the outcome's event, if it wrote one, and unwraps its value.
     */
    default <T> T publish(TransactionOutcome<T> outcome) {
        if (outcome.hasEvent()) {
            publish(outcome.eventId());
        }
        return outcome.value();
    }
}
