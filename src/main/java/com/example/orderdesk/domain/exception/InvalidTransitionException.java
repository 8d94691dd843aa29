package com.example.orderdesk.domain.exception;

import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.Role;

/**
 * Thrown when the acting role or the current state does not permit the requested action.
 * The message always names what would have been required.
 */
public class InvalidTransitionException extends DomainException {

    public InvalidTransitionException(String message) {
        super("INVALID_TRANSITION", message);
    }

    public InvalidTransitionException(Role role, OrderStatus from, OrderStatus to, String allowed) {
        super("INVALID_TRANSITION", role + " cannot move order from " + from.describe()
                + " to " + to.describe() + "; allowed: " + allowed);
    }

    protected InvalidTransitionException(String errorCode, String message) {
        super(errorCode, message);
    }
}
