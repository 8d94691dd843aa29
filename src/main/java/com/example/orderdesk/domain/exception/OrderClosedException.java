package com.example.orderdesk.domain.exception;

import com.example.orderdesk.domain.model.OrderStatus;

public class OrderClosedException extends InvalidTransitionException {

    public OrderClosedException(OrderStatus status) {
        super("ORDER_CLOSED", "Order already closed in status " + status.describe() + ". Cannot be modified.");
    }
}
