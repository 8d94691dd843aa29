package com.example.orderdesk.domain.model;

/**
 * Verification state of a recorded payment.
 */
public enum PaymentState {
    PENDING,
    VERIFIED,
    REJECTED
}
