package com.example.orderdesk.domain.model;

import java.util.Arrays;

/**
 * Lifecycle states of an order. The numeric code is what gets stored.
 */
public enum OrderStatus {

    /**
     * Query raised by the client, awaiting a price.
     */
    PENDING_QUERY(26, false, false),

    /**
     * A quotation has been sent to the client.
     */
    QUOTATION_SENT(27, false, true),

    /**
     * Client accepted the quotation.
     */
    ACCEPTED(28, false, true),

    /**
     * Client submitted a payment that an admin still has to verify.
     */
    AWAITING_VERIFICATION(29, false, true),

    /**
     * Fully paid and carrying a work code. Awaiting writer assignment.
     */
    PAYMENT_VERIFIED(30, false, true),

    WRITER_ASSIGNED(31, false, true),

    IN_PROGRESS(32, false, false),

    PENDING_QC(33, false, true),

    /**
     * Submission approved by QC, ready for delivery.
     */
    APPROVED(34, false, true),

    COMPLETED(35, true, true),

    REVISION_REQUIRED(36, false, true),

    DELIVERED(37, true, true),

    QUERY_REJECTED(38, true, false),

    CANCELLED(45, true, false);

    private final int code;
    private final boolean closed;
    private final boolean gated;

    OrderStatus(int code, boolean closed, boolean gated) {
        this.code = code;
        this.closed = closed;
        this.gated = gated;
    }

    public int getCode() {
        return code;
    }

    /**
     * Closed orders accept no further recruitment or QC actions.
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Gated statuses can only be entered through the operation that owns them,
     * never through a plain status change.
     */
    public boolean isGated() {
        return gated;
    }

    /**
     * Whether the order has passed the payment gate, so it must carry a work code.
     */
    public boolean isPostPayment() {
        return switch (this) {
            case PAYMENT_VERIFIED, WRITER_ASSIGNED, IN_PROGRESS, PENDING_QC, APPROVED,
                 REVISION_REQUIRED, DELIVERED, COMPLETED -> true;
            default -> false;
        };
    }

    public static OrderStatus fromCode(int code) {
        return Arrays.stream(values())
                .filter(status -> status.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status code: " + code));
    }

    public String describe() {
        return name() + " (" + code + ")";
    }
}
