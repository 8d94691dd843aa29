package com.example.orderdesk.domain.exception;

/**
 * The order changed between read and write. The caller should refresh and decide again.
 */
public class ConcurrentOrderUpdateException extends ConflictException {

    public ConcurrentOrderUpdateException(String orderId) {
        super("STALE_ORDER", "Order " + orderId + " was modified concurrently; refresh and try again");
    }

    public ConcurrentOrderUpdateException(String orderId, Throwable cause) {
        this(orderId, "refresh and try again", cause);
    }

    public ConcurrentOrderUpdateException(String orderId, long expectedVersion, long actualVersion) {
        super("STALE_ORDER", "Order " + orderId + " is at version " + actualVersion
                + " but version " + expectedVersion + " was expected; refresh and choose again");
    }

    private ConcurrentOrderUpdateException(String orderId, String nextStep, Throwable cause) {
        super("STALE_ORDER", "Order " + orderId + " was modified concurrently; " + nextStep, cause);
    }

    /**
     * Lost race on who holds the order, e.g. two admins picking different writers.
     */
    public static ConcurrentOrderUpdateException assignmentChanged(String orderId, Throwable cause) {
        return new ConcurrentOrderUpdateException(orderId, "refresh and choose again", cause);
    }
}
