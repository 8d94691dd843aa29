package com.example.orderdesk.domain.exception;

/**
 * Thrown when a compare-and-set lost against a concurrent or earlier write.
 */
public class ConflictException extends DomainException {

    public ConflictException(String message) {
        super("CONFLICT", message);
    }

    protected ConflictException(String errorCode, String message) {
        super(errorCode, message);
    }

    protected ConflictException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
