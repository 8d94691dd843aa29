package com.example.orderdesk.domain.exception;

/**
 * Missing or malformed input.
 */
public class ValidationException extends DomainException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
