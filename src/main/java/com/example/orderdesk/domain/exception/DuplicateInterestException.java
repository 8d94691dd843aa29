package com.example.orderdesk.domain.exception;

public class DuplicateInterestException extends ConflictException {

    public DuplicateInterestException(String orderId, String writerId) {
        super("DUPLICATE_INTEREST", "Writer " + writerId + " has already shown interest in order " + orderId);
    }
}
