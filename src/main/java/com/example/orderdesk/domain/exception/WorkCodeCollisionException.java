package com.example.orderdesk.domain.exception;

/**
 * A freshly minted work code hit the uniqueness constraint. Retried by the payment gate.
 */
public class WorkCodeCollisionException extends ConflictException {

    public WorkCodeCollisionException(String workCode, Throwable cause) {
        super("WORK_CODE_COLLISION", "Work code already in use: " + workCode, cause);
    }
}
