package com.example.orderdesk.domain.model;

/**
 * Review state of a file handed to QC.
 */
public enum SubmissionState {

    PENDING_QC,

    APPROVED,

    /**
     * Sent back to the writer. A new submission restarts review.
     */
    REVISION_REQUIRED,

    COMPLETED
}
