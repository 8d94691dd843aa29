package com.example.orderdesk.domain.model;

/**
 * Writer's feasibility verdict on the assignment they hold.
 */
public enum TaskEvaluationState {
    PENDING,
    DOABLE,
    NOT_DOABLE,
    RELEASED
}
