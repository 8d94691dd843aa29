package com.example.orderdesk.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stance of one candidate writer toward one order.
 */
public enum WriterInterestState {

    /**
     * Invited by an admin, no answer yet.
     */
    INVITED,

    /**
     * Writer raised a hand, either after an invite or on an open order.
     */
    INTERESTED,

    /**
     * Legacy acceptance state found in older rows, treated like {@link #INTERESTED}.
     */
    ACCEPTED,

    /**
     * Writer declined the invitation.
     */
    REJECTED,

    ASSIGNED,

    /**
     * Assignment pulled back by an admin.
     */
    REVOKED,

    /**
     * Assignment handed to another writer.
     */
    RELEASED;

    private static final Set<WriterInterestState> ASSIGNABLE = EnumSet.of(INTERESTED, ACCEPTED);
    private static final Set<WriterInterestState> REINVITABLE = EnumSet.of(REJECTED, REVOKED, RELEASED);

    public boolean isAssignable() {
        return ASSIGNABLE.contains(this);
    }

    /**
     * States an invite may move back to {@link #INVITED}.
     */
    public boolean isReinvitable() {
        return REINVITABLE.contains(this);
    }
}
