package com.seedling.model;

import java.util.EnumSet;
import java.util.Set;

public enum SubmissionStatus {
    DRAFT,
    PENDING_PAYMENT,
    SUBMITTED,
    UNDER_REVIEW,
    WINNER,
    NOT_SELECTED,
    REJECTED;

    /**
     * Statuses that appear on leaderboards and results.
     */
    public static final Set<SubmissionStatus> RANKABLE = EnumSet.of(SUBMITTED, UNDER_REVIEW, WINNER, NOT_SELECTED);

    /**
     * Statuses that are still in contention before winners are chosen.
     */
    public static final Set<SubmissionStatus> IN_CONTENTION = EnumSet.of(SUBMITTED, UNDER_REVIEW);

    public boolean isOwnerEditable() {
        return this == DRAFT || this == PENDING_PAYMENT;
    }
}
