package com.seedling.model;

/**
 * Competition lifecycle. States only move forward, one step at a time.
 */
public enum CompetitionStatus {
    DRAFT,
    UPCOMING,
    ACTIVE,
    CLOSED,
    JUDGING,
    COMPLETE;

    public CompetitionStatus next() {
        CompetitionStatus[] values = values();
        int nextIndex = ordinal() + 1;
        return nextIndex < values.length ? values[nextIndex] : null;
    }

    public boolean isImmediatePredecessorOf(CompetitionStatus target) {
        return target != null && next() == target;
    }
}
