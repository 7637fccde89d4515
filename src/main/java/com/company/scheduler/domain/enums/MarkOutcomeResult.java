package com.company.scheduler.domain.enums;

/**
 * Result of a conditional claim against the job store.
 */
public enum MarkOutcomeResult {
    APPLIED,
    CONFLICT;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
