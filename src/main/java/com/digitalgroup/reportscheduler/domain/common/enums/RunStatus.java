package com.digitalgroup.reportscheduler.domain.common.enums;

/**
 * Lifecycle of a scheduled report run.
 * PENDING -> RENDERING -> DELIVERING -> one of the terminal states.
 */
public enum RunStatus {
    PENDING,
    RENDERING,
    DELIVERING,
    SUCCEEDED,
    FAILED,
    CANCELLED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED || this == SKIPPED;
    }
}
