package com.digitalgroup.reportscheduler.domain.common.enums;

/**
 * Recurrence kinds a schedule can use.
 * CUSTOM is driven by a five-field cron expression, the rest by the structured
 * time-of-day / day-of-week / day-of-month fields.
 */
public enum Frequency {
    ONCE,
    DAILY,
    WEEKLY,
    MONTHLY,
    QUARTERLY,
    YEARLY,
    CUSTOM;

    public boolean usesDayOfMonth() {
        return this == MONTHLY || this == QUARTERLY || this == YEARLY;
    }
}
