package com.digitalgroup.reportscheduler.domain.common.enums;

/**
 * TRANSIENT errors are eligible for retry, PERMANENT ones short-circuit the retry policy.
 */
public enum DeliveryErrorKind {
    TRANSIENT,
    PERMANENT
}
