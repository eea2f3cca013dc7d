package com.digitalgroup.reportscheduler.domain.common.enums;

public enum WebhookMethod {
    POST,
    PUT,
    PATCH
}
