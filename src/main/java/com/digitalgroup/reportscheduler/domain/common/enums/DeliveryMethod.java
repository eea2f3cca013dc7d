package com.digitalgroup.reportscheduler.domain.common.enums;

public enum DeliveryMethod {
    EMAIL,
    CLOUD_STORAGE,
    FTP,
    WEBHOOK,
    DATABASE
}
