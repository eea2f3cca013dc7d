package com.digitalgroup.reportscheduler.domain.common.enums;

public enum ChannelStatus {
    SUCCEEDED,
    FAILED
}
