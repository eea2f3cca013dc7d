package com.digitalgroup.reportscheduler.domain.common.enums;

import lombok.Getter;

@Getter
public enum Priority {
    LOW(0),
    NORMAL(1),
    HIGH(2);

    private final int value;

    Priority(int value) {
        this.value = value;
    }
}
