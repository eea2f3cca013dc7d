package com.digitalgroup.reportscheduler.domain.common.enums;

import lombok.Getter;

/**
 * Cloud storage targets known to the delivery configuration.
 * Only providers flagged as supported have an uploader behind them.
 */
@Getter
public enum CloudProvider {
    AWS_S3(true),
    GOOGLE_DRIVE(false),
    DROPBOX(false),
    ONEDRIVE(false),
    AZURE_BLOB(false);

    private final boolean supported;

    CloudProvider(boolean supported) {
        this.supported = supported;
    }
}
