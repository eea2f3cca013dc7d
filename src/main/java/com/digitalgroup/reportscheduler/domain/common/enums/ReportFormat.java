package com.digitalgroup.reportscheduler.domain.common.enums;

import lombok.Getter;

@Getter
public enum ReportFormat {
    PDF("pdf", "application/pdf"),
    EXCEL("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
    CSV("csv", "text/csv"),
    JSON("json", "application/json"),
    IMAGE("png", "image/png"),
    ARCHIVE("zip", "application/zip");

    private final String extension;
    private final String contentType;

    ReportFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }
}
