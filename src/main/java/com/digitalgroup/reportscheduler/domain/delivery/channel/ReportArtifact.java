package com.digitalgroup.reportscheduler.domain.delivery.channel;

import com.digitalgroup.reportscheduler.domain.common.enums.ReportFormat;

/**
 * Rendered report handed to every channel of an attempt. Channels only read it.
 *
 * @param artifactRef opaque handle assigned by the renderer
 * @param recordCount number of data rows in the report, null when the renderer does not know
 */
public record ReportArtifact(
        String artifactRef,
        String fileName,
        ReportFormat format,
        byte[] content,
        Integer recordCount) {

    public String contentType() {
        return format != null ? format.getContentType() : "application/octet-stream";
    }

    public long size() {
        return content != null ? content.length : 0;
    }
}
