package com.digitalgroup.reportscheduler.domain.delivery.render;

import com.digitalgroup.reportscheduler.domain.common.enums.ReportFormat;

/**
 * @param password optional protection the renderer applies to the artifact
 */
public record RenderRequest(
        Long reportId,
        ReportFormat format,
        String password,
        Long scheduleId,
        Long runId,
        int attempt) {
}
