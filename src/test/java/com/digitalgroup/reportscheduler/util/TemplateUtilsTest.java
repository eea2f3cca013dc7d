package com.digitalgroup.reportscheduler.util;

import com.digitalgroup.reportscheduler.domain.common.enums.ReportFormat;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateUtilsTest {

    @Test
    void render_ReplacesKnownAndKeepsUnknownPlaceholders() {
        String result = TemplateUtils.render("{{schedule}} for {{ date }} ({{unknown}})",
                Map.of("schedule", "Weekly sales", "date", "2024-01-08"));

        assertEquals("Weekly sales for 2024-01-08 ({{unknown}})", result);
    }

    @Test
    void render_HandlesReplacementCharactersLiterally() {
        assertEquals("cost $5", TemplateUtils.render("cost {{amount}}", Map.of("amount", "$5")));
    }

    @Test
    void standardVariables_UseScheduleTimezone() {
        ReportSchedule schedule = ReportSchedule.builder()
                .name("Daily KPIs")
                .reportId(42L)
                .timezone("Asia/Tokyo")
                .build();
        ReportArtifact artifact = new ReportArtifact("art-1", "kpis.pdf", ReportFormat.PDF, new byte[0], 17);

        // 2024-12-31T20:00Z is already 2025-01-01 in Tokyo
        Map<String, String> vars = TemplateUtils.standardVariables(schedule, artifact,
                Instant.parse("2024-12-31T20:00:00Z"));

        assertEquals("2025-01-01", vars.get("date"));
        assertEquals("2025", vars.get("year"));
        assertEquals("01", vars.get("month"));
        assertEquals("20250101_050000", vars.get("timestamp"));
        assertEquals("42", vars.get("report"));
        assertEquals("Daily KPIs", vars.get("schedule"));
        assertEquals("kpis.pdf", vars.get("file_name"));
        assertEquals("17", vars.get("record_count"));
    }
}
