package com.digitalgroup.reportscheduler.util;

import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {{placeholder}} substitution for subjects, bodies, cloud paths and remote file names.
 * Unknown placeholders are left as written.
 */
public final class TemplateUtils {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-zA-Z_]+)\\s*}}");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private TemplateUtils() {}

    public static String render(String template, Map<String, String> variables) {
        if (template == null || template.isEmpty() || variables == null || variables.isEmpty()) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = variables.get(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Variables available to every delivery of a run. Dates are in the schedule's timezone.
     */
    public static Map<String, String> standardVariables(ReportSchedule schedule, ReportArtifact artifact,
                                                        Instant triggeredAt) {
        ZonedDateTime at = triggeredAt.atZone(schedule.zoneId());
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("date", DATE.format(at));
        vars.put("year", String.valueOf(at.getYear()));
        vars.put("month", String.format("%02d", at.getMonthValue()));
        vars.put("day", String.format("%02d", at.getDayOfMonth()));
        vars.put("timestamp", TIMESTAMP.format(at));
        vars.put("report", String.valueOf(schedule.getReportId()));
        vars.put("schedule", schedule.getName() != null ? schedule.getName() : "");
        if (artifact != null) {
            vars.put("file_name", artifact.fileName() != null ? artifact.fileName() : "");
            vars.put("record_count", artifact.recordCount() != null ? String.valueOf(artifact.recordCount()) : "");
        }
        return vars;
    }
}
