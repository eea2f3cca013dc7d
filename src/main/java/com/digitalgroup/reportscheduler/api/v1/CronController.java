package com.digitalgroup.reportscheduler.api.v1;

import com.digitalgroup.reportscheduler.api.v1.dto.schedule.CronDescriptionResponse;
import com.digitalgroup.reportscheduler.util.CronUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Cron helper for schedule editors: description and upcoming fire times
 */
@RestController
@RequestMapping("/api/v1/cron")
@RequiredArgsConstructor
public class CronController {

    private static final int MAX_PREVIEW = 20;

    private final Clock clock;

    @GetMapping("/describe")
    public ResponseEntity<CronDescriptionResponse> describe(
            @RequestParam String expression,
            @RequestParam(required = false, defaultValue = "UTC") String timezone,
            @RequestParam(required = false, defaultValue = "5") int count) {

        ZoneId zone;
        try {
            zone = ZoneId.of(timezone);
        } catch (DateTimeException e) {
            return ResponseEntity.badRequest().body(new CronDescriptionResponse(
                    expression, false, null, timezone, null, "Unknown timezone: " + timezone));
        }

        try {
            CronUtils.parse(expression);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.ok(new CronDescriptionResponse(
                    expression, false, null, timezone, null, e.getMessage()));
        }

        int previewCount = Math.min(Math.max(count, 0), MAX_PREVIEW);
        return ResponseEntity.ok(new CronDescriptionResponse(
                CronUtils.canonicalize(expression),
                true,
                CronUtils.describe(expression),
                zone.getId(),
                CronUtils.preview(expression, clock.instant(), zone, previewCount),
                null));
    }
}
