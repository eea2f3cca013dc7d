package com.digitalgroup.reportscheduler.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CronUtilsTest {

    @Test
    void parse_RejectsWrongFieldCount() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CronUtils.parse("0 0 9 * * *"));
        assertTrue(e.getMessage().contains("5 fields"));
    }

    @Test
    void parse_RejectsOutOfRangeField() {
        assertThrows(IllegalArgumentException.class, () -> CronUtils.parse("0 25 * * *"));
        assertFalse(CronUtils.isValid(""));
        assertFalse(CronUtils.isValid(null));
    }

    @Test
    void canonicalize_CollapsesWhitespace() {
        assertEquals("0 9 * * 1", CronUtils.canonicalize("  0   9 *\t* 1 "));
        assertNull(CronUtils.canonicalize("   "));
    }

    @Test
    void nextAfter_EvaluatesInGivenZone() {
        Instant next = CronUtils.nextAfter("0 9 * * *", Instant.parse("2024-06-01T00:00:00Z"),
                ZoneId.of("Europe/Madrid"));

        // 09:00 CEST
        assertEquals(Instant.parse("2024-06-01T07:00:00Z"), next);
    }

    @Test
    void nextAfter_SundayAsZeroOrSeven() {
        Instant from = Instant.parse("2024-01-03T00:00:00Z");
        ZoneId utc = ZoneId.of("UTC");

        assertEquals(Instant.parse("2024-01-07T08:00:00Z"), CronUtils.nextAfter("0 8 * * 0", from, utc));
        assertEquals(Instant.parse("2024-01-07T08:00:00Z"), CronUtils.nextAfter("0 8 * * 7", from, utc));
    }

    @Test
    void preview_ReturnsRequestedNumberOfFireTimes() {
        List<Instant> times = CronUtils.preview("*/15 * * * *", Instant.parse("2024-01-01T00:00:00Z"),
                ZoneId.of("UTC"), 3);

        assertEquals(List.of(
                Instant.parse("2024-01-01T00:15:00Z"),
                Instant.parse("2024-01-01T00:30:00Z"),
                Instant.parse("2024-01-01T00:45:00Z")), times);
    }

    @Test
    void describe_ProducesReadableText() {
        assertEquals("at 09:00, every day", CronUtils.describe("0 9 * * *"));
        assertEquals("at 14:30, Monday through Friday", CronUtils.describe("30 14 * * 1-5"));
        assertEquals("at 06:00, on day 1 of the month", CronUtils.describe("0 6 1 * *"));
        assertEquals("Invalid cron expression", CronUtils.describe("bogus"));
    }
}
