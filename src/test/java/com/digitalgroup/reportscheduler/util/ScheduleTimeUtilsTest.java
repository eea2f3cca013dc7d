package com.digitalgroup.reportscheduler.util;

import com.digitalgroup.reportscheduler.domain.common.enums.Frequency;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleTimeUtilsTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private ReportSchedule.ReportScheduleBuilder schedule(Frequency frequency) {
        return ReportSchedule.builder()
                .name("Sales")
                .reportId(10L)
                .frequency(frequency)
                .startDate(START)
                .timezone("UTC")
                .timeOfDay(LocalTime.of(9, 0));
    }

    @Test
    void computeNextRun_Daily_BeforeTimeOfDay_ReturnsSameDay() {
        ReportSchedule s = schedule(Frequency.DAILY).build();

        Instant next = ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-03-10T08:00:00Z"));

        assertEquals(Instant.parse("2024-03-10T09:00:00Z"), next);
    }

    @Test
    void computeNextRun_Daily_ExactlyAtOccurrence_ReturnsNextDay() {
        ReportSchedule s = schedule(Frequency.DAILY).build();

        Instant next = ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-03-10T09:00:00Z"));

        assertEquals(Instant.parse("2024-03-11T09:00:00Z"), next);
    }

    @Test
    void computeNextRun_Daily_StartInFuture_StartsAtStartDate() {
        ReportSchedule s = schedule(Frequency.DAILY).startDate(Instant.parse("2024-05-01T09:00:00Z")).build();

        Instant next = ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-01-01T00:00:00Z"));

        assertEquals(Instant.parse("2024-05-01T09:00:00Z"), next);
    }

    @Test
    void computeNextRun_IsStrictlyIncreasing() {
        ReportSchedule s = schedule(Frequency.MONTHLY).dayOfMonth(31).build();
        Instant cursor = Instant.parse("2024-01-15T00:00:00Z");

        for (int i = 0; i < 36; i++) {
            Instant next = ScheduleTimeUtils.computeNextRun(s, cursor);
            assertNotNull(next);
            assertTrue(next.isAfter(cursor), "occurrence " + next + " not after " + cursor);
            cursor = next;
        }
    }

    @Test
    void computeNextRun_EveryRecurringFrequency_IsStrictlyIncreasing() {
        List<ReportSchedule> schedules = List.of(
                schedule(Frequency.DAILY).timezone("America/New_York").build(),
                schedule(Frequency.WEEKLY).dayOfWeek(3).timezone("America/New_York").build(),
                schedule(Frequency.MONTHLY).dayOfMonth(31).build(),
                schedule(Frequency.QUARTERLY).dayOfMonth(31).build(),
                schedule(Frequency.YEARLY).startDate(Instant.parse("2024-02-01T00:00:00Z")).dayOfMonth(29).build(),
                schedule(Frequency.CUSTOM).customCronExpression("30 14 * * 1-5").build());

        for (ReportSchedule s : schedules) {
            Instant cursor = Instant.parse("2024-01-15T00:00:00Z");
            for (int i = 0; i < 24; i++) {
                Instant next = ScheduleTimeUtils.computeNextRun(s, cursor);
                assertNotNull(next, s.getFrequency() + " has no occurrence after " + cursor);
                assertTrue(next.isAfter(cursor), s.getFrequency() + ": " + next + " not after " + cursor);
                assertEquals(next, ScheduleTimeUtils.computeNextRun(s, next.minusSeconds(1)),
                        s.getFrequency() + " skipped an occurrence before " + next);
                cursor = next;
            }
        }
    }

    @Test
    void computeNextRun_Weekly_SameWeekday_DependsOnTimeOfDay() {
        // 2024-01-03 is a Wednesday
        ReportSchedule s = schedule(Frequency.WEEKLY).dayOfWeek(3).build();

        assertEquals(Instant.parse("2024-01-03T09:00:00Z"),
                ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-01-03T08:00:00Z")));
        assertEquals(Instant.parse("2024-01-10T09:00:00Z"),
                ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-01-03T09:00:00Z")));
        assertEquals(Instant.parse("2024-01-10T09:00:00Z"),
                ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-01-03T10:00:00Z")));
    }

    @Test
    void computeNextRun_PastEndDate_ReturnsNull() {
        ReportSchedule s = schedule(Frequency.DAILY).endDate(Instant.parse("2024-01-05T00:00:00Z")).build();

        assertEquals(Instant.parse("2024-01-04T09:00:00Z"),
                ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-01-03T10:00:00Z")));
        assertNull(ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-01-04T10:00:00Z")));
    }

    @Test
    void computeNextRun_Monthly_ClampsToLastDayOfShortMonth() {
        ReportSchedule s = schedule(Frequency.MONTHLY).dayOfMonth(31).build();

        assertEquals(Instant.parse("2024-02-29T09:00:00Z"),
                ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-02-01T00:00:00Z")));
        assertEquals(Instant.parse("2024-01-31T09:00:00Z"),
                ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-01-20T10:00:00Z")));
    }

    @Test
    void computeNextRun_Monthly_DoesNotDriftAfterClamping() {
        ReportSchedule s = schedule(Frequency.MONTHLY).dayOfMonth(31).build();

        Instant afterFebruary = ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-02-29T09:00:00Z"));

        assertEquals(Instant.parse("2024-03-31T09:00:00Z"), afterFebruary);
    }

    @Test
    void computeNextRun_Weekly_UsesSundayAsZero() {
        // 2024-01-03 is a Wednesday
        Instant from = Instant.parse("2024-01-03T12:00:00Z");

        assertEquals(Instant.parse("2024-01-08T09:00:00Z"),
                ScheduleTimeUtils.computeNextRun(schedule(Frequency.WEEKLY).dayOfWeek(1).build(), from));
        assertEquals(Instant.parse("2024-01-07T09:00:00Z"),
                ScheduleTimeUtils.computeNextRun(schedule(Frequency.WEEKLY).dayOfWeek(0).build(), from));
    }

    @Test
    void computeNextRun_Quarterly_FiresInFirstMonthOfEachQuarter() {
        ReportSchedule s = schedule(Frequency.QUARTERLY).dayOfMonth(15).build();

        assertEquals(Instant.parse("2024-01-15T09:00:00Z"),
                ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-01-10T00:00:00Z")));
        assertEquals(Instant.parse("2024-04-15T09:00:00Z"),
                ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-02-20T00:00:00Z")));
        assertEquals(Instant.parse("2025-01-15T09:00:00Z"),
                ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-10-15T09:00:00Z")));
    }

    @Test
    void computeNextRun_Yearly_RepeatsInStartMonth() {
        ReportSchedule s = schedule(Frequency.YEARLY)
                .startDate(Instant.parse("2023-06-10T00:00:00Z"))
                .dayOfMonth(10)
                .build();

        assertEquals(Instant.parse("2025-06-10T09:00:00Z"),
                ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-07-01T00:00:00Z")));
    }

    @Test
    void computeNextRun_Custom_UsesCronExpression() {
        ReportSchedule s = schedule(Frequency.CUSTOM).customCronExpression("30 14 * * 1-5").build();

        // 2024-01-06 is a Saturday
        Instant next = ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-01-06T00:00:00Z"));

        assertEquals(Instant.parse("2024-01-08T14:30:00Z"), next);
    }

    @Test
    void computeNextRun_Once_ReturnsStartUntilItPasses() {
        Instant start = Instant.parse("2024-05-01T10:00:00Z");
        ReportSchedule s = schedule(Frequency.ONCE).startDate(start).build();

        assertEquals(start, ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-04-01T00:00:00Z")));
        assertEquals(start, ScheduleTimeUtils.computeNextRun(s, start));
        assertNull(ScheduleTimeUtils.computeNextRun(s, start.plusSeconds(1)));
    }

    @Test
    void computeNextRun_KeepsLocalTimeAcrossDaylightSavingChange() {
        ReportSchedule s = schedule(Frequency.DAILY).timezone("America/New_York").build();

        // 09:00 EST is 14:00Z, after the March 10 switch 09:00 EDT is 13:00Z
        assertEquals(Instant.parse("2024-03-09T14:00:00Z"),
                ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-03-08T15:00:00Z")));
        assertEquals(Instant.parse("2024-03-10T13:00:00Z"),
                ScheduleTimeUtils.computeNextRun(s, Instant.parse("2024-03-09T15:00:00Z")));
    }

    @Test
    void toCronExpression_MapsStructuredFields() {
        assertEquals("0 9 * * *", ScheduleTimeUtils.toCronExpression(schedule(Frequency.DAILY).build()));
        assertEquals("0 9 * * 5",
                ScheduleTimeUtils.toCronExpression(schedule(Frequency.WEEKLY).dayOfWeek(5).build()));
        assertEquals("0 9 15 */3 *",
                ScheduleTimeUtils.toCronExpression(schedule(Frequency.QUARTERLY).dayOfMonth(15).build()));
        assertNull(ScheduleTimeUtils.toCronExpression(schedule(Frequency.ONCE).build()));
    }

    @Test
    void clampToMonth_LeapAndNonLeapFebruary() {
        assertEquals(LocalDate.of(2024, 2, 29), ScheduleTimeUtils.clampToMonth(YearMonth.of(2024, 2), 31));
        assertEquals(LocalDate.of(2023, 2, 28), ScheduleTimeUtils.clampToMonth(YearMonth.of(2023, 2), 30));
        assertEquals(LocalDate.of(2023, 4, 12), ScheduleTimeUtils.clampToMonth(YearMonth.of(2023, 4), 12));
    }

    @Test
    void toDayOfWeek_ZeroIsSunday() {
        assertEquals(DayOfWeek.SUNDAY, ScheduleTimeUtils.toDayOfWeek(0));
        assertEquals(DayOfWeek.MONDAY, ScheduleTimeUtils.toDayOfWeek(1));
        assertEquals(DayOfWeek.SATURDAY, ScheduleTimeUtils.toDayOfWeek(6));
    }
}
