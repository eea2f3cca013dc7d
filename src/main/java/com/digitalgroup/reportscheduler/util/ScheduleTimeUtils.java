package com.digitalgroup.reportscheduler.util;

import com.digitalgroup.reportscheduler.domain.common.enums.Frequency;
import com.digitalgroup.reportscheduler.domain.schedule.entity.ReportSchedule;

import java.time.*;
import java.util.Objects;

/**
 * Next-occurrence arithmetic for report schedules.
 * Pure functions: no clock, no I/O. All wall-clock fields are interpreted in the
 * schedule's timezone, so a 09:00 daily schedule stays at 09:00 across DST changes.
 */
public final class ScheduleTimeUtils {

    private static final LocalTime DEFAULT_TIME = LocalTime.of(9, 0);
    private static final int DEFAULT_DAY_OF_WEEK = 1; // Monday
    private static final int DEFAULT_DAY_OF_MONTH = 1;

    private ScheduleTimeUtils() {}

    /**
     * Computes the next execution instant after {@code from}.
     * <ul>
     *   <li>ONCE: the start date while it is not before {@code from}, else null.</li>
     *   <li>Recurring: the earliest occurrence strictly after {@code from} and not before the start date.</li>
     *   <li>null when the occurrence would fall after the end date.</li>
     * </ul>
     * Day-of-month values beyond the target month's length are clamped to its last day.
     */
    public static Instant computeNextRun(ReportSchedule schedule, Instant from) {
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(from, "from");

        Instant candidate;
        if (schedule.getFrequency() == Frequency.ONCE) {
            Instant start = schedule.getStartDate();
            candidate = start != null && !start.isBefore(from) ? start : null;
        } else {
            Instant effectiveFrom = from;
            Instant start = schedule.getStartDate();
            if (start != null && start.isAfter(from)) {
                // an occurrence exactly at the start date is eligible
                effectiveFrom = start.minusNanos(1);
            }
            candidate = nextRecurring(schedule, effectiveFrom);
        }

        if (candidate != null && schedule.getEndDate() != null && candidate.isAfter(schedule.getEndDate())) {
            return null;
        }
        return candidate;
    }

    /**
     * Five-field cron form of the schedule. Null for ONCE, which has no cron form.
     * The cron form does not carry day-of-month clamping; it is for display and export.
     */
    public static String toCronExpression(ReportSchedule schedule) {
        Frequency frequency = schedule.getFrequency();
        if (frequency == null || frequency == Frequency.ONCE) {
            return null;
        }
        if (frequency == Frequency.CUSTOM) {
            return CronUtils.canonicalize(schedule.getCustomCronExpression());
        }

        LocalTime time = timeOf(schedule);
        int minute = time.getMinute();
        int hour = time.getHour();
        int dom = dayOfMonthOf(schedule);

        return switch (frequency) {
            case DAILY -> String.format("%d %d * * *", minute, hour);
            case WEEKLY -> String.format("%d %d * * %d", minute, hour, dayOfWeekOf(schedule));
            case MONTHLY -> String.format("%d %d %d * *", minute, hour, dom);
            case QUARTERLY -> String.format("%d %d %d */3 *", minute, hour, dom);
            case YEARLY -> String.format("%d %d %d %d *", minute, hour, dom, yearlyMonthOf(schedule).getValue());
            default -> null;
        };
    }

    public static String describe(ReportSchedule schedule) {
        if (schedule.getFrequency() == Frequency.ONCE) {
            return "One-time execution";
        }
        String cron = toCronExpression(schedule);
        return cron != null ? CronUtils.describe(cron) : "One-time execution";
    }

    /**
     * Last day of the given month when {@code dayOfMonth} exceeds its length.
     */
    public static LocalDate clampToMonth(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(Math.max(dayOfMonth, 1), month.lengthOfMonth()));
    }

    // ==================== PER FREQUENCY ====================

    private static Instant nextRecurring(ReportSchedule schedule, Instant from) {
        ZoneId zone = schedule.zoneId();
        ZonedDateTime zonedFrom = from.atZone(zone);

        return switch (schedule.getFrequency()) {
            case DAILY -> nextDaily(zonedFrom, timeOf(schedule), zone);
            case WEEKLY -> nextWeekly(zonedFrom, timeOf(schedule), dayOfWeekOf(schedule), zone);
            case MONTHLY -> nextByMonthStep(YearMonth.from(zonedFrom), 1, zonedFrom, schedule, zone);
            case QUARTERLY -> nextByMonthStep(quarterStart(zonedFrom), 3, zonedFrom, schedule, zone);
            case YEARLY -> nextByMonthStep(
                    YearMonth.of(zonedFrom.getYear(), yearlyMonthOf(schedule)), 12, zonedFrom, schedule, zone);
            case CUSTOM -> CronUtils.nextAfter(schedule.getCustomCronExpression(), from, zone);
            default -> null;
        };
    }

    private static Instant nextDaily(ZonedDateTime from, LocalTime time, ZoneId zone) {
        LocalDate date = from.toLocalDate();
        ZonedDateTime candidate = ZonedDateTime.of(date, time, zone);
        while (!candidate.isAfter(from)) {
            date = date.plusDays(1);
            candidate = ZonedDateTime.of(date, time, zone);
        }
        return candidate.toInstant();
    }

    private static Instant nextWeekly(ZonedDateTime from, LocalTime time, int dayOfWeek, ZoneId zone) {
        DayOfWeek target = toDayOfWeek(dayOfWeek);
        LocalDate date = from.toLocalDate();
        ZonedDateTime candidate = ZonedDateTime.of(date, time, zone);
        while (date.getDayOfWeek() != target || !candidate.isAfter(from)) {
            date = date.plusDays(1);
            candidate = ZonedDateTime.of(date, time, zone);
        }
        return candidate.toInstant();
    }

    private static Instant nextByMonthStep(YearMonth month, int stepMonths, ZonedDateTime from,
                                           ReportSchedule schedule, ZoneId zone) {
        LocalTime time = timeOf(schedule);
        int dom = dayOfMonthOf(schedule);
        ZonedDateTime candidate = ZonedDateTime.of(clampToMonth(month, dom), time, zone);
        while (!candidate.isAfter(from)) {
            month = month.plusMonths(stepMonths);
            candidate = ZonedDateTime.of(clampToMonth(month, dom), time, zone);
        }
        return candidate.toInstant();
    }

    private static YearMonth quarterStart(ZonedDateTime dateTime) {
        int startMonth = ((dateTime.getMonthValue() - 1) / 3) * 3 + 1;
        return YearMonth.of(dateTime.getYear(), startMonth);
    }

    // ==================== FIELD DEFAULTS ====================

    private static LocalTime timeOf(ReportSchedule schedule) {
        LocalTime time = schedule.getTimeOfDay() != null ? schedule.getTimeOfDay() : DEFAULT_TIME;
        return time.withSecond(0).withNano(0);
    }

    private static int dayOfWeekOf(ReportSchedule schedule) {
        return schedule.getDayOfWeek() != null ? schedule.getDayOfWeek() : DEFAULT_DAY_OF_WEEK;
    }

    private static int dayOfMonthOf(ReportSchedule schedule) {
        return schedule.getDayOfMonth() != null ? schedule.getDayOfMonth() : DEFAULT_DAY_OF_MONTH;
    }

    // yearly schedules repeat in the month of their start date
    private static Month yearlyMonthOf(ReportSchedule schedule) {
        if (schedule.getStartDate() == null) {
            return Month.JANUARY;
        }
        return schedule.getStartDate().atZone(schedule.zoneId()).getMonth();
    }

    // 0 = Sunday, 1 = Monday ... 6 = Saturday
    static DayOfWeek toDayOfWeek(int value) {
        int normalized = Math.floorMod(value, 7);
        return normalized == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(normalized);
    }
}
