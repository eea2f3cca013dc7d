package com.digitalgroup.reportscheduler.util;

import org.springframework.scheduling.support.CronExpression;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.Month;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Five-field cron expressions: minute hour day-of-month month day-of-week.
 * Parsing and evaluation delegate to Spring's {@link CronExpression} with a
 * fixed "0" seconds field. Day-of-week accepts 0-7 (0 and 7 are Sunday) and
 * three-letter names; when both day fields are restricted, both must match.
 */
public final class CronUtils {

    public static final int FIELD_COUNT = 5;

    private static final String INVALID_DESCRIPTION = "Invalid cron expression";

    private CronUtils() {}

    /**
     * Collapses whitespace into single spaces. Returns null for blank input.
     */
    public static String canonicalize(String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        return String.join(" ", expression.trim().split("\\s+"));
    }

    /**
     * Parses a five-field expression.
     *
     * @throws IllegalArgumentException when the expression is blank, has the wrong
     *                                  number of fields or a field is out of range
     */
    public static CronExpression parse(String expression) {
        String canonical = canonicalize(expression);
        if (canonical == null) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        int fields = canonical.split(" ").length;
        if (fields != FIELD_COUNT) {
            throw new IllegalArgumentException(
                    "Cron expression must have 5 fields (minute hour day-of-month month day-of-week), got " + fields);
        }
        return CronExpression.parse("0 " + canonical);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Earliest instant strictly after {@code from} matching the expression in {@code zone},
     * or null when the expression never fires again.
     */
    public static Instant nextAfter(String expression, Instant from, ZoneId zone) {
        ZonedDateTime next = parse(expression).next(from.atZone(zone));
        return next != null ? next.toInstant() : null;
    }

    /**
     * The next {@code count} fire times after {@code from}.
     */
    public static List<Instant> preview(String expression, Instant from, ZoneId zone, int count) {
        CronExpression cron = parse(expression);
        List<Instant> result = new ArrayList<>();
        ZonedDateTime cursor = from.atZone(zone);
        for (int i = 0; i < count; i++) {
            cursor = cron.next(cursor);
            if (cursor == null) {
                break;
            }
            result.add(cursor.toInstant());
        }
        return result;
    }

    /**
     * Short English sentence for display, e.g. "at 09:00, every Monday".
     * Output is illustrative only and is never parsed back.
     */
    public static String describe(String expression) {
        if (!isValid(expression)) {
            return INVALID_DESCRIPTION;
        }
        String[] f = canonicalize(expression).split(" ");
        String minute = f[0];
        String hour = f[1];
        String dayOfMonth = f[2];
        String month = f[3];
        String dayOfWeek = f[4];

        StringBuilder sb = new StringBuilder(describeTime(minute, hour));

        boolean anyDay = isWildcard(dayOfMonth) && isWildcard(dayOfWeek);
        if (!isWildcard(dayOfWeek)) {
            sb.append(", ").append(describeDaysOfWeek(dayOfWeek));
        }
        if (!isWildcard(dayOfMonth)) {
            sb.append(", ").append(describeDaysOfMonth(dayOfMonth));
        }
        if (!isWildcard(month)) {
            sb.append(", ").append(describeMonths(month));
        } else if (anyDay) {
            sb.append(", every day");
        }
        return sb.toString();
    }

    // ==================== DESCRIPTION HELPERS ====================

    private static String describeTime(String minute, String hour) {
        if (isNumber(minute) && isNumber(hour)) {
            return String.format("at %02d:%02d", Integer.parseInt(hour), Integer.parseInt(minute));
        }
        String minutePart;
        if (isWildcard(minute)) {
            minutePart = "every minute";
        } else if (minute.startsWith("*/")) {
            minutePart = "every " + minute.substring(2) + " minutes";
        } else {
            minutePart = "at minute " + minute;
        }
        if (isWildcard(hour)) {
            return isNumber(minute) ? minutePart + " past every hour" : minutePart;
        }
        if (hour.startsWith("*/")) {
            return minutePart + ", every " + hour.substring(2) + " hours";
        }
        return minutePart + ", during hour " + hour;
    }

    private static String describeDaysOfWeek(String field) {
        if (field.startsWith("*/")) {
            return "every " + field.substring(2) + " days of the week";
        }
        if (field.contains(",")) {
            List<String> names = new ArrayList<>();
            for (String part : field.split(",")) {
                names.add(describeDayOfWeekRange(part));
            }
            return "on " + joinWithAnd(names);
        }
        if (field.contains("-")) {
            return describeDayOfWeekRange(field);
        }
        return "every " + dayName(field);
    }

    private static String describeDayOfWeekRange(String part) {
        if (part.contains("-")) {
            String[] bounds = part.split("-", 2);
            return dayName(bounds[0]) + " through " + dayName(bounds[1]);
        }
        return dayName(part);
    }

    private static String describeDaysOfMonth(String field) {
        if ("L".equalsIgnoreCase(field)) {
            return "on the last day of the month";
        }
        if (field.startsWith("*/")) {
            return "every " + field.substring(2) + " days";
        }
        if (field.contains("-")) {
            String[] bounds = field.split("-", 2);
            return "between day " + bounds[0] + " and " + bounds[1] + " of the month";
        }
        return "on day " + field + " of the month";
    }

    private static String describeMonths(String field) {
        if (field.startsWith("*/")) {
            return "every " + field.substring(2) + " months";
        }
        if (field.contains(",")) {
            List<String> names = new ArrayList<>();
            for (String part : field.split(",")) {
                names.add(monthName(part));
            }
            return "only in " + joinWithAnd(names);
        }
        if (field.contains("-")) {
            String[] bounds = field.split("-", 2);
            return monthName(bounds[0]) + " through " + monthName(bounds[1]);
        }
        return "only in " + monthName(field);
    }

    private static String dayName(String token) {
        if (!isNumber(token)) {
            return token;
        }
        int value = Integer.parseInt(token) % 7;
        DayOfWeek day = value == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(value);
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    private static String monthName(String token) {
        if (!isNumber(token)) {
            return token;
        }
        return Month.of(Integer.parseInt(token)).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    private static String joinWithAnd(List<String> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return String.join(", ", parts.subList(0, parts.size() - 1)) + " and " + parts.get(parts.size() - 1);
    }

    private static boolean isWildcard(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static boolean isNumber(String field) {
        return field != null && !field.isEmpty() && field.chars().allMatch(Character::isDigit);
    }
}
