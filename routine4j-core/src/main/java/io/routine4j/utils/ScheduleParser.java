package io.routine4j.utils;

import io.routine4j.core.InvalidScheduleFormatException;
import io.routine4j.core.ScheduleSpec;
import io.routine4j.core.ScheduleType;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a job type and its raw time string into a {@link ScheduleSpec}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>hourly: minute of the hour, "0".."59" (e.g. "15")</li>
 *   <li>daily: "HH:MM" (e.g. "14:30", "7:05")</li>
 *   <li>weekly: "ddd HH:MM" with a three-letter weekday, any case (e.g. "mon 12:45")</li>
 * </ul>
 */
public final class ScheduleParser {

    private static final Pattern MINUTE = Pattern.compile("^\\d{1,2}$");
    private static final Pattern HOUR_MINUTE = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
    private static final Pattern WEEKDAY_HOUR_MINUTE = Pattern.compile("^([A-Za-z]{3})\\s+(\\d{1,2}:\\d{2})$");

    private static final Map<String, DayOfWeek> WEEKDAYS = Map.of(
            "mon", DayOfWeek.MONDAY,
            "tue", DayOfWeek.TUESDAY,
            "wed", DayOfWeek.WEDNESDAY,
            "thu", DayOfWeek.THURSDAY,
            "fri", DayOfWeek.FRIDAY,
            "sat", DayOfWeek.SATURDAY,
            "sun", DayOfWeek.SUNDAY
    );

    private ScheduleParser() {
    }

    /**
     * Parse using the wire name of the type ("hourly", "daily", "weekly").
     */
    public static ScheduleSpec parse(String type, String raw) {
        return parse(ScheduleType.fromId(type), raw);
    }

    public static ScheduleSpec parse(ScheduleType type, String raw) {
        if (type == null) {
            throw new InvalidScheduleFormatException("Job type must not be null");
        }
        if (raw == null || raw.isBlank()) {
            throw new InvalidScheduleFormatException("Time must not be blank for " + type.id() + " jobs");
        }

        String s = raw.trim();
        return switch (type) {
            case HOURLY -> new ScheduleSpec.Hourly(parseMinute(s));
            case DAILY -> {
                int[] hm = parseHourMinute(s, raw);
                yield new ScheduleSpec.Daily(hm[0], hm[1]);
            }
            case WEEKLY -> parseWeekly(s, raw);
        };
    }

    private static int parseMinute(String s) {
        if (!MINUTE.matcher(s).matches()) {
            throw new InvalidScheduleFormatException("Hourly time must be a minute between 0 and 59: " + s);
        }
        int minute = Integer.parseInt(s);
        if (minute > 59) {
            throw new InvalidScheduleFormatException("Hourly time must be a minute between 0 and 59: " + s);
        }
        return minute;
    }

    private static int[] parseHourMinute(String s, String raw) {
        Matcher m = HOUR_MINUTE.matcher(s);
        if (!m.matches()) {
            throw new InvalidScheduleFormatException("Expected HH:MM but got: " + raw);
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        if (hour > 23) {
            throw new InvalidScheduleFormatException("Hour must be between 0 and 23: " + raw);
        }
        if (minute > 59) {
            throw new InvalidScheduleFormatException("Minute must be between 0 and 59: " + raw);
        }
        return new int[]{hour, minute};
    }

    private static ScheduleSpec.Weekly parseWeekly(String s, String raw) {
        Matcher m = WEEKDAY_HOUR_MINUTE.matcher(s);
        if (!m.matches()) {
            throw new InvalidScheduleFormatException("Expected '<day> HH:MM' (e.g. 'mon 12:45') but got: " + raw);
        }
        DayOfWeek day = WEEKDAYS.get(m.group(1).toLowerCase(Locale.ROOT));
        if (day == null) {
            throw new InvalidScheduleFormatException("Unknown weekday '" + m.group(1) + "', expected one of mon..sun");
        }
        int[] hm = parseHourMinute(m.group(2), raw);
        return new ScheduleSpec.Weekly(day, hm[0], hm[1]);
    }
}
