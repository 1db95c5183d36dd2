package io.routine4j.core;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Objects;

/**
 * Structured, validated form of a job's recurrence.
 *
 * <p>Each variant renders itself as a Quartz cron expression (seconds field first), which is what
 * {@link io.routine4j.utils.NextRunCalculator} evaluates.
 */
public sealed interface ScheduleSpec permits ScheduleSpec.Hourly, ScheduleSpec.Daily, ScheduleSpec.Weekly {

    ScheduleType type();

    String toCron();

    /**
     * Every hour at the given minute.
     */
    record Hourly(int minute) implements ScheduleSpec {
        public Hourly {
            requireRange("minute", minute, 59);
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.HOURLY;
        }

        @Override
        public String toCron() {
            return "0 " + minute + " * * * ?";
        }
    }

    /**
     * Every day at hour:minute.
     */
    record Daily(int hour, int minute) implements ScheduleSpec {
        public Daily {
            requireRange("hour", hour, 23);
            requireRange("minute", minute, 59);
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.DAILY;
        }

        @Override
        public String toCron() {
            return "0 " + minute + " " + hour + " * * ?";
        }
    }

    /**
     * Every week on the given day at hour:minute.
     */
    record Weekly(DayOfWeek dayOfWeek, int hour, int minute) implements ScheduleSpec {
        public Weekly {
            Objects.requireNonNull(dayOfWeek, "dayOfWeek must not be null");
            requireRange("hour", hour, 23);
            requireRange("minute", minute, 59);
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.WEEKLY;
        }

        @Override
        public String toCron() {
            String day = dayOfWeek.name().substring(0, 3).toUpperCase(Locale.ROOT);
            return "0 " + minute + " " + hour + " ? * " + day;
        }
    }

    private static void requireRange(String field, int value, int max) {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(field + " must be between 0 and " + max + ": " + value);
        }
    }
}
