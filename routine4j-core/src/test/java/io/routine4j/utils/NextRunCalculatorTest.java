package io.routine4j.utils;

import io.routine4j.core.ScheduleSpec;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NextRunCalculatorTest {

    private final NextRunCalculator utc = new NextRunCalculator(ZoneOffset.UTC);

    @Test
    void hourlyShouldAdvanceToNextHourWhenMinutePassed() {
        Instant next = utc.nextRun(new ScheduleSpec.Hourly(15), Instant.parse("2026-10-20T10:20:00Z"));
        assertEquals(Instant.parse("2026-10-20T11:15:00Z"), next);
    }

    @Test
    void hourlyShouldStayInSameHourWhenMinuteAhead() {
        Instant next = utc.nextRun(new ScheduleSpec.Hourly(15), Instant.parse("2026-10-20T10:10:00Z"));
        assertEquals(Instant.parse("2026-10-20T10:15:00Z"), next);
    }

    @Test
    void exactTriggerInstantShouldMoveToNextOccurrence() {
        Instant next = utc.nextRun(new ScheduleSpec.Hourly(15), Instant.parse("2026-10-20T10:15:00Z"));
        assertEquals(Instant.parse("2026-10-20T11:15:00Z"), next);
    }

    @Test
    void subSecondBeforeTriggerShouldStillHitTrigger() {
        Instant next = utc.nextRun(new ScheduleSpec.Hourly(15), Instant.parse("2026-10-20T10:14:59.800Z"));
        assertEquals(Instant.parse("2026-10-20T10:15:00Z"), next);
    }

    @Test
    void dailyShouldMoveToNextDayWhenTimePassed() {
        Instant next = utc.nextRun(new ScheduleSpec.Daily(14, 30), Instant.parse("2026-10-20T15:00:00Z"));
        assertEquals(Instant.parse("2026-10-21T14:30:00Z"), next);
    }

    @Test
    void dailyShouldUseSameDayWhenTimeAhead() {
        Instant next = utc.nextRun(new ScheduleSpec.Daily(14, 30), Instant.parse("2026-10-20T14:00:00Z"));
        assertEquals(Instant.parse("2026-10-20T14:30:00Z"), next);
    }

    @Test
    void weeklyFromTuesdayShouldPickNextMonday() {
        Instant next = utc.nextRun(
                new ScheduleSpec.Weekly(DayOfWeek.MONDAY, 12, 45),
                Instant.parse("2026-10-20T09:00:00Z"));
        assertEquals(Instant.parse("2026-10-26T12:45:00Z"), next);
    }

    @Test
    void weeklyOnSameDayBeforeTimeShouldPickToday() {
        Instant next = utc.nextRun(
                new ScheduleSpec.Weekly(DayOfWeek.MONDAY, 12, 45),
                Instant.parse("2026-10-19T12:00:00Z"));
        assertEquals(Instant.parse("2026-10-19T12:45:00Z"), next);
    }

    @Test
    void weeklyOnSameDayAfterTimeShouldWaitAWeek() {
        Instant next = utc.nextRun(
                new ScheduleSpec.Weekly(DayOfWeek.MONDAY, 12, 45),
                Instant.parse("2026-10-19T12:45:00Z"));
        assertEquals(Instant.parse("2026-10-26T12:45:00Z"), next);
    }

    @Test
    void calculationShouldHappenInConfiguredZone() {
        NextRunCalculator taipei = new NextRunCalculator(ZoneId.of("Asia/Taipei"));
        Instant next = taipei.nextRun(new ScheduleSpec.Daily(14, 30), Instant.parse("2026-10-20T00:00:00Z"));
        assertEquals(Instant.parse("2026-10-20T06:30:00Z"), next);
    }

    @Test
    void nextRunShouldAlwaysBeStrictlyAfterFrom() {
        List<ScheduleSpec> specs = List.of(
                new ScheduleSpec.Hourly(0),
                new ScheduleSpec.Hourly(59),
                new ScheduleSpec.Daily(0, 0),
                new ScheduleSpec.Daily(23, 59),
                new ScheduleSpec.Weekly(DayOfWeek.SUNDAY, 23, 59),
                new ScheduleSpec.Weekly(DayOfWeek.WEDNESDAY, 6, 30)
        );
        NextRunCalculator taipei = new NextRunCalculator(ZoneId.of("Asia/Taipei"));
        Random random = new Random(42);
        Instant base = Instant.parse("2026-01-01T00:00:00Z");

        for (int i = 0; i < 500; i++) {
            Instant from = base.plusSeconds(random.nextInt(366 * 24 * 3600));
            for (ScheduleSpec spec : specs) {
                Instant next = taipei.nextRun(spec, from);
                assertTrue(next.isAfter(from), () -> spec + " from " + from + " gave " + next);
                assertEquals(0, next.getEpochSecond() % 60, () -> spec + " gave non-zero seconds " + next);
                assertTrue(Duration.between(from, next).compareTo(Duration.ofDays(8)) < 0);
            }
        }
    }

    @Test
    void repeatedCallsShouldMakeProgress() {
        ScheduleSpec spec = new ScheduleSpec.Hourly(30);
        Instant t = Instant.parse("2026-10-20T00:00:00Z");
        for (int i = 0; i < 5; i++) {
            Instant next = utc.nextRun(spec, t);
            assertTrue(next.isAfter(t));
            t = next;
        }
        assertEquals(Instant.parse("2026-10-20T04:30:00Z"), t);
    }
}
