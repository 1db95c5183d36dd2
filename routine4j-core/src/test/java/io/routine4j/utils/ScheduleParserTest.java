package io.routine4j.utils;

import io.routine4j.core.InvalidScheduleFormatException;
import io.routine4j.core.ScheduleSpec;
import io.routine4j.core.ScheduleType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.DayOfWeek;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScheduleParserTest {

    @Test
    void parseHourlyShouldReadMinute() {
        assertEquals(new ScheduleSpec.Hourly(15), ScheduleParser.parse("hourly", "15"));
        assertEquals(new ScheduleSpec.Hourly(5), ScheduleParser.parse("hourly", "05"));
        assertEquals(new ScheduleSpec.Hourly(0), ScheduleParser.parse("hourly", " 0 "));
    }

    @Test
    void parseDailyShouldReadHourAndMinute() {
        assertEquals(new ScheduleSpec.Daily(14, 30), ScheduleParser.parse("daily", "14:30"));
        assertEquals(new ScheduleSpec.Daily(7, 5), ScheduleParser.parse("daily", "7:05"));
        assertEquals(new ScheduleSpec.Daily(23, 59), ScheduleParser.parse(ScheduleType.DAILY, "23:59"));
    }

    @Test
    void parseWeeklyShouldAcceptAnyCaseWeekday() {
        assertEquals(new ScheduleSpec.Weekly(DayOfWeek.MONDAY, 12, 45), ScheduleParser.parse("weekly", "mon 12:45"));
        assertEquals(new ScheduleSpec.Weekly(DayOfWeek.SUNDAY, 0, 0), ScheduleParser.parse("weekly", "SUN 00:00"));
        assertEquals(new ScheduleSpec.Weekly(DayOfWeek.FRIDAY, 9, 0), ScheduleParser.parse("weekly", "Fri   9:00"));
    }

    @Test
    void typeNameShouldBeCaseInsensitive() {
        assertEquals(new ScheduleSpec.Daily(1, 2), ScheduleParser.parse("Daily", "01:02"));
    }

    @Test
    void parsingTwiceShouldYieldEqualSpecs() {
        assertEquals(ScheduleParser.parse("weekly", "wed 08:15"), ScheduleParser.parse("weekly", "wed 08:15"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"60", "-1", "abc", "1.5", "15:00", "100", ""})
    void invalidHourlyShouldBeRejected(String raw) {
        assertThrows(InvalidScheduleFormatException.class, () -> ScheduleParser.parse("hourly", raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {"24:00", "12:60", "1230", "12:3", "noon", "mon 12:30", "12:30:00"})
    void invalidDailyShouldBeRejected(String raw) {
        assertThrows(InvalidScheduleFormatException.class, () -> ScheduleParser.parse("daily", raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {"monday 12:45", "xyz 12:45", "mon", "12:45", "mon 25:00", "mon 12:75", "mon12:45"})
    void invalidWeeklyShouldBeRejected(String raw) {
        assertThrows(InvalidScheduleFormatException.class, () -> ScheduleParser.parse("weekly", raw));
    }

    @ParameterizedTest
    @CsvSource({"monthly,1", "'',10"})
    void unknownTypeShouldBeRejected(String type, String raw) {
        assertThrows(InvalidScheduleFormatException.class, () -> ScheduleParser.parse(type, raw));
    }

    @Test
    void nullTimeShouldBeRejected() {
        assertThrows(InvalidScheduleFormatException.class, () -> ScheduleParser.parse("daily", null));
    }

    @Test
    void cronRenderingShouldUseQuartzSyntax() {
        assertEquals("0 15 * * * ?", new ScheduleSpec.Hourly(15).toCron());
        assertEquals("0 30 14 * * ?", new ScheduleSpec.Daily(14, 30).toCron());
        assertEquals("0 45 12 ? * MON", new ScheduleSpec.Weekly(DayOfWeek.MONDAY, 12, 45).toCron());
    }
}
