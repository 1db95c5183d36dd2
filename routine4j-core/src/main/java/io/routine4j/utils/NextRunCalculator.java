package io.routine4j.utils;

import io.routine4j.core.ScheduleSpec;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Computes the next trigger instant of a {@link ScheduleSpec}.
 * <p>
 * The schedule is rendered as a Quartz cron expression and evaluated in one fixed zone. Quartz only
 * returns instants strictly after the reference, so repeated calls always make progress.
 * <p>
 * Note: daylight-saving transitions are handled however Quartz handles them (a skipped wall-clock
 * minute fires at the next valid time, a repeated one fires once).
 */
public final class NextRunCalculator {

    private final ZoneId zone;

    public NextRunCalculator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public static NextRunCalculator systemDefault() {
        return new NextRunCalculator(ZoneId.systemDefault());
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Smallest instant strictly after {@code from} that matches {@code spec}, with seconds = 0.
     */
    public Instant nextRun(ScheduleSpec spec, Instant from) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(from, "from must not be null");

        CronExpression exp = compile(spec);
        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalStateException("Schedule produced no next execution time: " + spec);
        }
        return next.toInstant();
    }

    private CronExpression compile(ScheduleSpec spec) {
        String cron = spec.toCron();
        try {
            CronExpression exp = new CronExpression(cron);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalStateException("Invalid cron expression for " + spec + ": " + cron, ex);
        }
    }
}
