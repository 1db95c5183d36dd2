package io.routine4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a recurring job.
 *
 * <p>A job is scheduled exactly when it is enabled: {@code nextRun} is non-null iff {@code enabled}.
 * {@link io.routine4j.internal.JobRegistry} produces a new snapshot for every change.
 */
public record Job(

        // identity
        String id,
        String name,

        // scheduling
        ScheduleType type,
        String time,
        ScheduleSpec schedule,
        boolean enabled,
        Instant lastRun,
        Instant nextRun,

        // execution
        String task,

        Instant createdAt
) {
    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(time, "time must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (schedule.type() != type) {
            throw new IllegalArgumentException("schedule " + schedule + " does not match type " + type);
        }
        if (enabled && nextRun == null) {
            throw new IllegalArgumentException("enabled job must have a nextRun: " + id);
        }
        if (!enabled && nextRun != null) {
            throw new IllegalArgumentException("disabled job must not have a nextRun: " + id);
        }
    }

    /**
     * Returns a copy with the given enabled flag and next run.
     */
    public Job withEnabled(boolean enabled, Instant nextRun) {
        return new Job(id, name, type, time, schedule, enabled, lastRun, nextRun, task, createdAt);
    }

    /**
     * Returns a copy reflecting a completed run.
     */
    public Job withRun(Instant lastRun, Instant nextRun) {
        return new Job(id, name, type, time, schedule, enabled, lastRun, nextRun, task, createdAt);
    }

    public boolean isDue(Instant now) {
        return enabled && !nextRun.isAfter(now);
    }
}
