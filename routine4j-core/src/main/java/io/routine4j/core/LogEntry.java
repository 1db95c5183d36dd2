package io.routine4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one finished run.
 *
 * <p>{@code jobName} is a snapshot taken when the run started. {@code runTime} is the completion instant.
 */
public record LogEntry(
        String id,
        String jobId,
        String jobName,
        Instant startedAt,
        Instant runTime,
        String output,
        RunStatus status,
        RunTrigger trigger
) {
    public LogEntry {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(jobName, "jobName must not be null");
        Objects.requireNonNull(runTime, "runTime must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        output = output == null ? "" : output;
    }
}
