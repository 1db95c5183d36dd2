package io.routine4j.server.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.routine4j.core.LogEntry;

import java.time.Instant;

public record LogEntryResponse(
        String id,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("job_name") String jobName,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("run_time") Instant runTime,
        String output,
        String status,
        String trigger
) {
    public static LogEntryResponse from(LogEntry entry) {
        return new LogEntryResponse(
                entry.id(),
                entry.jobId(),
                entry.jobName(),
                entry.startedAt(),
                entry.runTime(),
                entry.output(),
                entry.status().name(),
                entry.trigger().name()
        );
    }
}
