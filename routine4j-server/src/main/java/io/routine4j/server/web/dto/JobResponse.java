package io.routine4j.server.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.routine4j.core.Job;

import java.time.Instant;

public record JobResponse(
        String id,
        String name,
        String type,
        String time,
        String task,
        boolean enabled,
        @JsonProperty("last_run") Instant lastRun,
        @JsonProperty("next_run") Instant nextRun
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.name(),
                job.type().id(),
                job.time(),
                job.task(),
                job.enabled(),
                job.lastRun(),
                job.nextRun()
        );
    }
}
