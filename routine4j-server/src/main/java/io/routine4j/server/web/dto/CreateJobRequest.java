package io.routine4j.server.web.dto;

import io.routine4j.core.JobDefinition;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /jobs}. {@code task} and {@code enabled} are optional.
 */
public record CreateJobRequest(
        @NotBlank String name,
        @NotBlank String type,
        @NotBlank String time,
        String task,
        Boolean enabled
) {
    public JobDefinition toDefinition() {
        return new JobDefinition(name, type, time, task, enabled == null || enabled);
    }
}
