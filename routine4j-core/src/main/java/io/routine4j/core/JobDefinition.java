package io.routine4j.core;

/**
 * Input for creating a job. {@code task} may be null to use the configured default task.
 */
public record JobDefinition(
        String name,
        String type,
        String time,
        String task,
        boolean enabled
) {
    public static JobDefinition of(String name, String type, String time) {
        return new JobDefinition(name, type, time, null, true);
    }

    public JobDefinition withTask(String task) {
        return new JobDefinition(name, type, time, task, enabled);
    }

    public JobDefinition disabled() {
        return new JobDefinition(name, type, time, task, false);
    }
}
