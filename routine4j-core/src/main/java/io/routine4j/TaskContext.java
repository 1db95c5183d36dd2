package io.routine4j;

import io.routine4j.core.Job;
import io.routine4j.core.RunTrigger;

import java.io.PrintWriter;

/**
 * Passed to a {@link JobTask} for one run.
 *
 * <p>Text written to {@link #out()} becomes the run's log output. Tasks should return promptly
 * when their thread is interrupted; that is how timeouts and shutdown cancel them.
 */
public record TaskContext(
        Job job,
        RunTrigger trigger,
        PrintWriter out
) {
}
