package io.routine4j;

import io.routine4j.core.Job;
import io.routine4j.core.JobDefinition;
import io.routine4j.core.LogEntry;

import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>Jobs recur hourly, daily or weekly. Once {@link #start()} is called, due jobs run automatically;
 * {@link #runNow(String)} triggers a job on demand. Every finished run is kept in the run history.
 *
 * <p>Typical usage:
 * <pre>{@code
 * routines.start();
 *
 * Job job = routines.create(JobDefinition.of("nightly-report", "daily", "02:30"));
 * routines.runNow(job.id());
 * routines.logs();
 *
 * routines.stop();
 * }</pre>
 */
public interface Routines {
    void start();

    void stop();

    /**
     * True between {@link #start()} and {@link #stop()}.
     */
    boolean isRunning();

    /**
     * Create a job and schedule its first run.
     *
     * @throws io.routine4j.core.InvalidScheduleFormatException if type/time cannot be parsed
     * @throws io.routine4j.core.InvalidJobException            if the name is blank or the task is unknown
     */
    Job create(JobDefinition definition);

    /**
     * Flip the enabled flag. Enabling schedules the next occurrence from now; disabling clears it.
     *
     * @throws io.routine4j.core.JobNotFoundException if the id is unknown
     */
    Job toggle(String jobId);

    Job get(String jobId);

    /**
     * All jobs in creation order.
     */
    List<Job> jobs();

    /**
     * Run a job immediately on the calling thread and return its log entry.
     *
     * @throws io.routine4j.core.JobNotFoundException       if the id is unknown
     * @throws io.routine4j.core.JobAlreadyRunningException if the job is already running
     */
    LogEntry runNow(String jobId);

    /**
     * Run history, newest first.
     */
    List<LogEntry> logs();

    List<LogEntry> logs(String jobId);
}
