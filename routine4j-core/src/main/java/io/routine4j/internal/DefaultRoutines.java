package io.routine4j.internal;

import io.routine4j.Routines;
import io.routine4j.config.RoutineProperties;
import io.routine4j.core.Job;
import io.routine4j.core.JobAlreadyRunningException;
import io.routine4j.core.JobDefinition;
import io.routine4j.core.LogEntry;
import io.routine4j.core.RunTrigger;
import io.routine4j.spi.LogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polling scheduler that dispatches due jobs to a {@link RunExecutor}.
 *
 * <p>Core behavior:
 * <ul>
 *   <li>A single daemon thread ticks every {@code pollInterval}</li>
 *   <li>Each tick dispatches every due job without waiting for it to finish</li>
 *   <li>Missed occurrences are skipped: a job that was due several times since the last tick runs once</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * Routines routines = new DefaultRoutines(props, registry, executor, logStore, Clock.systemUTC());
 * routines.start();
 * routines.create(JobDefinition.of("cleanup", "hourly", "15"));
 * routines.stop();
 * }</pre>
 */
public class DefaultRoutines implements Routines {
    private static final Logger log = LoggerFactory.getLogger(DefaultRoutines.class);

    private final RoutineProperties props;
    private final JobRegistry registry;
    private final RunExecutor executor;
    private final LogStore logStore;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private Thread pollerThread;
    private int systemErrorCount = 0;

    public DefaultRoutines(RoutineProperties props, JobRegistry registry, RunExecutor executor, LogStore logStore, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start polling for due jobs. Idempotent; a stopped instance cannot be restarted.
     */
    @Override
    public synchronized void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Routines cannot be restarted after stop()");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getPollInterval(), "routine.pollInterval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("routine.pollInterval must be a positive duration");
        }

        log.info("Routines starting with pollInterval={}, executionTimeout={}, timezone={}, maxConcurrency={}, store={}",
                props.getPollInterval(),
                props.getExecutionTimeout(),
                props.zoneId(),
                props.getMaxConcurrency(),
                props.getStore());

        int moved = registry.reschedule(clock.instant());
        if (moved > 0) {
            log.info("Routines skipped missed runs for {} job(s)", moved);
        }

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("routine.poller");
        pollerThread.setDaemon(true);
        pollerThread.start();
        log.info("Routines started successfully.");
    }

    /**
     * Stop polling, then let in-flight runs finish within the grace period. Idempotent.
     */
    @Override
    public synchronized void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        started.set(false);

        log.info("Routines stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }

        executor.shutdown(props.getShutdownGracePeriod());
        log.info("Routines stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public Job create(JobDefinition definition) {
        return registry.create(definition);
    }

    @Override
    public Job toggle(String jobId) {
        return registry.toggle(jobId);
    }

    @Override
    public Job get(String jobId) {
        return registry.get(jobId);
    }

    @Override
    public List<Job> jobs() {
        return registry.list();
    }

    @Override
    public LogEntry runNow(String jobId) {
        Job job = registry.get(jobId);
        log.info("Routine job triggered manually id={} name={}", job.id(), job.name());
        return executor.run(job, RunTrigger.MANUAL);
    }

    @Override
    public List<LogEntry> logs() {
        return logStore.list();
    }

    @Override
    public List<LogEntry> logs(String jobId) {
        registry.get(jobId);
        return logStore.listByJob(jobId);
    }

    /**
     * Dispatch every job due at the current instant.
     *
     * @return number of runs dispatched
     */
    int tickOnce() {
        Instant now = clock.instant();
        List<Job> due = registry.due(now);
        if (due.isEmpty()) {
            return 0;
        }

        log.debug("Routines tick found due jobs count={} now={}", due.size(), now);
        int dispatched = 0;
        for (Job job : due) {
            try {
                if (executor.submitIfDue(job, now).isPresent()) {
                    dispatched++;
                }
            } catch (JobAlreadyRunningException e) {
                log.debug("Routine job still running, skipping this tick id={} name={}", job.id(), job.name());
            } catch (IllegalStateException e) {
                log.warn("Routine job not dispatched id={} msg={}", job.id(), e.getMessage());
            }
        }
        return dispatched;
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                tickOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("Routines tick failed msg={}", e.getMessage(), e);

                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                Thread.sleep(props.getPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated tick failures.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
