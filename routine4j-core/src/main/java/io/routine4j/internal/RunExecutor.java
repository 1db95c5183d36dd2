package io.routine4j.internal;

import io.routine4j.JobTask;
import io.routine4j.TaskContext;
import io.routine4j.config.RoutineProperties;
import io.routine4j.core.Job;
import io.routine4j.core.JobAlreadyRunningException;
import io.routine4j.core.JobNotFoundException;
import io.routine4j.core.LogEntry;
import io.routine4j.core.RunStatus;
import io.routine4j.core.RunTrigger;
import io.routine4j.core.TaskRegistry;
import io.routine4j.spi.LogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs job tasks and turns every outcome into a {@link LogEntry}.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>at most one run per job id at a time; a concurrent request fails with {@link JobAlreadyRunningException}</li>
 *   <li>at most {@code maxConcurrency} tasks execute at once</li>
 *   <li>a task exceeding {@code executionTimeout} is interrupted and logged as {@link RunStatus#TIMEOUT}</li>
 *   <li>task errors never escape; they are logged as {@link RunStatus#FAILURE}</li>
 * </ul>
 *
 * <p>When a run finishes, the registry is updated first, then the entry is appended. The single-flight
 * slot and the concurrency permit are released only once the entry is recorded and the task thread has
 * returned, so a task that ignores interruption after a timeout still blocks new runs of its job.
 * Scheduled dispatch re-reads the job after reserving the slot and skips it unless it is still due.
 */
public class RunExecutor {
    private static final Logger log = LoggerFactory.getLogger(RunExecutor.class);

    private static final long PERMIT_POLL_MILLIS = 100;

    private final RoutineProperties props;
    private final JobRegistry registry;
    private final LogStore logStore;
    private final TaskRegistry tasks;
    private final Clock clock;

    private final ConcurrentHashMap<String, RunSlot> running = new ConcurrentHashMap<>();
    private final Semaphore globalSem;
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    private final ExecutorService dispatchPool;
    private final ExecutorService taskPool;

    /**
     * One in-flight run. Completion is recorded exactly once, either by the thread executing
     * the run or by a forced shutdown. The slot is held until both the run is recorded and
     * the task thread (if one started) has returned.
     */
    private static final class RunSlot {
        private volatile Job job;
        private final RunTrigger trigger;
        private final Instant startedAt;
        private volatile boolean canceled;
        private volatile boolean permitHeld;
        private final AtomicBoolean released = new AtomicBoolean(false);
        private LogEntry entry;
        private Future<?> future;

        private boolean taskActive;
        private boolean runFinished;

        private RunSlot(Job job, RunTrigger trigger, Instant startedAt) {
            this.job = job;
            this.trigger = trigger;
            this.startedAt = startedAt;
        }

        // false when the run already finished without waiting for the task
        private synchronized boolean beginTask() {
            if (runFinished) {
                return false;
            }
            taskActive = true;
            return true;
        }

        /** @return true if the caller is the last holder and must release the slot */
        private synchronized boolean endTask() {
            taskActive = false;
            return runFinished;
        }

        /** @return true if the caller is the last holder and must release the slot */
        private synchronized boolean endRun() {
            runFinished = true;
            return !taskActive;
        }

        private synchronized void attach(Future<?> future) {
            this.future = future;
            if (canceled) {
                future.cancel(true);
            }
        }

        private synchronized void cancel() {
            canceled = true;
            if (future != null) {
                future.cancel(true);
            }
        }
    }

    private record Outcome(RunStatus status, String output) {
    }

    public RunExecutor(RoutineProperties props, JobRegistry registry, LogStore logStore, TaskRegistry tasks, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.tasks = Objects.requireNonNull(tasks, "tasks must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("routine.maxConcurrency must be positive");
        }
        if (props.getMaxOutputLength() <= 0) {
            throw new IllegalArgumentException("routine.maxOutputLength must be positive");
        }
        Duration timeout = Objects.requireNonNull(props.getExecutionTimeout(), "routine.executionTimeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("routine.executionTimeout must be a positive duration");
        }

        this.globalSem = new Semaphore(props.getMaxConcurrency());
        this.dispatchPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), daemonThreads("routine.dispatch-"));
        this.taskPool = Executors.newCachedThreadPool(daemonThreads("routine.task-"));
    }

    /**
     * Run the job on the calling thread and wait for its entry.
     *
     * @throws JobAlreadyRunningException if a run of this job is in flight
     * @throws IllegalStateException      if the executor has been shut down
     */
    public LogEntry run(Job job, RunTrigger trigger) {
        RunSlot slot = acquire(job, trigger);
        return execute(slot);
    }

    /**
     * Reserve the job's single-flight slot on the calling thread and run it on the dispatch pool.
     *
     * @throws JobAlreadyRunningException if a run of this job is in flight
     * @throws IllegalStateException      if the executor has been shut down
     */
    public CompletableFuture<LogEntry> submit(Job job, RunTrigger trigger) {
        return dispatch(acquire(job, trigger));
    }

    /**
     * Scheduled dispatch of a job found due at {@code now}. After the slot is reserved the job is read
     * again; the run goes ahead with that fresh copy only if it is still enabled and due. A stale
     * snapshot (run finished or job disabled in the meantime) is skipped.
     *
     * @return the pending run, or empty if the job is no longer due
     * @throws JobAlreadyRunningException if a run of this job is in flight
     * @throws IllegalStateException      if the executor has been shut down
     */
    public Optional<CompletableFuture<LogEntry>> submitIfDue(Job snapshot, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        RunSlot slot = acquire(snapshot, RunTrigger.SCHEDULED);

        Job current;
        try {
            current = registry.get(snapshot.id());
        } catch (JobNotFoundException e) {
            release(slot);
            return Optional.empty();
        } catch (RuntimeException e) {
            release(slot);
            throw e;
        }
        if (!current.isDue(now)) {
            release(slot);
            log.debug("Routine job no longer due, skipping id={} nextRun={} now={}", current.id(), current.nextRun(), now);
            return Optional.empty();
        }
        slot.job = current;
        return Optional.of(dispatch(slot));
    }

    private CompletableFuture<LogEntry> dispatch(RunSlot slot) {
        try {
            return CompletableFuture.supplyAsync(() -> execute(slot), dispatchPool);
        } catch (RejectedExecutionException e) {
            release(slot);
            throw new IllegalStateException("Executor is shut down", e);
        }
    }

    public boolean isRunning(String jobId) {
        return running.containsKey(jobId);
    }

    public int runningCount() {
        return running.size();
    }

    /**
     * Stop accepting runs, give in-flight runs {@code grace} to finish, then cancel the rest.
     * Canceled runs are logged as {@link RunStatus#CANCELED}.
     */
    public void shutdown(Duration grace) {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        log.info("Routine executor stopping inFlight={} grace={}", running.size(), grace);

        dispatchPool.shutdown();
        if (!awaitIdle(grace)) {
            List<RunSlot> leftovers = List.copyOf(running.values());
            log.warn("Routine executor canceling {} run(s) still in flight after grace period", leftovers.size());
            leftovers.forEach(RunSlot::cancel);
            dispatchPool.shutdownNow();

            if (!awaitIdle(Duration.ofSeconds(5))) {
                for (RunSlot slot : List.copyOf(running.values())) {
                    complete(slot, new Outcome(RunStatus.CANCELED, "Run canceled by shutdown"));
                    release(slot);
                }
            }
        }

        taskPool.shutdownNow();
        log.info("Routine executor stopped.");
    }

    private RunSlot acquire(Job job, RunTrigger trigger) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        if (!accepting.get()) {
            throw new IllegalStateException("Executor is shut down");
        }

        RunSlot slot = new RunSlot(job, trigger, clock.instant());
        if (running.putIfAbsent(job.id(), slot) != null) {
            throw new JobAlreadyRunningException(job.id());
        }
        return slot;
    }

    private LogEntry execute(RunSlot slot) {
        try {
            return complete(slot, invoke(slot));
        } finally {
            if (slot.endRun()) {
                release(slot);
            }
        }
    }

    private void release(RunSlot slot) {
        if (!slot.released.compareAndSet(false, true)) {
            return;
        }
        if (slot.permitHeld) {
            globalSem.release();
        }
        running.remove(slot.job.id(), slot);
    }

    private Outcome invoke(RunSlot slot) {
        Job job = slot.job;
        try {
            if (!awaitPermit(slot)) {
                return new Outcome(RunStatus.CANCELED, "Run canceled before start");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Outcome(RunStatus.CANCELED, "Run canceled before start");
        }

        try {
            JobTask task;
            try {
                task = tasks.getRequired(job.task());
            } catch (IllegalStateException e) {
                log.warn("Routine job has no task id={} name={} task={}", job.id(), job.name(), job.task());
                return new Outcome(RunStatus.FAILURE, e.getMessage());
            }

            BoundedTextWriter buffer = new BoundedTextWriter(props.getMaxOutputLength());
            PrintWriter out = new PrintWriter(buffer, true);
            TaskContext context = new TaskContext(job, slot.trigger, out);

            log.debug("Routine job started id={} name={} trigger={}", job.id(), job.name(), slot.trigger);
            Future<?> future = taskPool.submit(() -> {
                if (!slot.beginTask()) {
                    return null;
                }
                try {
                    task.execute(context);
                } finally {
                    if (slot.endTask()) {
                        release(slot);
                    }
                }
                return null;
            });
            slot.attach(future);

            Duration timeout = props.getExecutionTimeout();
            try {
                future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                out.flush();
                return new Outcome(RunStatus.SUCCESS, buffer.toString());
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Routine job timed out id={} name={} timeout={}; slot held until the task returns",
                        job.id(), job.name(), timeout);
                return new Outcome(RunStatus.TIMEOUT, appendLine(buffer, "Execution timed out after " + timeout));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Routine job failed id={} name={} msg={}", job.id(), job.name(), cause.getMessage(), cause);
                return new Outcome(RunStatus.FAILURE, appendLine(buffer, describe(cause)));
            } catch (CancellationException e) {
                return new Outcome(RunStatus.CANCELED, appendLine(buffer, "Run canceled by shutdown"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                return new Outcome(RunStatus.CANCELED, appendLine(buffer, "Run canceled by shutdown"));
            }
        } catch (RejectedExecutionException e) {
            return new Outcome(RunStatus.CANCELED, "Run canceled by shutdown");
        }
    }

    private boolean awaitPermit(RunSlot slot) throws InterruptedException {
        while (!globalSem.tryAcquire(PERMIT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            if (slot.canceled) {
                return false;
            }
        }
        if (slot.canceled) {
            globalSem.release();
            return false;
        }
        slot.permitHeld = true;
        return true;
    }

    private LogEntry complete(RunSlot slot, Outcome outcome) {
        synchronized (slot) {
            if (slot.entry == null) {
                slot.entry = record(slot, outcome);
            }
            return slot.entry;
        }
    }

    private LogEntry record(RunSlot slot, Outcome outcome) {
        Job job = slot.job;
        Instant completedAt = clock.instant();
        String output = outcome.output();

        try {
            registry.recordRun(job.id(), completedAt);
        } catch (JobNotFoundException e) {
            log.warn("Routine job vanished before its run was recorded id={}", job.id());
        } catch (RuntimeException e) {
            log.error("Routine recordRun failed id={} msg={}", job.id(), e.getMessage(), e);
            output = appendLine(output, "Run could not be recorded on the job (lastRun/nextRun unchanged): " + describe(e));
        }

        LogEntry entry = new LogEntry(
                UUID.randomUUID().toString(),
                job.id(),
                job.name(),
                slot.startedAt,
                completedAt,
                output,
                outcome.status(),
                slot.trigger
        );

        try {
            logStore.append(entry);
        } catch (RuntimeException e) {
            log.error("Routine log append failed id={} msg={}", job.id(), e.getMessage(), e);
        }

        log.info("Routine job finished id={} name={} status={} trigger={} at={}",
                job.id(), job.name(), entry.status(), entry.trigger(), completedAt);
        return entry;
    }

    private boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!running.isEmpty()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return running.isEmpty();
            }
        }
        return true;
    }

    private static String appendLine(BoundedTextWriter buffer, String line) {
        return appendLine(buffer.toString(), line);
    }

    private static String appendLine(String captured, String line) {
        if (captured == null || captured.isEmpty()) {
            return line;
        }
        return captured.endsWith("\n") ? captured + line : captured + System.lineSeparator() + line;
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return (message == null || message.isBlank()) ? t.getClass().getName() : message;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
