package io.routine4j.internal;

import io.routine4j.core.InvalidJobException;
import io.routine4j.core.Job;
import io.routine4j.core.JobDefinition;
import io.routine4j.core.JobNotFoundException;
import io.routine4j.core.ScheduleSpec;
import io.routine4j.core.ScheduleType;
import io.routine4j.core.TaskRegistry;
import io.routine4j.spi.JobStore;
import io.routine4j.utils.NextRunCalculator;
import io.routine4j.utils.ScheduleParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the job lifecycle and is the single writer of {@code lastRun}/{@code nextRun}.
 *
 * <p>Every read-modify-write of one job happens under that job's monitor, so concurrent toggles,
 * manual runs and scheduler ticks on the same job are totally ordered.
 */
public class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final JobStore store;
    private final NextRunCalculator calculator;
    private final TaskRegistry tasks;
    private final String defaultTask;
    private final Clock clock;

    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();

    public JobRegistry(JobStore store, NextRunCalculator calculator, TaskRegistry tasks, String defaultTask, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.tasks = Objects.requireNonNull(tasks, "tasks must not be null");
        this.defaultTask = Objects.requireNonNull(defaultTask, "defaultTask must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Validate and store a new job. Nothing is stored when validation fails.
     */
    public Job create(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        if (definition.name() == null || definition.name().isBlank()) {
            throw new InvalidJobException("Job name must not be blank");
        }

        ScheduleType type = ScheduleType.fromId(definition.type());
        ScheduleSpec schedule = ScheduleParser.parse(type, definition.time());

        String task = (definition.task() == null || definition.task().isBlank())
                ? defaultTask
                : definition.task().trim();
        if (!tasks.contains(task)) {
            throw new InvalidJobException("Unknown task: " + task);
        }

        Instant now = clock.instant();
        Instant nextRun = definition.enabled() ? calculator.nextRun(schedule, now) : null;
        Job job = new Job(
                UUID.randomUUID().toString(),
                definition.name().trim(),
                type,
                definition.time().trim(),
                schedule,
                definition.enabled(),
                null,
                nextRun,
                task,
                now
        );
        store.save(job);

        log.info("Routine job created id={} name={} type={} time={} task={} nextRun={}",
                job.id(), job.name(), type.id(), job.time(), task, nextRun);
        return job;
    }

    /**
     * Flip the enabled flag; enabling schedules from now, disabling clears the next run.
     */
    public Job toggle(String id) {
        get(id);
        synchronized (lockFor(id)) {
            Job current = get(id);
            Job updated;
            if (current.enabled()) {
                updated = current.withEnabled(false, null);
            } else {
                updated = current.withEnabled(true, calculator.nextRun(current.schedule(), clock.instant()));
            }
            store.save(updated);

            log.info("Routine job toggled id={} enabled={} nextRun={}", id, updated.enabled(), updated.nextRun());
            return updated;
        }
    }

    /**
     * Record a finished run. The next run is computed from the completion instant.
     */
    public Job recordRun(String id, Instant at) {
        Objects.requireNonNull(at, "at must not be null");
        get(id);
        synchronized (lockFor(id)) {
            Job current = get(id);
            Instant nextRun = current.enabled() ? calculator.nextRun(current.schedule(), at) : null;
            Job updated = current.withRun(at, nextRun);
            store.save(updated);

            log.debug("Routine job run recorded id={} lastRun={} nextRun={}", id, at, nextRun);
            return updated;
        }
    }

    /**
     * Move every enabled job whose next run is already in the past to its next future occurrence.
     * Missed occurrences are skipped, never replayed.
     *
     * @return number of jobs moved
     */
    public int reschedule(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        int moved = 0;
        for (Job snapshot : store.findAll()) {
            if (!snapshot.enabled() || snapshot.nextRun().isAfter(now)) {
                continue;
            }
            synchronized (lockFor(snapshot.id())) {
                Job current = store.findById(snapshot.id()).orElse(null);
                if (current == null || !current.enabled() || current.nextRun().isAfter(now)) {
                    continue;
                }
                Job updated = current.withEnabled(true, calculator.nextRun(current.schedule(), now));
                store.save(updated);
                moved++;
                log.info("Routine job skipped missed run id={} missed={} nextRun={}",
                        current.id(), current.nextRun(), updated.nextRun());
            }
        }
        return moved;
    }

    public Job get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return store.findById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    /**
     * All jobs in creation order.
     */
    public List<Job> list() {
        return store.findAll();
    }

    /**
     * Snapshot of jobs that are enabled and due at {@code now}.
     */
    public List<Job> due(Instant now) {
        return store.findDue(now);
    }

    // Only called for ids known to the store, so the map is bounded by the number of jobs.
    private Object lockFor(String id) {
        return locks.computeIfAbsent(id, k -> new Object());
    }

    int lockCount() {
        return locks.size();
    }
}
