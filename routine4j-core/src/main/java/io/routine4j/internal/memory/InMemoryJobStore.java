package io.routine4j.internal.memory;

import io.routine4j.core.Job;
import io.routine4j.spi.JobStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local job storage. Contents are lost on restart.
 */
public class InMemoryJobStore implements JobStore {

    private record Slot(long seq, Job job) {
    }

    private final ConcurrentHashMap<String, Slot> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public void save(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        jobs.compute(job.id(), (id, existing) ->
                new Slot(existing == null ? sequence.incrementAndGet() : existing.seq(), job));
    }

    @Override
    public Optional<Job> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Slot slot = jobs.get(id);
        return slot == null ? Optional.empty() : Optional.of(slot.job());
    }

    @Override
    public List<Job> findAll() {
        return jobs.values().stream()
                .sorted(Comparator.comparingLong(Slot::seq))
                .map(Slot::job)
                .toList();
    }

    @Override
    public List<Job> findDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return jobs.values().stream()
                .map(Slot::job)
                .filter(job -> job.isDue(now))
                .sorted(Comparator.comparing(Job::nextRun))
                .toList();
    }
}
