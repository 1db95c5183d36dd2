package io.routine4j.spi;

import io.routine4j.core.Job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for jobs. Writes for one job id are serialized by the caller
 * ({@link io.routine4j.internal.JobRegistry}); implementations only need to be safe for concurrent use.
 */
public interface JobStore {

    /**
     * Insert the job, or replace the stored job with the same id.
     */
    void save(Job job);

    Optional<Job> findById(String id);

    /**
     * All jobs ordered by creation time.
     */
    List<Job> findAll();

    /**
     * Enabled jobs whose next run is at or before {@code now}, earliest first.
     */
    List<Job> findDue(Instant now);
}
