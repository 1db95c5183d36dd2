package io.routine4j.config;

import io.routine4j.internal.mongo.JobDocument;
import io.routine4j.internal.mongo.LogEntryDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the Mongo stores.
 *
 * <p>Indexes are not created automatically; set {@code routine.ensure-indexes-on-startup=true} or
 * create them with a migration script:
 * <pre>
 * db.routine_jobs.createIndex({ enabled: 1, nextRun: 1 }, { name: "idx_due" });
 * db.routine_jobs.createIndex({ createdAt: 1 }, { name: "idx_created" });
 * db.routine_logs.createIndex({ runTime: -1 }, { name: "idx_run_time" });
 * db.routine_logs.createIndex({ jobId: 1, runTime: -1 }, { name: "idx_job_run_time" });
 * </pre>
 */
public class RoutineMongoIndexConfig {

    public static final String IDX_DUE = "idx_due";
    public static final String IDX_CREATED = "idx_created";
    public static final String IDX_RUN_TIME = "idx_run_time";
    public static final String IDX_JOB_RUN_TIME = "idx_job_run_time";

    private final MongoTemplate mongoTemplate;

    public RoutineMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(dueIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(createdIndex());
        mongoTemplate.indexOps(LogEntryDocument.class).ensureIndex(runTimeIndex());
        mongoTemplate.indexOps(LogEntryDocument.class).ensureIndex(jobRunTimeIndex());
    }

    /**
     * Polling for due jobs. Keys: enabled ASC, nextRun ASC
     */
    public static Index dueIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .on("nextRun", Sort.Direction.ASC)
                .named(IDX_DUE);
    }

    public static Index createdIndex() {
        return new Index().on("createdAt", Sort.Direction.ASC).named(IDX_CREATED);
    }

    /**
     * Newest-first history and retention trimming. Keys: runTime DESC
     */
    public static Index runTimeIndex() {
        return new Index().on("runTime", Sort.Direction.DESC).named(IDX_RUN_TIME);
    }

    public static Index jobRunTimeIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("runTime", Sort.Direction.DESC)
                .named(IDX_JOB_RUN_TIME);
    }
}
