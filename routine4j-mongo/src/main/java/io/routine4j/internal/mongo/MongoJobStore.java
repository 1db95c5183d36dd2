package io.routine4j.internal.mongo;

import io.routine4j.core.Job;
import io.routine4j.spi.JobStore;
import io.routine4j.utils.ScheduleParser;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Jobs survive restarts; run scheduling itself stays in-process. Each save replaces the whole
 * document by id, which is safe because the registry serializes writes per job.
 */
public class MongoJobStore implements JobStore {

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void save(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        mongoTemplate.save(toDocument(job));
    }

    @Override
    public Optional<Job> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        JobDocument doc = mongoTemplate.findById(id, JobDocument.class);
        return Optional.ofNullable(doc).map(MongoJobStore::toJob);
    }

    @Override
    public List<Job> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));
        return mongoTemplate.find(q, JobDocument.class).stream()
                .map(MongoJobStore::toJob)
                .toList();
    }

    /**
     * Due jobs: {@code enabled == true && nextRun <= now}, earliest first.
     */
    @Override
    public List<Job> findDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Query q = new Query(
                Criteria.where("enabled").is(true)
                        .and("nextRun").ne(null).lte(now)
        );
        q.with(Sort.by(Sort.Order.asc("nextRun")));
        return mongoTemplate.find(q, JobDocument.class).stream()
                .map(MongoJobStore::toJob)
                .toList();
    }

    static JobDocument toDocument(Job job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.id());
        doc.setName(job.name());
        doc.setType(job.type());
        doc.setTime(job.time());
        doc.setTask(job.task());
        doc.setEnabled(job.enabled());
        doc.setNextRun(job.nextRun());
        doc.setLastRun(job.lastRun());
        doc.setCreatedAt(job.createdAt());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Job)}; re-parses the stored type/time pair.
     */
    static Job toJob(JobDocument doc) {
        return new Job(
                doc.getId(),
                doc.getName(),
                doc.getType(),
                doc.getTime(),
                ScheduleParser.parse(doc.getType(), doc.getTime()),
                doc.isEnabled(),
                doc.getLastRun(),
                doc.getNextRun(),
                doc.getTask(),
                doc.getCreatedAt()
        );
    }
}
