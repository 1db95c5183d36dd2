package io.routine4j.internal.mongo;

import io.routine4j.config.RoutineProperties;
import io.routine4j.core.LogEntry;
import io.routine4j.spi.LogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MongoDB-backed run history with bounded retention.
 *
 * <p>Retention is applied after every append: entries older than {@code maxAge} are removed, then the
 * oldest entries beyond {@code maxEntries}.
 */
public class MongoLogStore implements LogStore {
    private static final Logger log = LoggerFactory.getLogger(MongoLogStore.class);

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("runTime"), Sort.Order.desc("_id"));

    private final MongoTemplate mongoTemplate;
    private final int maxEntries;
    private final Duration maxAge;
    private final Clock clock;

    public MongoLogStore(MongoTemplate mongoTemplate, RoutineProperties.LogRetention retention, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        Objects.requireNonNull(retention, "retention must not be null");
        this.maxEntries = retention.getMaxEntries();
        this.maxAge = retention.getMaxAge();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must not be negative");
        }
    }

    @Override
    public void append(LogEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        mongoTemplate.insert(toDocument(entry));
        evict();
    }

    @Override
    public List<LogEntry> list() {
        Query q = new Query().with(NEWEST_FIRST);
        return mongoTemplate.find(q, LogEntryDocument.class).stream()
                .map(MongoLogStore::toEntry)
                .toList();
    }

    @Override
    public List<LogEntry> listByJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Query q = new Query(Criteria.where("jobId").is(jobId)).with(NEWEST_FIRST);
        return mongoTemplate.find(q, LogEntryDocument.class).stream()
                .map(MongoLogStore::toEntry)
                .toList();
    }

    private void evict() {
        long removed = 0;
        if (maxAge != null) {
            Query expired = new Query(Criteria.where("runTime").lt(clock.instant().minus(maxAge)));
            removed += mongoTemplate.remove(expired, LogEntryDocument.class).getDeletedCount();
        }

        if (maxEntries > 0) {
            Query overflow = new Query().with(NEWEST_FIRST).skip(maxEntries);
            overflow.fields().include("_id");

            List<String> ids = new ArrayList<>();
            for (LogEntryDocument d : mongoTemplate.find(overflow, LogEntryDocument.class)) {
                ids.add(d.getId());
            }
            if (!ids.isEmpty()) {
                removed += mongoTemplate.remove(new Query(Criteria.where("_id").in(ids)), LogEntryDocument.class)
                        .getDeletedCount();
            }
        }

        if (removed > 0) {
            log.debug("Routine log retention evicted count={}", removed);
        }
    }

    static LogEntryDocument toDocument(LogEntry entry) {
        LogEntryDocument doc = new LogEntryDocument();
        doc.setId(entry.id());
        doc.setJobId(entry.jobId());
        doc.setJobName(entry.jobName());
        doc.setStartedAt(entry.startedAt());
        doc.setRunTime(entry.runTime());
        doc.setOutput(entry.output());
        doc.setStatus(entry.status());
        doc.setTrigger(entry.trigger());
        return doc;
    }

    static LogEntry toEntry(LogEntryDocument doc) {
        return new LogEntry(
                doc.getId(),
                doc.getJobId(),
                doc.getJobName(),
                doc.getStartedAt(),
                doc.getRunTime(),
                doc.getOutput(),
                doc.getStatus(),
                doc.getTrigger()
        );
    }
}
