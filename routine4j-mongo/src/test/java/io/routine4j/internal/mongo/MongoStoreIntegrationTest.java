package io.routine4j.internal.mongo;

import com.mongodb.client.MongoClients;
import io.routine4j.config.RoutineProperties;
import io.routine4j.core.Job;
import io.routine4j.core.LogEntry;
import io.routine4j.core.RunStatus;
import io.routine4j.core.RunTrigger;
import io.routine4j.core.ScheduleSpec;
import io.routine4j.core.ScheduleType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant T0 = Instant.parse("2026-10-19T10:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "routine4j_test");
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(LogEntryDocument.class);
        jobStore = new MongoJobStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(LogEntryDocument.class);
    }

    @Test
    void savedJobShouldLoadWithParsedSchedule() {
        Job weekly = new Job("w1", "report", ScheduleType.WEEKLY, "mon 12:45",
                new ScheduleSpec.Weekly(DayOfWeek.MONDAY, 12, 45), true,
                null, T0.plusSeconds(3600), "hello-world", T0);
        jobStore.save(weekly);

        Optional<Job> loaded = jobStore.findById("w1");

        assertTrue(loaded.isPresent());
        assertEquals(weekly, loaded.get());
    }

    @Test
    void disablingShouldPersistClearedNextRun() {
        Job job = hourly("h1", T0, T0.plusSeconds(60));
        jobStore.save(job);
        jobStore.save(job.withEnabled(false, null));

        Job loaded = jobStore.findById("h1").orElseThrow();
        assertFalse(loaded.enabled());
        assertNull(loaded.nextRun());
        assertTrue(jobStore.findDue(T0.plusSeconds(7200)).isEmpty());
    }

    @Test
    void findDueShouldReturnEnabledJobsEarliestFirst() {
        jobStore.save(hourly("late", T0, T0.minusSeconds(10)));
        jobStore.save(hourly("early", T0.plusSeconds(1), T0.minusSeconds(60)));
        jobStore.save(hourly("future", T0.plusSeconds(2), T0.plusSeconds(600)));
        jobStore.save(hourly("off", T0.plusSeconds(3), T0.minusSeconds(60)).withEnabled(false, null));

        List<Job> due = jobStore.findDue(T0);

        assertEquals(List.of("early", "late"), due.stream().map(Job::id).toList());
    }

    @Test
    void findAllShouldKeepCreationOrder() {
        jobStore.save(hourly("b", T0.plusSeconds(5), T0.plusSeconds(60)));
        jobStore.save(hourly("a", T0, T0.plusSeconds(60)));

        assertEquals(List.of("a", "b"), jobStore.findAll().stream().map(Job::id).toList());
    }

    @Test
    void logStoreShouldListNewestFirstAndFilterByJob() {
        MongoLogStore logStore = new MongoLogStore(mongoTemplate, new RoutineProperties().getLogRetention(), Clock.fixed(T0, ZoneOffset.UTC));
        logStore.append(entry("j1", T0.minusSeconds(30)));
        logStore.append(entry("j2", T0.minusSeconds(20)));
        logStore.append(entry("j1", T0.minusSeconds(10)));

        List<LogEntry> all = logStore.list();
        assertEquals(3, all.size());
        assertEquals(T0.minusSeconds(10), all.get(0).runTime());
        assertEquals(T0.minusSeconds(30), all.get(2).runTime());

        List<LogEntry> j1 = logStore.listByJob("j1");
        assertEquals(2, j1.size());
        assertTrue(j1.stream().allMatch(e -> e.jobId().equals("j1")));
    }

    @Test
    void logStoreShouldEvictOldestBeyondRetention() {
        RoutineProperties.LogRetention retention = new RoutineProperties.LogRetention();
        retention.setMaxEntries(2);
        retention.setMaxAge(Duration.ofHours(1));
        MongoLogStore logStore = new MongoLogStore(mongoTemplate, retention, Clock.fixed(T0, ZoneOffset.UTC));

        logStore.append(entry("j1", T0.minus(Duration.ofHours(2))));
        logStore.append(entry("j1", T0.minusSeconds(30)));
        logStore.append(entry("j1", T0.minusSeconds(20)));
        logStore.append(entry("j1", T0.minusSeconds(10)));

        List<LogEntry> kept = logStore.list();
        assertEquals(List.of(T0.minusSeconds(10), T0.minusSeconds(20)),
                kept.stream().map(LogEntry::runTime).toList());
    }

    private static Job hourly(String id, Instant createdAt, Instant nextRun) {
        return new Job(id, "job-" + id, ScheduleType.HOURLY, "15", new ScheduleSpec.Hourly(15), true,
                null, nextRun, "hello-world", createdAt);
    }

    private static LogEntry entry(String jobId, Instant runTime) {
        return new LogEntry(UUID.randomUUID().toString(), jobId, "job-" + jobId, runTime.minusSeconds(1), runTime,
                "Hello World", RunStatus.SUCCESS, RunTrigger.SCHEDULED);
    }
}
