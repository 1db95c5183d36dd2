package io.routine4j.internal.memory;

import io.routine4j.core.LogEntry;
import io.routine4j.core.RunStatus;
import io.routine4j.core.RunTrigger;
import io.routine4j.internal.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryLogStoreTest {

    private static final Instant T0 = Instant.parse("2026-10-20T10:00:00Z");

    @Test
    void listShouldReturnNewestFirst() {
        InMemoryLogStore store = new InMemoryLogStore();
        LogEntry first = entry("1", "job-a", T0);
        LogEntry second = entry("2", "job-b", T0.plusSeconds(10));
        LogEntry third = entry("3", "job-a", T0.plusSeconds(5));

        store.append(first);
        store.append(second);
        store.append(third);

        assertEquals(List.of(second, third, first), store.list());
        assertEquals(List.of(third, first), store.listByJob("job-a"));
    }

    @Test
    void equalRunTimesShouldListLatestAppendFirst() {
        InMemoryLogStore store = new InMemoryLogStore();
        LogEntry a = entry("a", "job", T0);
        LogEntry b = entry("b", "job", T0);

        store.append(a);
        store.append(b);

        assertEquals(List.of(b, a), store.list());
    }

    @Test
    void maxEntriesShouldEvictOldestFirst() {
        InMemoryLogStore store = new InMemoryLogStore(2, null, new MutableClock(T0));

        store.append(entry("1", "job", T0));
        store.append(entry("2", "job", T0.plusSeconds(1)));
        store.append(entry("3", "job", T0.plusSeconds(2)));

        List<String> ids = store.list().stream().map(LogEntry::id).toList();
        assertEquals(List.of("3", "2"), ids);
    }

    @Test
    void maxAgeShouldEvictExpiredEntries() {
        MutableClock clock = new MutableClock(T0);
        InMemoryLogStore store = new InMemoryLogStore(0, Duration.ofHours(1), clock);

        store.append(entry("old", "job", T0));
        store.append(entry("new", "job", T0.plus(Duration.ofMinutes(45))));
        clock.advance(Duration.ofMinutes(90));

        List<String> ids = store.list().stream().map(LogEntry::id).toList();
        assertEquals(List.of("new"), ids);
    }

    @Test
    void unknownJobShouldHaveEmptyHistory() {
        assertTrue(new InMemoryLogStore().listByJob("nobody").isEmpty());
    }

    @Test
    void invalidRetentionShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryLogStore(-1, null, new MutableClock(T0)));
        assertThrows(IllegalArgumentException.class, () -> new InMemoryLogStore(0, Duration.ZERO, new MutableClock(T0)));
    }

    private static LogEntry entry(String id, String jobId, Instant runTime) {
        return new LogEntry(id, jobId, "name-" + jobId, runTime, runTime, "ok", RunStatus.SUCCESS, RunTrigger.SCHEDULED);
    }
}
