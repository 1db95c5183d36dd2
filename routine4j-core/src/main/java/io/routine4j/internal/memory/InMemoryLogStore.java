package io.routine4j.internal.memory;

import io.routine4j.config.RoutineProperties;
import io.routine4j.core.LogEntry;
import io.routine4j.spi.LogStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Process-local run history with bounded retention.
 *
 * <p>Entries are kept in append (completion) order; when a limit is exceeded the oldest appended
 * entries are evicted first.
 */
public class InMemoryLogStore implements LogStore {

    private static final Comparator<LogEntry> NEWEST_FIRST =
            Comparator.comparing(LogEntry::runTime).reversed();

    private final int maxEntries;
    private final Duration maxAge;
    private final Clock clock;

    private final Deque<LogEntry> entries = new ArrayDeque<>();

    public InMemoryLogStore() {
        this(0, null, Clock.systemUTC());
    }

    public InMemoryLogStore(RoutineProperties.LogRetention retention, Clock clock) {
        this(retention.getMaxEntries(), retention.getMaxAge(), clock);
    }

    public InMemoryLogStore(int maxEntries, Duration maxAge, Clock clock) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must not be negative");
        }
        if (maxAge != null && (maxAge.isZero() || maxAge.isNegative())) {
            throw new IllegalArgumentException("maxAge must be a positive duration");
        }
        this.maxEntries = maxEntries;
        this.maxAge = maxAge;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized void append(LogEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        entries.addLast(entry);
        evict();
    }

    @Override
    public List<LogEntry> list() {
        List<LogEntry> snapshot = snapshot();
        snapshot.sort(NEWEST_FIRST);
        return List.copyOf(snapshot);
    }

    @Override
    public List<LogEntry> listByJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return snapshot().stream()
                .filter(e -> jobId.equals(e.jobId()))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    // Newest-appended first, so the stable sort keeps later appends ahead on equal runTime.
    private synchronized List<LogEntry> snapshot() {
        evict();
        List<LogEntry> copy = new ArrayList<>(entries.size());
        entries.descendingIterator().forEachRemaining(copy::add);
        return copy;
    }

    private void evict() {
        if (maxEntries > 0) {
            while (entries.size() > maxEntries) {
                entries.removeFirst();
            }
        }
        if (maxAge != null) {
            Instant cutoff = clock.instant().minus(maxAge);
            Iterator<LogEntry> it = entries.iterator();
            while (it.hasNext()) {
                if (it.next().runTime().isBefore(cutoff)) {
                    it.remove();
                }
            }
        }
    }
}
