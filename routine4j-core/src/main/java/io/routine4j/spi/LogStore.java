package io.routine4j.spi;

import io.routine4j.core.LogEntry;

import java.util.List;

/**
 * Append-only run history. Entries are never modified; retention eviction is the only removal.
 */
public interface LogStore {

    void append(LogEntry entry);

    /**
     * All retained entries, newest {@code runTime} first.
     */
    List<LogEntry> list();

    List<LogEntry> listByJob(String jobId);
}
