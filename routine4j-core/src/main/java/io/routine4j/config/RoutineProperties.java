package io.routine4j.config;

import io.routine4j.tasks.HelloWorldTask;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration for scheduler behavior. Bound from the {@code routine.*} prefix by the starter
 * and fixed once the scheduler has started.
 */
public class RoutineProperties {
    private Duration pollInterval = Duration.ofSeconds(30);
    private Duration executionTimeout = Duration.ofMinutes(5);
    private Duration shutdownGracePeriod = Duration.ofSeconds(10);
    private String timezone; // null means system default
    private int maxConcurrency = 10; // global
    private int maxOutputLength = 64 * 1024; // chars per run
    private String defaultTask = HelloWorldTask.NAME;
    private StoreType store = StoreType.MEMORY;
    private final LogRetention logRetention = new LogRetention();

    public enum StoreType {
        MEMORY,
        MONGO
    }

    /**
     * Bounds on the run history. Oldest entries are evicted first.
     */
    public static class LogRetention {
        private int maxEntries = 1000; // 0 = unlimited
        private Duration maxAge; // null = unlimited

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public Duration getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Duration maxAge) {
            this.maxAge = maxAge;
        }
    }

    /**
     * Resolve {@link #getTimezone()} into a zone.
     *
     * @throws IllegalArgumentException if the configured id is not a valid zone
     */
    public ZoneId zoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("routine.timezone is not a valid zone id: " + timezone, e);
        }
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public void setExecutionTimeout(Duration executionTimeout) {
        this.executionTimeout = executionTimeout;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getMaxOutputLength() {
        return maxOutputLength;
    }

    public void setMaxOutputLength(int maxOutputLength) {
        this.maxOutputLength = maxOutputLength;
    }

    public String getDefaultTask() {
        return defaultTask;
    }

    public void setDefaultTask(String defaultTask) {
        this.defaultTask = defaultTask;
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public LogRetention getLogRetention() {
        return logRetention;
    }
}
