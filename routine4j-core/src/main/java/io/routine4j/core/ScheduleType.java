package io.routine4j.core;

import java.util.Locale;

/**
 * Cadence of a recurring job.
 */
public enum ScheduleType {
    HOURLY("hourly"),
    DAILY("daily"),
    WEEKLY("weekly");

    private final String id;

    ScheduleType(String id) {
        this.id = id;
    }

    /**
     * Lowercase name used on the wire (e.g. "daily").
     */
    public String id() {
        return id;
    }

    /**
     * Resolve a type from its wire name, case-insensitively.
     *
     * @throws InvalidScheduleFormatException if the name is blank or unknown
     */
    public static ScheduleType fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidScheduleFormatException("Job type must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ScheduleType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new InvalidScheduleFormatException("Unsupported job type: " + value);
    }
}
