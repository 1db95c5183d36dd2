package io.routine4j.core;

/**
 * The job type / time string combination cannot be turned into a {@link ScheduleSpec}.
 */
public class InvalidScheduleFormatException extends RoutineException {

    public InvalidScheduleFormatException(String message) {
        super(message);
    }
}
