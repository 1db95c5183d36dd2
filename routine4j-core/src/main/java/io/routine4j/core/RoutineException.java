package io.routine4j.core;

/**
 * Base class for errors reported synchronously to callers of {@link io.routine4j.Routines}.
 */
public class RoutineException extends RuntimeException {

    public RoutineException(String message) {
        super(message);
    }

    public RoutineException(String message, Throwable cause) {
        super(message, cause);
    }
}
