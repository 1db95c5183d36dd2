package io.routine4j.core;

/**
 * A job definition was rejected: blank name or unknown task.
 */
public class InvalidJobException extends RoutineException {

    public InvalidJobException(String message) {
        super(message);
    }
}
