package io.routine4j.core;

public enum RunStatus {
    SUCCESS,
    FAILURE,
    TIMEOUT,
    CANCELED
}
