package io.routine4j.core;

/**
 * What started a run.
 */
public enum RunTrigger {
    SCHEDULED,
    MANUAL
}
