package io.routine4j.core;

/**
 * A run was requested while another run of the same job is still in flight.
 */
public class JobAlreadyRunningException extends RoutineException {

    private final String jobId;

    public JobAlreadyRunningException(String jobId) {
        super("Job is already running: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
