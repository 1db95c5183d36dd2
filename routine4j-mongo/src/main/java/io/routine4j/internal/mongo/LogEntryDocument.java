package io.routine4j.internal.mongo;

import io.routine4j.core.RunStatus;
import io.routine4j.core.RunTrigger;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for the run history.
 */
@Document(collection = "routine_logs")
public class LogEntryDocument {

    @Id
    private String id;

    private String jobId;
    private String jobName;
    private Instant startedAt;
    private Instant runTime;
    private String output;
    private RunStatus status;
    private RunTrigger trigger;

    public LogEntryDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getJobName() {
        return jobName;
    }

    public void setJobName(String jobName) {
        this.jobName = jobName;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getRunTime() {
        return runTime;
    }

    public void setRunTime(Instant runTime) {
        this.runTime = runTime;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    public RunTrigger getTrigger() {
        return trigger;
    }

    public void setTrigger(RunTrigger trigger) {
        this.trigger = trigger;
    }
}
