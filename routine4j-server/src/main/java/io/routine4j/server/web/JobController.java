package io.routine4j.server.web;

import io.routine4j.Routines;
import io.routine4j.core.Job;
import io.routine4j.core.LogEntry;
import io.routine4j.server.web.dto.CreateJobRequest;
import io.routine4j.server.web.dto.JobResponse;
import io.routine4j.server.web.dto.LogEntryResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/jobs")
public class JobController {

    private final Routines routines;

    public JobController(Routines routines) {
        this.routines = routines;
    }

    @GetMapping
    public List<JobResponse> list() {
        return routines.jobs().stream().map(JobResponse::from).toList();
    }

    @GetMapping("/{id}")
    public JobResponse get(@PathVariable("id") String id) {
        return JobResponse.from(routines.get(id));
    }

    /**
     * Creates an enabled job (unless {@code enabled=false}) and schedules its first run.
     */
    @PostMapping
    public ResponseEntity<JobResponse> create(@Valid @RequestBody CreateJobRequest req) {
        Job job = routines.create(req.toDefinition());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @PostMapping("/{id}/toggle")
    public JobResponse toggle(@PathVariable("id") String id) {
        return JobResponse.from(routines.toggle(id));
    }

    /**
     * Runs the job now and waits for it. A failed run answers 500 and a timed-out run 504,
     * with the captured output as plain text.
     */
    @PostMapping("/{id}/run")
    public ResponseEntity<?> run(@PathVariable("id") String id) {
        LogEntry entry = routines.runNow(id);
        return switch (entry.status()) {
            case SUCCESS -> ResponseEntity.ok(LogEntryResponse.from(entry));
            case TIMEOUT -> text(HttpStatus.GATEWAY_TIMEOUT, entry.output());
            case FAILURE, CANCELED -> text(HttpStatus.INTERNAL_SERVER_ERROR, entry.output());
        };
    }

    @GetMapping("/{id}/logs")
    public List<LogEntryResponse> logs(@PathVariable("id") String id) {
        return routines.logs(id).stream().map(LogEntryResponse::from).toList();
    }

    private static ResponseEntity<String> text(HttpStatus status, String body) {
        return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(body);
    }
}
