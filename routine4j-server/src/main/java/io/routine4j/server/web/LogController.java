package io.routine4j.server.web;

import io.routine4j.Routines;
import io.routine4j.server.web.dto.LogEntryResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/logs")
public class LogController {

    private final Routines routines;

    public LogController(Routines routines) {
        this.routines = routines;
    }

    /**
     * Full run history, newest first.
     */
    @GetMapping
    public List<LogEntryResponse> list() {
        return routines.logs().stream().map(LogEntryResponse::from).toList();
    }
}
