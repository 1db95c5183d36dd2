package io.routine4j.server.web;

import io.routine4j.core.InvalidJobException;
import io.routine4j.core.InvalidScheduleFormatException;
import io.routine4j.core.JobAlreadyRunningException;
import io.routine4j.core.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps routine errors to plain-text responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidScheduleFormatException.class)
    public ResponseEntity<String> invalidSchedule(InvalidScheduleFormatException ex) {
        return text(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(InvalidJobException.class)
    public ResponseEntity<String> invalidJob(InvalidJobException ex) {
        return text(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<String> validation(MethodArgumentNotValidException ex) {
        String fields = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .sorted()
                .collect(Collectors.joining(", "));
        return text(HttpStatus.BAD_REQUEST, "Missing or blank field(s): " + fields);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<String> unreadable(HttpMessageNotReadableException ex) {
        return text(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<String> notFound(JobNotFoundException ex) {
        return text(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(JobAlreadyRunningException.class)
    public ResponseEntity<String> conflict(JobAlreadyRunningException ex) {
        return text(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> unexpected(Exception ex) {
        // framework errors (unknown path, wrong method, ...) keep their own status
        if (ex instanceof ErrorResponse er) {
            String detail = er.getBody().getDetail();
            return text(HttpStatus.valueOf(er.getStatusCode().value()), detail == null ? "" : detail);
        }
        log.error("Unhandled API error msg={}", ex.getMessage(), ex);
        return text(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<String> text(HttpStatus status, String body) {
        return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(body);
    }
}
