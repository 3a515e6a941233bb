package com.taskgraph.api.rest;

import com.taskgraph.core.exception.ConflictException;
import com.taskgraph.core.exception.InvalidStateTransitionException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.OrchestratorException;
import com.taskgraph.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps engine exceptions to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({InvalidStateTransitionException.class, ConflictException.class})
    public ResponseEntity<ErrorResponse> handleConflict(OrchestratorException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body", e);
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("MALFORMED_REQUEST", "Request body could not be read", Instant.now()));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, OrchestratorException e) {
        log.debug("Request rejected with {}: {}", status.value(), e.getMessage());
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getErrorCode(), e.getMessage(), Instant.now()));
    }

    public record ErrorResponse(String errorCode, String message, Instant timestamp) {}
}
