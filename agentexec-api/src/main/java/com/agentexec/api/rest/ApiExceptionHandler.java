package com.agentexec.api.rest;

import com.agentexec.core.exception.AdmissionDeniedException;
import com.agentexec.core.exception.CheckpointCorruptException;
import com.agentexec.core.exception.ContractValidationException;
import com.agentexec.core.exception.DuplicateCheckpointException;
import com.agentexec.core.exception.DuplicateConditionException;
import com.agentexec.core.exception.ExecutionEngineException;
import com.agentexec.core.exception.NotFoundException;
import com.agentexec.core.exception.UndefinedTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps engine exceptions to HTTP responses with a uniform error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(AdmissionDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAdmissionDenied(AdmissionDeniedException e) {
        return respond(HttpStatus.TOO_MANY_REQUESTS, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({ContractValidationException.class, UndefinedTransitionException.class,
        DuplicateConditionException.class})
    public ResponseEntity<ErrorResponse> handleBadContract(ExecutionEngineException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({CheckpointCorruptException.class, DuplicateCheckpointException.class})
    public ResponseEntity<ErrorResponse> handleCheckpointConflict(ExecutionEngineException e) {
        log.warn("Checkpoint conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(ExecutionEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngine(ExecutionEngineException e) {
        log.error("Engine error [{}]", e.getErrorCode(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        return respond(HttpStatus.CONFLICT, "CONFLICT", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, Instant.now()));
    }

    // ========== DTOs ==========

    public record ErrorResponse(String errorCode, String message, Instant timestamp) {}
}
