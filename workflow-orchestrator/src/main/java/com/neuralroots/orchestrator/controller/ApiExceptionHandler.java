package com.neuralroots.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.neuralroots.common.exception.FreshnessComputationException;
import com.neuralroots.common.exception.ValidationException;
import com.neuralroots.common.exception.ValidationException.FieldError;
import com.neuralroots.orchestrator.service.WorkflowNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps the fatal assessment failures to HTTP statuses. Degraded stages never reach here:
 * they complete with {@code status=completed_degraded}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.info("[Api] rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("validation_error", e.getMessage(), e.getErrors()));
    }

    @ExceptionHandler(FreshnessComputationException.class)
    public ResponseEntity<ErrorResponse> handleFreshness(FreshnessComputationException e) {
        log.error("[Api] freshness computation failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ErrorResponse("freshness_computation_error", e.getMessage(), null));
    }

    @ExceptionHandler(WorkflowNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(WorkflowNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("not_found", e.getMessage(), null));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
        @JsonProperty("error")   String error,
        @JsonProperty("message") String message,
        @JsonProperty("fields")  List<FieldError> fields
    ) {}
}
