package com.researchflow.orchestrator.api;

import com.researchflow.orchestrator.api.dto.ErrorResponse;
import com.researchflow.orchestrator.model.ErrorCode;
import com.researchflow.orchestrator.service.JobAlreadyFinishedException;
import com.researchflow.orchestrator.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps domain exceptions to {@link ErrorResponse} bodies. Anything not
 * listed here falls through to Spring's default handling, which never
 * exposes a stack trace.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> onValidation(ValidationException e) {
        log.info("Rejected submission: {}", e.getDetails());
        return ResponseEntity.badRequest().body(ErrorResponse.of(
                ErrorCode.VALIDATION_ERROR.name(), "Request validation failed", e.getDetails()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> onUnreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(
                ErrorCode.VALIDATION_ERROR.name(), "Request body is missing or is not valid JSON"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> onTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(
                ErrorCode.VALIDATION_ERROR.name(), "Invalid value for '" + e.getName() + "'"));
    }

    @ExceptionHandler(JobAlreadyFinishedException.class)
    public ResponseEntity<ErrorResponse> onFinished(JobAlreadyFinishedException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(
                "JOB_FINISHED", e.getMessage()));
    }
}
