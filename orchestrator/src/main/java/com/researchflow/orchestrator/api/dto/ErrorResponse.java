package com.researchflow.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Error body for every 4xx the API produces.
 *
 * @param error   machine-readable code, e.g. VALIDATION_ERROR
 * @param details one line per violated rule, omitted when there is only a message
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, List<String> details, Instant timestamp) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null, Instant.now());
    }

    public static ErrorResponse of(String error, String message, List<String> details) {
        return new ErrorResponse(error, message, details, Instant.now());
    }
}
