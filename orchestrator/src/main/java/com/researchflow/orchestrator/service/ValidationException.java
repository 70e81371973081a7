package com.researchflow.orchestrator.service;

import java.util.List;

/**
 * A submission broke one or more input rules. Carries every violation, not
 * just the first, so the caller can fix them in one round trip.
 */
public class ValidationException extends RuntimeException {

    private final List<String> details;

    public ValidationException(List<String> details) {
        super("Request validation failed: " + String.join("; ", details));
        this.details = List.copyOf(details);
    }

    public List<String> getDetails() { return details; }
}
