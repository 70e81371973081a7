package com.researchflow.orchestrator.api.dto;

import com.researchflow.orchestrator.service.SubmissionResult;

import java.util.UUID;

/**
 * Response body for POST /stages/{stage}/execute.
 *
 * status is "queued" for a new job; a deduplicated submission reports the
 * existing job's current status instead.
 */
public record JobAcceptedResponse(
        UUID    jobId,
        String  status,
        boolean deduplicated
) {
    public static JobAcceptedResponse from(SubmissionResult result) {
        return new JobAcceptedResponse(
                result.job().getId(),
                result.job().getStatus().wireName(),
                result.deduplicated()
        );
    }
}
