package com.researchflow.orchestrator.api.dto;

import com.researchflow.orchestrator.model.Job;

import java.util.UUID;

/**
 * Response body for POST /stages/{stage}/jobs/{job_id}/cancel.
 * A job that was still waiting is already "failed"; a running one stays
 * "active" until its worker reaches the next step boundary.
 */
public record CancelResponse(UUID jobId, String status, boolean cancelRequested) {

    public static CancelResponse from(Job job) {
        return new CancelResponse(job.getId(), job.getStatus().wireName(), job.isCancelRequested());
    }
}
