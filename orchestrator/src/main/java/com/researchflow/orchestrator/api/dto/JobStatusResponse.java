package com.researchflow.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.researchflow.orchestrator.model.Job;
import com.researchflow.orchestrator.service.JobSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for GET /stages/{stage}/jobs/{job_id}/status.
 *
 * result is present once the job has finished (completed, or failed after at
 * least one step ran); error only when it failed or a retry is pending.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        UUID                     jobId,
        int                      stageId,
        String                   workflowId,
        String                   mode,
        String                   status,
        int                      attemptCount,
        int                      progress,
        Boolean                  retryScheduled,
        List<StepStatusResponse> stepStatuses,
        Map<String, Object>      result,
        ErrorBody                error,
        Instant                  createdAt,
        Instant                  processedAt,
        Instant                  finishedAt
) {

    public record ErrorBody(String code, String message) {}

    public static JobStatusResponse from(JobSnapshot snapshot) {
        Job job = snapshot.job();
        return new JobStatusResponse(
                job.getId(),
                job.getStageId(),
                job.getWorkflowId(),
                job.getMode().name(),
                job.getStatus().wireName(),
                job.getAttemptCount(),
                job.getProgress(),
                job.isRetryScheduled() ? Boolean.TRUE : null,
                snapshot.steps().stream().map(StepStatusResponse::from).toList(),
                snapshot.result(),
                job.getErrorCode() == null ? null : new ErrorBody(job.getErrorCode().name(), job.getErrorMessage()),
                job.getCreatedAt(),
                job.getProcessedAt(),
                job.getFinishedAt()
        );
    }
}
