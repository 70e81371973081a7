package com.researchflow.orchestrator.api.dto;

import com.researchflow.orchestrator.model.Step;

import java.time.Instant;

/**
 * One entry of {@code step_statuses} in the job status response.
 */
public record StepStatusResponse(
        String  name,
        int     order,
        String  taskType,
        String  status,
        boolean reused,
        boolean warning,
        String  artifactRef,
        String  errorCode,
        String  errorMessage,
        Instant startedAt,
        Instant finishedAt
) {
    public static StepStatusResponse from(Step s) {
        return new StepStatusResponse(
                s.getName(),
                s.getOrderIndex(),
                s.getTaskType(),
                s.getStatus().wireName(),
                s.isReused(),
                s.isWarning(),
                s.getArtifactRef(),
                s.getErrorCode() == null ? null : s.getErrorCode().name(),
                s.getErrorMessage(),
                s.getStartedAt(),
                s.getFinishedAt()
        );
    }
}
