package com.researchflow.orchestrator.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.researchflow.orchestrator.model.ErrorCode;
import com.researchflow.orchestrator.model.Job;
import com.researchflow.orchestrator.model.JobStatus;
import com.researchflow.orchestrator.model.StepStatus;

import java.time.Instant;

/**
 * One entry of a job's progress log.
 *
 * Kinds:
 * <pre>
 *   progress   a step changed status            {step, status, progress}
 *   retrying   the attempt failed transiently    {attempt, error_code, message}
 *   complete   terminal, job completed           {progress=100}
 *   error      terminal, job failed              {error_code, message}
 * </pre>
 *
 * The sequence is assigned by {@link JobEventLog} on append; factories leave it at 0.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(long sequence,
                            String event,
                            String step,
                            String status,
                            Integer progress,
                            Integer attempt,
                            String errorCode,
                            String message,
                            Instant timestamp) {

    public static final String PROGRESS = "progress";
    public static final String RETRYING = "retrying";
    public static final String COMPLETE = "complete";
    public static final String ERROR    = "error";

    public static ProgressEvent step(String step, StepStatus status, int progress, Instant at) {
        return new ProgressEvent(0, PROGRESS, step, status.wireName(), progress, null, null, null, at);
    }

    public static ProgressEvent retrying(int nextAttempt, ErrorCode code, String message, Instant at) {
        return new ProgressEvent(0, RETRYING, null, null, null, nextAttempt, code.name(), message, at);
    }

    public static ProgressEvent complete(Instant at) {
        return new ProgressEvent(0, COMPLETE, null, "completed", 100, null, null, null, at);
    }

    public static ProgressEvent error(ErrorCode code, String message, Instant at) {
        return new ProgressEvent(0, ERROR, null, "failed", null, null, code.name(), message, at);
    }

    /** The terminal event matching a finished job row. */
    public static ProgressEvent finished(Job job) {
        return job.getStatus() == JobStatus.COMPLETED
                ? complete(job.getFinishedAt())
                : error(job.getErrorCode(), job.getErrorMessage(), job.getFinishedAt());
    }

    ProgressEvent withSequence(long seq) {
        return new ProgressEvent(seq, event, step, status, progress, attempt, errorCode, message, timestamp);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return COMPLETE.equals(event) || ERROR.equals(event);
    }
}
