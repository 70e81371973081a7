package com.researchflow.orchestrator.service;

import com.researchflow.orchestrator.model.JobStatus;

import java.util.UUID;

/**
 * An operation that needs a live job was aimed at a completed or failed one.
 */
public class JobAlreadyFinishedException extends RuntimeException {

    private final UUID      jobId;
    private final JobStatus status;

    public JobAlreadyFinishedException(UUID jobId, JobStatus status) {
        super("Job " + jobId + " is already " + status.wireName());
        this.jobId  = jobId;
        this.status = status;
    }

    public UUID      getJobId()  { return jobId; }
    public JobStatus getStatus() { return status; }
}
