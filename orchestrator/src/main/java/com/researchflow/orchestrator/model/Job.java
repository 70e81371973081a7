package com.researchflow.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One request to execute a numbered stage for a workflow.
 *
 * The jobs table doubles as the work queue: a row is claimable when it is
 * QUEUED (or ACTIVE with a retry scheduled) and its availability time has
 * passed. Workers claim rows with SELECT FOR UPDATE SKIP LOCKED.
 *
 * Status only moves forward; every mutator below checks the transition and
 * throws {@link IllegalStateException} on an attempt to go backwards.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "stage_id", nullable = false, updatable = false)
    private int stageId;

    @Column(name = "workflow_id", nullable = false, updatable = false)
    private String workflowId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private GovernanceMode mode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.QUEUED;

    // Header value, or "{workflow_id}:{stage}" when the client sent none.
    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    // Validated request fields, JSON-encoded. Fed to every step as "request".
    @Column(name = "payload_json", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String payloadJson;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount = 0;

    @Column(nullable = false)
    private int progress = 0;

    // Earliest time a worker may claim this row. Pushed forward by retry backoff.
    @Column(name = "available_at", nullable = false)
    private Instant availableAt;

    @Column(name = "retry_scheduled", nullable = false)
    private boolean retryScheduled = false;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested = false;

    // Refreshed after every step; stale heartbeats mark a crashed worker.
    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_code")
    private ErrorCode errorCode;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // Set by every mutator from the caller's clock.
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(int stageId, String workflowId, GovernanceMode mode,
               String idempotencyKey, String payloadJson, Instant now) {
        this.stageId        = stageId;
        this.workflowId     = workflowId;
        this.mode           = mode;
        this.idempotencyKey = idempotencyKey;
        this.payloadJson    = payloadJson;
        this.createdAt      = now;
        this.updatedAt      = now;
        this.availableAt    = now;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Start a new attempt. Valid for a QUEUED job, or an ACTIVE job whose
     * retry has been scheduled.
     */
    public void claim(String workerId, Instant now) {
        if (status == JobStatus.ACTIVE && !retryScheduled) {
            throw new IllegalStateException("Job " + id + " is already running on " + this.workerId);
        }
        if (status != JobStatus.ACTIVE) {
            moveTo(JobStatus.ACTIVE);
        }
        this.attemptCount++;
        this.retryScheduled = false;
        this.workerId       = workerId;
        this.processedAt    = now;
        this.heartbeatAt    = now;
        this.updatedAt      = now;
    }

    /**
     * True while {@code attempt} is the attempt in flight and
     * {@code workerId} is the worker that claimed it.
     */
    public boolean isRunningAttempt(int attempt, String workerId) {
        return status == JobStatus.ACTIVE
                && !retryScheduled
                && attemptCount == attempt
                && Objects.equals(this.workerId, workerId);
    }

    /** Park an ACTIVE job until {@code availableAt}; the last error stays visible meanwhile. */
    public void scheduleRetry(Instant now, Instant availableAt, ErrorCode code, String message) {
        if (status != JobStatus.ACTIVE) {
            throw new IllegalStateException("Job " + id + " cannot be retried from " + status);
        }
        this.retryScheduled = true;
        this.availableAt    = availableAt;
        this.errorCode      = code;
        this.errorMessage   = message;
        this.workerId       = null;
        this.updatedAt      = now;
    }

    public void complete(String resultJson, Instant now) {
        moveTo(JobStatus.COMPLETED);
        this.resultJson   = resultJson;
        this.progress     = 100;
        this.finishedAt   = now;
        this.errorCode    = null;
        this.errorMessage = null;
        this.retryScheduled = false;
        this.updatedAt    = now;
    }

    public void fail(ErrorCode code, String message, String resultJson, Instant now) {
        moveTo(JobStatus.FAILED);
        this.errorCode      = code;
        this.errorMessage   = message;
        this.resultJson     = resultJson;
        this.finishedAt     = now;
        this.retryScheduled = false;
        this.updatedAt      = now;
    }

    public void requestCancel(Instant now) {
        this.cancelRequested = true;
        this.updatedAt       = now;
    }

    private void moveTo(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Job " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID           getId()             { return id; }
    public int            getStageId()        { return stageId; }
    public String         getWorkflowId()     { return workflowId; }
    public GovernanceMode getMode()           { return mode; }
    public JobStatus      getStatus()         { return status; }
    public String         getIdempotencyKey() { return idempotencyKey; }
    public String         getPayloadJson()    { return payloadJson; }
    public int            getAttemptCount()   { return attemptCount; }
    public int            getProgress()       { return progress; }
    public Instant        getAvailableAt()    { return availableAt; }
    public boolean        isRetryScheduled()  { return retryScheduled; }
    public boolean        isCancelRequested() { return cancelRequested; }
    public Instant        getHeartbeatAt()    { return heartbeatAt; }
    public String         getWorkerId()       { return workerId; }
    public String         getResultJson()     { return resultJson; }
    public ErrorCode      getErrorCode()      { return errorCode; }
    public String         getErrorMessage()   { return errorMessage; }
    public Instant        getCreatedAt()      { return createdAt; }
    public Instant        getProcessedAt()    { return processedAt; }
    public Instant        getFinishedAt()     { return finishedAt; }
    public Instant        getUpdatedAt()      { return updatedAt; }
}
