package com.researchflow.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One pipeline step within one attempt of a Job.
 *
 * Every attempt opens a fresh set of step rows, so a step's status never
 * reverts even when the job is retried. Order within an attempt is fixed by
 * {@code orderIndex} and the steps run strictly in that order.
 *
 * DB table: steps  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "steps")
public class Step {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false, updatable = false)
    private Job job;

    @Column(nullable = false, updatable = false)
    private int attempt;

    @Column(nullable = false, updatable = false)
    private String name;

    @Column(name = "order_index", nullable = false, updatable = false)
    private int orderIndex;

    @Column(name = "task_type", nullable = false, updatable = false)
    private String taskType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepStatus status = StepStatus.PENDING;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // artifact://{workflow}/{stage}/{step}; set once the step is DONE.
    @Column(name = "artifact_ref")
    private String artifactRef;

    // True when the step was satisfied by an artifact from an earlier attempt.
    @Column(nullable = false)
    private boolean reused = false;

    // True for a best-effort failure the pipeline continued past.
    @Column(nullable = false)
    private boolean warning = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_code")
    private ErrorCode errorCode;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Step() {}   // required by JPA

    public Step(Job job, int attempt, String name, int orderIndex, String taskType) {
        this.job        = job;
        this.attempt    = attempt;
        this.name       = name;
        this.orderIndex = orderIndex;
        this.taskType   = taskType;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public void start(Instant now) {
        moveTo(StepStatus.RUNNING);
        this.startedAt = now;
    }

    public void complete(String artifactRef, Instant now) {
        moveTo(StepStatus.DONE);
        this.artifactRef = artifactRef;
        this.finishedAt  = now;
    }

    /** PENDING → DONE without running: an artifact for this step already exists. */
    public void reuse(String artifactRef, Instant now) {
        complete(artifactRef, now);
        this.reused    = true;
        this.startedAt = now;
    }

    public void fail(ErrorCode code, String message, boolean warning, Instant now) {
        moveTo(StepStatus.FAILED);
        this.errorCode    = code;
        this.errorMessage = message;
        this.warning      = warning;
        this.finishedAt   = now;
    }

    public void skip(Instant now) {
        moveTo(StepStatus.SKIPPED);
        this.finishedAt = now;
    }

    private void moveTo(StepStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Step '" + name + "' cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID       getId()           { return id; }
    public Job        getJob()          { return job; }
    public int        getAttempt()      { return attempt; }
    public String     getName()         { return name; }
    public int        getOrderIndex()   { return orderIndex; }
    public String     getTaskType()     { return taskType; }
    public StepStatus getStatus()       { return status; }
    public Instant    getStartedAt()    { return startedAt; }
    public Instant    getFinishedAt()   { return finishedAt; }
    public String     getArtifactRef()  { return artifactRef; }
    public boolean    isReused()        { return reused; }
    public boolean    isWarning()       { return warning; }
    public ErrorCode  getErrorCode()    { return errorCode; }
    public String     getErrorMessage() { return errorMessage; }
}
