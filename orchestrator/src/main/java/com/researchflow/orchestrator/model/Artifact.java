package com.researchflow.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Output of one step, keyed by (workflow, stage, step name).
 *
 * Written once and never updated. The unique constraint on the key is what
 * rejects a second writer; see {@code ArtifactStore}.
 *
 * DB table: artifacts  (created by Flyway V1 migration)
 */
@Entity
@Immutable
@Table(name = "artifacts",
       uniqueConstraints = @UniqueConstraint(
               name = "uq_artifacts_step_key",
               columnNames = {"workflow_id", "stage_id", "step_name"}))
public class Artifact {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private String workflowId;

    @Column(name = "stage_id", nullable = false)
    private int stageId;

    @Column(name = "step_name", nullable = false)
    private String stepName;

    // The job that produced the value.
    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "content_type", nullable = false)
    private String contentType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected Artifact() {}   // required by JPA

    public Artifact(String workflowId, int stageId, String stepName, UUID jobId,
                    String contentType, String payload, Instant createdAt) {
        this.workflowId  = workflowId;
        this.stageId     = stageId;
        this.stepName    = stepName;
        this.jobId       = jobId;
        this.contentType = contentType;
        this.payload     = payload;
        this.createdAt   = createdAt;
    }

    /** Stable reference stored on the step row and reported in the job result. */
    public String reference() {
        return "artifact://" + workflowId + "/" + stageId + "/" + stepName;
    }

    public UUID    getId()          { return id; }
    public String  getWorkflowId()  { return workflowId; }
    public int     getStageId()     { return stageId; }
    public String  getStepName()    { return stepName; }
    public UUID    getJobId()       { return jobId; }
    public String  getContentType() { return contentType; }
    public String  getPayload()     { return payload; }
    public Instant getCreatedAt()   { return createdAt; }
}
