package com.researchflow.orchestrator.service;

import com.researchflow.orchestrator.model.Artifact;
import com.researchflow.orchestrator.model.Job;
import com.researchflow.orchestrator.repository.ArtifactRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Write-once storage for step outputs, keyed by (workflow, stage, step).
 */
@Component
public class ArtifactStore {

    public static final String JSON = "application/json";

    private final ArtifactRepository artifactRepo;
    private final Clock              clock;

    public ArtifactStore(ArtifactRepository artifactRepo, Clock clock) {
        this.artifactRepo = artifactRepo;
        this.clock        = clock;
    }

    public Optional<Artifact> find(String workflowId, int stageId, String stepName) {
        return artifactRepo.findByWorkflowIdAndStageIdAndStepName(workflowId, stageId, stepName);
    }

    /**
     * Persist a step's output.
     *
     * @throws ArtifactConflictException when the key already holds a value;
     *         the existing artifact is left untouched
     */
    public Artifact write(Job job, String stepName, String payloadJson) {
        Artifact artifact = new Artifact(job.getWorkflowId(), job.getStageId(), stepName, job.getId(),
                JSON, payloadJson, clock.instant());
        try {
            return artifactRepo.saveAndFlush(artifact);
        } catch (DataIntegrityViolationException e) {
            throw new ArtifactConflictException(artifact.reference(), e);
        }
    }
}
