package com.researchflow.orchestrator.repository;

import com.researchflow.orchestrator.model.Artifact;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ArtifactRepository extends JpaRepository<Artifact, UUID> {

    Optional<Artifact> findByWorkflowIdAndStageIdAndStepName(String workflowId, int stageId, String stepName);
}
