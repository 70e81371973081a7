package com.researchflow.orchestrator.repository;

import com.researchflow.orchestrator.model.Step;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD for the steps table.
 */
public interface StepRepository extends JpaRepository<Step, UUID> {

    /** Steps of one job attempt, in pipeline order. */
    List<Step> findByJobIdAndAttemptOrderByOrderIndexAsc(UUID jobId, int attempt);
}
