package com.researchflow.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchflow.orchestrator.events.ProgressBroadcaster;
import com.researchflow.orchestrator.events.ProgressEvent;
import com.researchflow.orchestrator.model.Artifact;
import com.researchflow.orchestrator.model.ErrorCode;
import com.researchflow.orchestrator.model.FailurePolicy;
import com.researchflow.orchestrator.model.Job;
import com.researchflow.orchestrator.model.Step;
import com.researchflow.orchestrator.pipeline.StageCatalog;
import com.researchflow.orchestrator.pipeline.StageDefinition;
import com.researchflow.orchestrator.pipeline.StepDefinition;
import com.researchflow.orchestrator.router.DispatchResult;
import com.researchflow.orchestrator.router.RouterDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one attempt of a stage: its steps strictly in order, each routed to
 * an agent through the {@link RouterDispatcher}.
 *
 * For every step:
 *   0. stop if cancellation was requested
 *   1. reuse the artifact an earlier attempt already wrote for this step, if any
 *   2. mark it running and emit a progress event
 *   3. build its input from the original request and the prior steps' outputs
 *   4. dispatch
 *   5. on success, write the artifact and mark the step done
 *   6. on failure, apply the step's policy for the job's mode:
 *        best_effort → warning, step failed, pipeline continues with a partial output
 *        strict      → step failed, remaining steps skipped, attempt aborted
 *      FATAL aborts regardless of policy.
 *
 * State is persisted before the matching event is published. The terminal
 * event and the job's final status are written by the caller from the
 * returned {@link StageOutcome}.
 */
@Component
public class StageOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StageOrchestrator.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final StageCatalog        catalog;
    private final JobService          jobService;
    private final ArtifactStore       artifactStore;
    private final RouterDispatcher    dispatcher;
    private final ProgressBroadcaster broadcaster;
    private final ObjectMapper        objectMapper;
    private final Clock               clock;

    public StageOrchestrator(StageCatalog catalog,
                             JobService jobService,
                             ArtifactStore artifactStore,
                             RouterDispatcher dispatcher,
                             ProgressBroadcaster broadcaster,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.catalog       = catalog;
        this.jobService    = jobService;
        this.artifactStore = artifactStore;
        this.dispatcher    = dispatcher;
        this.broadcaster   = broadcaster;
        this.objectMapper  = objectMapper;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Entry point, called by StageWorkerPool for each claimed job
    // ------------------------------------------------------------------

    public StageOutcome execute(Job job) {
        StageDefinition stage   = catalog.get(job.getStageId());
        Map<String, Object> request = jobService.requestPayload(job);
        List<Step> steps        = jobService.openAttempt(job, stage);

        log.info("Running stage {} '{}' for workflow {} ({} steps, mode={}, attempt={})",
                stage.id(), stage.name(), job.getWorkflowId(), steps.size(), job.getMode(), job.getAttemptCount());

        Map<String, Object> outputs   = new LinkedHashMap<>();
        List<String>        artifacts = new ArrayList<>();
        List<String>        warnings  = new ArrayList<>();
        int processed = 0;

        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            StepDefinition def = stage.steps().get(i);

            // 0. cooperative cancellation, only between steps
            if (jobService.isCancelRequested(job.getId())) {
                skipFrom(job, steps, i, processed);
                log.info("Job {} cancelled before step '{}'", job.getId(), step.getName());
                return StageOutcome.failed(ErrorCode.CANCELLED, "Cancelled before step '" + step.getName() + "'",
                        null, artifacts, outputs, warnings);
            }

            // 1. checkpoint reuse
            Optional<Artifact> existing = artifactStore.find(job.getWorkflowId(), job.getStageId(), step.getName());
            if (existing.isPresent()) {
                Artifact artifact = existing.get();
                step.reuse(artifact.reference(), clock.instant());
                jobService.saveStep(step);
                outputs.put(step.getName(), fromJson(artifact.getPayload()));
                artifacts.add(artifact.reference());
                processed++;
                report(job, step, processed, steps.size());
                log.info("Step '{}' satisfied by existing artifact {}", step.getName(), artifact.reference());
                continue;
            }

            // 2. running
            step.start(clock.instant());
            jobService.saveStep(step);
            broadcaster.publish(job.getId(),
                    ProgressEvent.step(step.getName(), step.getStatus(), percent(processed, steps.size()), clock.instant()));

            // 3-4. build input and dispatch
            Map<String, Object> input = stepInput(job, step, request, outputs);
            DispatchResult result = dispatcher.dispatch(step.getTaskType(), input, job.getMode());

            // 5. success
            if (result.success()) {
                Artifact artifact;
                try {
                    artifact = artifactStore.write(job, step.getName(), toJson(result.output()));
                } catch (ArtifactConflictException e) {
                    log.error("Integrity violation on step '{}': {}", step.getName(), e.getMessage());
                    step.fail(ErrorCode.FATAL, "Artifact already written by another job", false, clock.instant());
                    jobService.saveStep(step);
                    processed++;
                    report(job, step, processed, steps.size());
                    skipFrom(job, steps, i + 1, processed);
                    return StageOutcome.failed(ErrorCode.FATAL, "Artifact integrity violation on step '"
                            + step.getName() + "'", step.getName(), artifacts, outputs, warnings);
                }
                step.complete(artifact.reference(), clock.instant());
                jobService.saveStep(step);
                outputs.put(step.getName(), result.output());
                artifacts.add(artifact.reference());
                processed++;
                report(job, step, processed, steps.size());
                continue;
            }

            // 6. failure policy
            boolean bestEffort = def.policyFor(job.getMode()) == FailurePolicy.BEST_EFFORT
                    && result.errorCode() != ErrorCode.FATAL;
            step.fail(result.errorCode(), result.message(), bestEffort, clock.instant());
            jobService.saveStep(step);
            processed++;
            report(job, step, processed, steps.size());

            if (bestEffort) {
                log.warn("Best-effort step '{}' failed with {}; continuing", step.getName(), result.errorCode());
                warnings.add(step.getName() + ": " + result.errorCode() + " " + result.message());
                Map<String, Object> partial = new LinkedHashMap<>();
                partial.put("partial",    true);
                partial.put("error_code", result.errorCode().name());
                partial.put("output",     result.output());
                outputs.put(step.getName(), partial);
                continue;
            }

            log.warn("Strict step '{}' failed with {}; aborting stage", step.getName(), result.errorCode());
            skipFrom(job, steps, i + 1, processed);
            return StageOutcome.failed(result.errorCode(), result.message(), step.getName(),
                    artifacts, outputs, warnings);
        }

        return StageOutcome.completed(artifacts, outputs, warnings);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * The payload an agent receives:
     * {@code {workflow_id, stage_id, step, request: {...}, prior_outputs: {step: output}}}.
     */
    private static Map<String, Object> stepInput(Job job, Step step, Map<String, Object> request,
                                                 Map<String, Object> priorOutputs) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("workflow_id",   job.getWorkflowId());
        input.put("stage_id",      job.getStageId());
        input.put("step",          step.getName());
        input.put("request",       request);
        input.put("prior_outputs", new LinkedHashMap<>(priorOutputs));
        return input;
    }

    private void skipFrom(Job job, List<Step> steps, int from, int processed) {
        for (int j = from; j < steps.size(); j++) {
            Step skipped = steps.get(j);
            skipped.skip(clock.instant());
            jobService.saveStep(skipped);
            broadcaster.publish(job.getId(), ProgressEvent.step(skipped.getName(), skipped.getStatus(),
                    percent(processed, steps.size()), clock.instant()));
        }
    }

    /** Persist progress (and heartbeat), then publish the step's new status. */
    private void report(Job job, Step step, int processed, int total) {
        int progress = percent(processed, total);
        jobService.recordProgress(job.getId(), job.getAttemptCount(), progress);
        broadcaster.publish(job.getId(), ProgressEvent.step(step.getName(), step.getStatus(), progress, clock.instant()));
    }

    private static int percent(int processed, int total) {
        return total == 0 ? 100 : processed * 100 / total;
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Agent output is not serializable", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored artifact is not valid JSON", e);
        }
    }
}
