package com.researchflow.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchflow.orchestrator.config.ResearchFlowProperties;
import com.researchflow.orchestrator.model.ErrorCode;
import com.researchflow.orchestrator.model.Job;
import com.researchflow.orchestrator.model.JobStatus;
import com.researchflow.orchestrator.model.Step;
import com.researchflow.orchestrator.pipeline.StageDefinition;
import com.researchflow.orchestrator.pipeline.StepDefinition;
import com.researchflow.orchestrator.repository.JobRepository;
import com.researchflow.orchestrator.repository.StepRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Core business logic for the job lifecycle: submission, queue claims,
 * step bookkeeping, retry decisions and terminal transitions.
 *
 * Methods that change a job's status load the row with a write lock so they
 * serialize with queue claims and cancellation. Progress and heartbeat go
 * through a targeted UPDATE instead.
 *
 * Metrics:
 * <pre>
 *   researchflow.jobs.submitted{stage, deduplicated}
 *   researchflow.jobs.retried{stage, error_code}
 *   researchflow.jobs.finished{stage, outcome}
 * </pre>
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final JobRepository       jobRepo;
    private final StepRepository      stepRepo;
    private final SubmissionValidator validator;
    private final ObjectMapper        objectMapper;
    private final MeterRegistry       meterRegistry;
    private final Clock               clock;
    private final int                 maxAttempts;
    private final Duration            backoffBase;
    private final Duration            stallTimeout;

    public JobService(JobRepository jobRepo,
                      StepRepository stepRepo,
                      SubmissionValidator validator,
                      ObjectMapper objectMapper,
                      MeterRegistry meterRegistry,
                      Clock clock,
                      ResearchFlowProperties properties) {
        this.jobRepo       = jobRepo;
        this.stepRepo      = stepRepo;
        this.validator     = validator;
        this.objectMapper  = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.maxAttempts   = properties.getWorker().getMaxAttempts();
        this.backoffBase   = properties.getWorker().getBackoffBase();
        this.stallTimeout  = properties.getWorker().getStallTimeout();
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Validate a stage request and enqueue it, unless a live job already
     * exists for the same idempotency key.
     *
     * Not transactional: the insert runs in its own repository transaction,
     * so a unique-index violation from a concurrent duplicate can be caught
     * here and answered with the job that won.
     *
     * @param idempotencyKey client-supplied key, or null to use "{workflow_id}:{stage}"
     * @throws ValidationException when the request breaks any input rule
     */
    public SubmissionResult submit(int stageId, String workflowId, String mode,
                                   Map<String, Object> fields, String idempotencyKey) {
        SubmissionValidator.ValidSubmission valid = validator.validate(stageId, workflowId, mode, fields);
        String key = (idempotencyKey == null || idempotencyKey.isBlank())
                ? valid.workflowId() + ":" + stageId
                : idempotencyKey.trim();

        Optional<Job> existing = findLive(key);
        if (existing.isPresent()) {
            return deduplicated(existing.get(), key);
        }

        Job job = new Job(stageId, valid.workflowId(), valid.mode(), key, toJson(valid.fields()), clock.instant());
        try {
            job = jobRepo.save(job);
        } catch (DataIntegrityViolationException e) {
            // Lost the race against a concurrent submission with the same key.
            return deduplicated(findLive(key).orElseThrow(() -> e), key);
        }
        meterRegistry.counter("researchflow.jobs.submitted",
                "stage", String.valueOf(stageId), "deduplicated", "false").increment();
        log.info("Job {} queued: stage={} workflow={} mode={}", job.getId(), stageId, job.getWorkflowId(), job.getMode());
        return new SubmissionResult(job, false);
    }

    public Optional<Job> findById(UUID id) {
        return jobRepo.findById(id);
    }

    /** Those of {@code ids} whose job has reached a terminal status. */
    @Transactional(readOnly = true)
    public List<Job> findFinished(Collection<UUID> ids) {
        return jobRepo.findAllById(ids).stream()
                .filter(job -> job.getStatus().isTerminal())
                .toList();
    }

    /** The job plus its latest attempt's steps; empty if unknown or owned by another stage. */
    @Transactional(readOnly = true)
    public Optional<JobSnapshot> snapshot(int stageId, UUID jobId) {
        return jobRepo.findById(jobId)
                .filter(job -> job.getStageId() == stageId)
                .map(job -> new JobSnapshot(job,
                        stepRepo.findByJobIdAndAttemptOrderByOrderIndexAsc(jobId, job.getAttemptCount()),
                        job.getResultJson() == null ? null : fromJson(job.getResultJson())));
    }

    // ------------------------------------------------------------------
    // Queue claims (called by the worker pool)
    // ------------------------------------------------------------------

    /**
     * Claim the next available job and start a new attempt on it.
     *
     * The row stays locked from the SKIP LOCKED select until this
     * transaction commits with the job marked ACTIVE, so two workers never
     * claim the same attempt.
     */
    @Transactional
    public Optional<Job> claimNextJob(String workerId) {
        Instant now = clock.instant();
        Optional<Job> claimed = jobRepo.claimNext(now);
        claimed.ifPresent(job -> {
            job.claim(workerId, now);
            jobRepo.save(job);
            log.info("Worker '{}' claimed job {} (stage={}, attempt={})",
                    workerId, job.getId(), job.getStageId(), job.getAttemptCount());
        });
        return claimed;
    }

    /** Open a fresh set of PENDING step rows for the job's current attempt. */
    @Transactional
    public List<Step> openAttempt(Job job, StageDefinition stage) {
        List<Step> steps = new ArrayList<>();
        for (StepDefinition def : stage.steps()) {
            steps.add(new Step(job, job.getAttemptCount(), def.name(), def.order(), def.taskType()));
        }
        return stepRepo.saveAll(steps);
    }

    @Transactional
    public Step saveStep(Step step) {
        return stepRepo.save(step);
    }

    /**
     * Persist progress and refresh the heartbeat in one statement. A worker
     * whose attempt has been taken over updates nothing.
     */
    @Transactional
    public void recordProgress(UUID jobId, int attempt, int progress) {
        if (jobRepo.updateProgress(jobId, attempt, progress, clock.instant()) == 0) {
            log.debug("Progress for job {} attempt {} ignored: attempt no longer current", jobId, attempt);
        }
    }

    @Transactional(readOnly = true)
    public boolean isCancelRequested(UUID jobId) {
        return jobRepo.findCancelRequestedById(jobId).orElse(false);
    }

    @Transactional(readOnly = true)
    public Map<String, Object> requestPayload(Job job) {
        return fromJson(job.getPayloadJson());
    }

    // ------------------------------------------------------------------
    // Settlement
    // ------------------------------------------------------------------

    /**
     * Complete the job with the outcome of the given attempt.
     *
     * @return empty when the attempt is no longer the job's current one
     *         (redelivered after a stall, or cancelled); nothing is written then
     */
    @Transactional
    public Optional<Job> completeJob(UUID jobId, int attempt, String workerId, StageOutcome outcome) {
        Job job = lock(jobId);
        if (!owns(job, attempt, workerId)) {
            return Optional.empty();
        }
        job.complete(toJson(outcome.summary()), clock.instant());
        finished(job, "completed");
        log.info("Job {} COMPLETED after {} attempt(s), {} warning(s)",
                jobId, job.getAttemptCount(), outcome.warnings().size());
        return Optional.of(jobRepo.save(job));
    }

    /**
     * Record a failed attempt. A retryable code with attempts left schedules
     * the next attempt after the backoff delay; anything else fails the job.
     *
     * @param outcome what the attempt produced, or null when it never got that far
     * @return the job, either still ACTIVE with a retry scheduled, or FAILED;
     *         empty when the attempt is no longer the job's current one
     */
    @Transactional
    public Optional<Job> settleFailure(UUID jobId, int attempt, String workerId,
                                       ErrorCode code, String message, StageOutcome outcome) {
        Job job = lock(jobId);
        if (!owns(job, attempt, workerId)) {
            return Optional.empty();
        }
        return Optional.of(settle(job, code, message, outcome));
    }

    private Job settle(Job job, ErrorCode code, String message, StageOutcome outcome) {
        Instant now = clock.instant();
        if (code.isRetryable() && job.getAttemptCount() < maxAttempts) {
            Duration delay = backoff(job.getAttemptCount());
            job.scheduleRetry(now, now.plus(delay), code, message);
            meterRegistry.counter("researchflow.jobs.retried",
                    "stage", String.valueOf(job.getStageId()), "error_code", code.name()).increment();
            log.warn("Job {} attempt {}/{} failed with {}, retrying in {}",
                    job.getId(), job.getAttemptCount(), maxAttempts, code, delay);
            return jobRepo.save(job);
        }
        job.fail(code, message, outcome == null ? null : toJson(outcome.summary()), now);
        finished(job, "failed");
        log.error("Job {} FAILED with {} after {} attempt(s): {}", job.getId(), code, job.getAttemptCount(), message);
        return jobRepo.save(job);
    }

    private boolean owns(Job job, int attempt, String workerId) {
        if (job.isRunningAttempt(attempt, workerId)) {
            return true;
        }
        log.warn("Ignoring stale settlement of job {} attempt {} by '{}': job is {} at attempt {} (worker={}, retry={})",
                job.getId(), attempt, workerId, job.getStatus(), job.getAttemptCount(),
                job.getWorkerId(), job.isRetryScheduled());
        return false;
    }

    /** Delay before attempt {@code attempt + 1}: base × 2^(attempt-1). */
    public Duration backoff(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 20));
        return backoffBase.multipliedBy(1L << exponent);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Request cancellation. A job no worker is running (queued, or waiting
     * for a retry) fails right away; a running job is flagged and stops at
     * the next step boundary.
     *
     * @return empty if the job is unknown or belongs to another stage
     * @throws JobAlreadyFinishedException if the job is already terminal
     */
    @Transactional
    public Optional<Job> requestCancel(int stageId, UUID jobId) {
        Optional<Job> found = jobRepo.findByIdForUpdate(jobId).filter(j -> j.getStageId() == stageId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Job job = found.get();
        if (job.getStatus().isTerminal()) {
            throw new JobAlreadyFinishedException(jobId, job.getStatus());
        }
        Instant now = clock.instant();
        job.requestCancel(now);
        if (job.getStatus() == JobStatus.QUEUED || job.isRetryScheduled()) {
            job.fail(ErrorCode.CANCELLED, "Cancelled before execution", null, now);
            finished(job, "cancelled");
            log.info("Job {} cancelled while waiting", jobId);
        } else {
            log.info("Cancellation requested for running job {}", jobId);
        }
        return Optional.of(jobRepo.save(job));
    }

    // ------------------------------------------------------------------
    // Stall recovery
    // ------------------------------------------------------------------

    /**
     * Redeliver jobs whose worker stopped heartbeating: schedule a retry when
     * attempts remain, fail them otherwise.
     *
     * @return the jobs that were changed
     */
    @Transactional
    public List<Job> recoverStalledJobs() {
        Instant cutoff = clock.instant().minus(stallTimeout);
        List<Job> stalled = jobRepo.lockStalled(cutoff);
        List<Job> changed = new ArrayList<>();
        for (Job job : stalled) {
            log.warn("Recovering stalled job {} (worker={}, last heartbeat={})",
                    job.getId(), job.getWorkerId(), job.getHeartbeatAt());
            changed.add(settle(job, ErrorCode.TRANSIENT_ERROR,
                    "Worker stopped responding during attempt " + job.getAttemptCount(), null));
        }
        return changed;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Optional<Job> findLive(String key) {
        return jobRepo.findFirstByIdempotencyKeyAndStatusNotOrderByCreatedAtDesc(key, JobStatus.FAILED);
    }

    private SubmissionResult deduplicated(Job job, String key) {
        meterRegistry.counter("researchflow.jobs.submitted",
                "stage", String.valueOf(job.getStageId()), "deduplicated", "true").increment();
        log.info("Submission with key '{}' matched existing job {} ({})", key, job.getId(), job.getStatus());
        return new SubmissionResult(job, true);
    }

    private Job lock(UUID jobId) {
        return jobRepo.findByIdForUpdate(jobId)
                .orElseThrow(() -> new IllegalStateException("Job disappeared: " + jobId));
    }

    private void finished(Job job, String outcome) {
        meterRegistry.counter("researchflow.jobs.finished",
                "stage", String.valueOf(job.getStageId()), "outcome", outcome).increment();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode job data", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored job data is not valid JSON", e);
        }
    }
}
