package com.researchflow.orchestrator.service;

import com.researchflow.orchestrator.config.ResearchFlowProperties;
import com.researchflow.orchestrator.events.ProgressBroadcaster;
import com.researchflow.orchestrator.events.ProgressEvent;
import com.researchflow.orchestrator.model.ErrorCode;
import com.researchflow.orchestrator.model.Job;
import com.researchflow.orchestrator.model.JobStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Background workers that drain the jobs table.
 *
 * Every poll interval the scheduler claims as many jobs as there are free
 * slots and hands each to a worker thread, which runs the stage and settles
 * the job:
 * <pre>
 *   completed outcome           → COMPLETED, "complete" event
 *   TRANSIENT_ERROR, attempts left → retry scheduled with backoff, "retrying" event
 *   anything else               → FAILED, "error" event
 * </pre>
 *
 * A second schedule redelivers jobs whose worker stopped heartbeating.
 */
@Component
@EnableScheduling
public class StageWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(StageWorkerPool.class);

    private final JobService          jobService;
    private final StageOrchestrator   orchestrator;
    private final ProgressBroadcaster broadcaster;
    private final Clock               clock;
    private final Duration            shutdownTimeout;

    private final ExecutorService workers;
    private final Semaphore       slots;
    private final String          workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    private volatile boolean accepting = true;

    @Autowired
    public StageWorkerPool(JobService jobService,
                           StageOrchestrator orchestrator,
                           ProgressBroadcaster broadcaster,
                           Clock clock,
                           ResearchFlowProperties properties) {
        this(jobService, orchestrator, broadcaster, clock,
                properties.getWorker().getConcurrency(), properties.getWorker().getShutdownTimeout());
    }

    public StageWorkerPool(JobService jobService,
                           StageOrchestrator orchestrator,
                           ProgressBroadcaster broadcaster,
                           Clock clock,
                           int concurrency,
                           Duration shutdownTimeout) {
        this.jobService      = jobService;
        this.orchestrator    = orchestrator;
        this.broadcaster     = broadcaster;
        this.clock           = clock;
        this.shutdownTimeout = shutdownTimeout;
        this.slots           = new Semaphore(concurrency);
        this.workers         = Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("stage-worker-"));
    }

    // ------------------------------------------------------------------
    // Scheduling
    // ------------------------------------------------------------------

    /** Claim jobs until every slot is busy or the queue has nothing available. */
    @Scheduled(fixedDelayString = "${researchflow.worker.poll-interval-ms:500}")
    public void tick() {
        while (accepting && slots.tryAcquire()) {
            Optional<Job> claimed;
            try {
                claimed = jobService.claimNextJob(workerId);
            } catch (RuntimeException e) {
                slots.release();
                log.error("Queue claim failed: {}", e.getMessage(), e);
                return;
            }
            if (claimed.isEmpty()) {
                slots.release();
                return;
            }
            Job job = claimed.get();
            try {
                workers.submit(() -> {
                    try {
                        run(job);
                    } finally {
                        slots.release();
                    }
                });
            } catch (RejectedExecutionException e) {
                // Shutting down; the claimed row is redelivered by stall recovery.
                slots.release();
                log.warn("Worker pool rejected job {} during shutdown", job.getId());
                return;
            }
        }
    }

    @Scheduled(initialDelayString = "${researchflow.worker.stall-check-interval-ms:60000}",
               fixedDelayString   = "${researchflow.worker.stall-check-interval-ms:60000}")
    public void recoverStalled() {
        List<Job> changed = jobService.recoverStalledJobs();
        for (Job job : changed) {
            announceSettlement(job, job.getAttemptCount() + 1);
        }
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /** Run one attempt of a claimed job and settle it. Never throws. */
    public void run(Job job) {
        // Every log line of this attempt carries these fields, in plain-text and JSON output alike.
        MDC.put("jobId",      job.getId().toString());
        MDC.put("stageId",    String.valueOf(job.getStageId()));
        MDC.put("workflowId", job.getWorkflowId());
        MDC.put("attempt",    String.valueOf(job.getAttemptCount()));
        try {
            StageOutcome outcome = orchestrator.execute(job);
            if (outcome.completed()) {
                jobService.completeJob(job.getId(), job.getAttemptCount(), job.getWorkerId(), outcome)
                        .ifPresentOrElse(
                                done -> broadcaster.publish(done.getId(), ProgressEvent.complete(clock.instant())),
                                () -> staleAttempt(job));
            } else {
                jobService.settleFailure(job.getId(), job.getAttemptCount(), job.getWorkerId(),
                                outcome.errorCode(), outcome.message(), outcome)
                        .ifPresentOrElse(
                                settled -> announceSettlement(settled, job.getAttemptCount() + 1),
                                () -> staleAttempt(job));
            }
        } catch (Exception e) {
            log.error("Unhandled error while running job {}: {}", job.getId(), e.getMessage(), e);
            failFatal(job);
        } finally {
            MDC.clear();
        }
    }

    private void failFatal(Job job) {
        try {
            jobService.settleFailure(job.getId(), job.getAttemptCount(), job.getWorkerId(),
                            ErrorCode.FATAL, "Internal error while running the stage", null)
                    .ifPresentOrElse(
                            failed -> announceSettlement(failed, job.getAttemptCount() + 1),
                            () -> staleAttempt(job));
        } catch (RuntimeException e) {
            // Row stays ACTIVE; stall recovery picks it up once the heartbeat ages out.
            log.error("Could not record failure for job {}: {}", job.getId(), e.getMessage(), e);
        }
    }

    // Another worker owns the job now; its attempt reports the outcome.
    private void staleAttempt(Job job) {
        log.warn("Attempt {} of job {} was taken over; its outcome is discarded",
                job.getAttemptCount(), job.getId());
    }

    private void announceSettlement(Job job, int nextAttempt) {
        if (job.getStatus() == JobStatus.FAILED) {
            broadcaster.publish(job.getId(), ProgressEvent.error(job.getErrorCode(), job.getErrorMessage(), clock.instant()));
        } else if (job.isRetryScheduled()) {
            broadcaster.publish(job.getId(), ProgressEvent.retrying(nextAttempt, job.getErrorCode(),
                    "Attempt " + (nextAttempt - 1) + " failed: " + job.getErrorMessage(), clock.instant()));
        }
    }

    // ------------------------------------------------------------------
    // Shutdown
    // ------------------------------------------------------------------

    /** Stop claiming, then wait (bounded) for in-flight jobs to settle. */
    @PreDestroy
    public void shutdown() {
        accepting = false;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("In-flight jobs did not finish within {}; interrupting", shutdownTimeout);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
