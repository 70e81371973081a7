package com.researchflow.orchestrator.service;

import com.researchflow.orchestrator.events.ProgressBroadcaster;
import com.researchflow.orchestrator.events.ProgressEvent;
import com.researchflow.orchestrator.model.ErrorCode;
import com.researchflow.orchestrator.model.GovernanceMode;
import com.researchflow.orchestrator.model.Job;
import com.researchflow.orchestrator.support.MutableClock;
import com.researchflow.orchestrator.support.TestJobs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StageWorkerPoolTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");

    @Mock JobService        jobService;
    @Mock StageOrchestrator orchestrator;

    ProgressBroadcaster broadcaster;
    StageWorkerPool     pool;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        broadcaster = new ProgressBroadcaster(100, Duration.ofMinutes(5), clock);
        pool = new StageWorkerPool(jobService, orchestrator, broadcaster, clock, 2, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    private ProgressEvent lastEvent(Job job) {
        List<ProgressEvent> events = broadcaster.read(job.getId(), 0);
        assertThat(events).isNotEmpty();
        return events.get(events.size() - 1);
    }

    private static StageOutcome failed(ErrorCode code) {
        return StageOutcome.failed(code, "Step 'screen' failed", "screen", List.of(), Map.of(), List.of());
    }

    // ------------------------------------------------------------------
    // run()
    // ------------------------------------------------------------------

    @Test
    void run_completedOutcome_completesJobAndPublishesComplete() {
        Job job = TestJobs.active(2, "wf-123", GovernanceMode.LIVE, NOW);
        StageOutcome outcome = StageOutcome.completed(List.of(), Map.of(), List.of());
        when(orchestrator.execute(job)).thenReturn(outcome);
        when(jobService.completeJob(job.getId(), 1, "worker-test", outcome)).thenReturn(Optional.of(job));

        pool.run(job);

        verify(jobService).completeJob(job.getId(), 1, "worker-test", outcome);
        assertThat(lastEvent(job).event()).isEqualTo(ProgressEvent.COMPLETE);
        assertThat(lastEvent(job).progress()).isEqualTo(100);
    }

    @Test
    void run_finalFailure_publishesErrorEvent() {
        Job job = TestJobs.active(2, "wf-123", GovernanceMode.LIVE, NOW);
        StageOutcome outcome = failed(ErrorCode.AGENT_ERROR);
        when(orchestrator.execute(job)).thenReturn(outcome);
        Job settled = TestJobs.withId(TestJobs.active(2, "wf-123", GovernanceMode.LIVE, NOW), job.getId());
        settled.fail(ErrorCode.AGENT_ERROR, "Step 'screen' failed", null, NOW);
        when(jobService.settleFailure(job.getId(), 1, "worker-test",
                ErrorCode.AGENT_ERROR, "Step 'screen' failed", outcome))
                .thenReturn(Optional.of(settled));

        pool.run(job);

        ProgressEvent error = lastEvent(job);
        assertThat(error.event()).isEqualTo(ProgressEvent.ERROR);
        assertThat(error.errorCode()).isEqualTo("AGENT_ERROR");
    }

    @Test
    void run_transientFailureWithAttemptsLeft_publishesRetrying() {
        Job job = TestJobs.active(2, "wf-123", GovernanceMode.LIVE, NOW);
        StageOutcome outcome = failed(ErrorCode.TRANSIENT_ERROR);
        when(orchestrator.execute(job)).thenReturn(outcome);
        Job settled = TestJobs.withId(TestJobs.active(2, "wf-123", GovernanceMode.LIVE, NOW), job.getId());
        settled.scheduleRetry(NOW, NOW.plusSeconds(5), ErrorCode.TRANSIENT_ERROR, "Step 'screen' failed");
        when(jobService.settleFailure(eq(job.getId()), eq(1), eq("worker-test"),
                eq(ErrorCode.TRANSIENT_ERROR), anyString(), eq(outcome)))
                .thenReturn(Optional.of(settled));

        pool.run(job);

        ProgressEvent retrying = lastEvent(job);
        assertThat(retrying.event()).isEqualTo(ProgressEvent.RETRYING);
        assertThat(retrying.attempt()).isEqualTo(2);
        assertThat(retrying.isTerminal()).isFalse();
    }

    @Test
    void run_unexpectedException_failsJobAsFatal() {
        Job job = TestJobs.active(2, "wf-123", GovernanceMode.LIVE, NOW);
        when(orchestrator.execute(job)).thenThrow(new IllegalStateException("Stored artifact is not valid JSON"));
        Job failed = TestJobs.withId(TestJobs.active(2, "wf-123", GovernanceMode.LIVE, NOW), job.getId());
        failed.fail(ErrorCode.FATAL, "Internal error while running the stage", null, NOW);
        when(jobService.settleFailure(eq(job.getId()), eq(1), eq("worker-test"),
                eq(ErrorCode.FATAL), anyString(), isNull()))
                .thenReturn(Optional.of(failed));

        pool.run(job);

        assertThat(lastEvent(job).errorCode()).isEqualTo("FATAL");
        assertThat(lastEvent(job).message()).doesNotContain("JSON");
    }

    @Test
    void run_attemptTakenOverByAnotherWorker_publishesNothing() {
        Job job = TestJobs.active(2, "wf-123", GovernanceMode.LIVE, NOW);
        StageOutcome outcome = StageOutcome.completed(List.of(), Map.of(), List.of());
        when(orchestrator.execute(job)).thenReturn(outcome);
        when(jobService.completeJob(job.getId(), 1, "worker-test", outcome)).thenReturn(Optional.empty());

        pool.run(job);

        assertThat(broadcaster.read(job.getId(), 0)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Scheduling
    // ------------------------------------------------------------------

    @Test
    void tick_runsClaimedJobsUntilQueueIsEmpty() {
        Job job = TestJobs.active(2, "wf-123", GovernanceMode.DEMO, NOW);
        StageOutcome outcome = StageOutcome.completed(List.of(), Map.of(), List.of());
        when(jobService.claimNextJob(anyString())).thenReturn(Optional.of(job), Optional.empty());
        when(orchestrator.execute(job)).thenReturn(outcome);
        when(jobService.completeJob(job.getId(), 1, "worker-test", outcome)).thenReturn(Optional.of(job));

        pool.tick();
        pool.shutdown();

        verify(jobService, times(2)).claimNextJob(anyString());
        verify(jobService).completeJob(job.getId(), 1, "worker-test", outcome);
    }

    @Test
    void tick_afterShutdown_claimsNothing() {
        pool.shutdown();

        pool.tick();

        verify(jobService, never()).claimNextJob(anyString());
    }

    @Test
    void recoverStalled_announcesRetries() {
        Job job = TestJobs.active(2, "wf-123", GovernanceMode.LIVE, NOW);
        job.scheduleRetry(NOW, NOW.plusSeconds(5), ErrorCode.TRANSIENT_ERROR, "Worker stopped responding during attempt 1");
        when(jobService.recoverStalledJobs()).thenReturn(List.of(job));

        pool.recoverStalled();

        assertThat(lastEvent(job).event()).isEqualTo(ProgressEvent.RETRYING);
        verify(jobService, never()).settleFailure(any(), anyInt(), any(), any(), any(), any());
    }
}
