package com.researchflow.orchestrator.api;

import com.researchflow.orchestrator.api.dto.CancelResponse;
import com.researchflow.orchestrator.api.dto.ExecuteStageRequest;
import com.researchflow.orchestrator.api.dto.JobAcceptedResponse;
import com.researchflow.orchestrator.api.dto.JobStatusResponse;
import com.researchflow.orchestrator.events.EventSubscription;
import com.researchflow.orchestrator.events.ProgressBroadcaster;
import com.researchflow.orchestrator.events.ProgressEvent;
import com.researchflow.orchestrator.model.Job;
import com.researchflow.orchestrator.model.JobStatus;
import com.researchflow.orchestrator.service.JobService;
import com.researchflow.orchestrator.service.SubmissionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * REST API for stage jobs.
 *
 * POST /stages/{stage}/execute                     validate and enqueue a stage run
 * GET  /stages/{stage}/jobs/{id}/status            persisted job and step state
 * GET  /stages/{stage}/jobs/{id}/events            progress events as SSE (replay + tail)
 * GET  /stages/{stage}/jobs/{id}/events/log        retained progress events as JSON
 * POST /stages/{stage}/jobs/{id}/cancel            cooperative cancellation
 *
 * A job addressed under a stage it does not belong to is reported as 404.
 */
@RestController
@RequestMapping("/stages")
public class StageController {

    private static final Logger log = LoggerFactory.getLogger(StageController.class);

    private final JobService          jobService;
    private final ProgressBroadcaster broadcaster;
    private final Duration            sseTimeout;

    public StageController(JobService jobService,
                           ProgressBroadcaster broadcaster,
                           @Value("${researchflow.events.sse-timeout:30m}") Duration sseTimeout) {
        this.jobService  = jobService;
        this.broadcaster = broadcaster;
        this.sseTimeout  = sseTimeout;
    }

    /**
     * Submit a stage run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/stages/2/execute \
     *     -H "Content-Type: application/json" \
     *     -d '{"workflow_id":"wf-123","mode":"DEMO","research_question":"Does drug X reduce readmissions?"}'
     *
     * 202 with the new job, or with the existing one when the idempotency key matches
     * a job that has not failed. 400 VALIDATION_ERROR lists every violated rule.
     */
    @PostMapping("/{stage}/execute")
    public ResponseEntity<JobAcceptedResponse> execute(
            @PathVariable int stage,
            @RequestBody ExecuteStageRequest req,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {
        SubmissionResult result = jobService.submit(stage, req.getWorkflowId(), req.getMode(),
                req.getFields(), idempotencyKey);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobAcceptedResponse.from(result));
    }

    @GetMapping("/{stage}/jobs/{jobId}/status")
    public JobStatusResponse status(@PathVariable int stage, @PathVariable UUID jobId) {
        return jobService.snapshot(stage, jobId)
                .map(JobStatusResponse::from)
                .orElseThrow(() -> notFound(jobId));
    }

    /**
     * Stream progress events.
     *
     * Starts at {@code ?from=} when given, otherwise right after
     * {@code Last-Event-ID}, otherwise at the beginning of the retained log.
     * The stream ends after the terminal event.
     */
    @GetMapping(path = "/{stage}/jobs/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable int stage,
                             @PathVariable UUID jobId,
                             @RequestParam(value = "from", required = false) Long from,
                             @RequestHeader(value = "Last-Event-ID", required = false) String lastEventId) {
        Job job = requireJob(stage, jobId);
        SseEmitter emitter = new SseEmitter(sseTimeout.toMillis());

        // The log may already be reclaimed; the terminal state is still on the row.
        if (job.getStatus().isTerminal() && !broadcaster.hasLog(jobId)) {
            send(emitter, ProgressEvent.finished(job));
            emitter.complete();
            return emitter;
        }

        EventSubscription subscription = broadcaster.subscribe(jobId, startPosition(from, lastEventId), event -> {
            send(emitter, event);
            if (event.isTerminal()) {
                emitter.complete();
            }
        });
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());
        if (job.getStatus().isTerminal()) {
            // The log may have been reclaimed and recreated empty since the check above.
            broadcaster.publish(jobId, ProgressEvent.finished(job));
        }
        return emitter;
    }

    @GetMapping("/{stage}/jobs/{jobId}/events/log")
    public List<ProgressEvent> eventLog(@PathVariable int stage,
                                        @PathVariable UUID jobId,
                                        @RequestParam(value = "from", defaultValue = "0") long from) {
        Job job = requireJob(stage, jobId);
        if (job.getStatus().isTerminal() && !broadcaster.hasLog(jobId)) {
            return List.of(ProgressEvent.finished(job));
        }
        return broadcaster.read(jobId, from);
    }

    /**
     * Request cancellation. 202 once recorded; 404 unknown job; 409 already finished.
     * A job that was only waiting fails immediately and its stream receives the error event.
     */
    @PostMapping("/{stage}/jobs/{jobId}/cancel")
    public ResponseEntity<CancelResponse> cancel(@PathVariable int stage, @PathVariable UUID jobId) {
        Job job = jobService.requestCancel(stage, jobId).orElseThrow(() -> notFound(jobId));
        if (job.getStatus() == JobStatus.FAILED) {
            broadcaster.publish(jobId, ProgressEvent.finished(job));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(CancelResponse.from(job));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Job requireJob(int stage, UUID jobId) {
        return jobService.findById(jobId)
                .filter(job -> job.getStageId() == stage)
                .orElseThrow(() -> notFound(jobId));
    }

    private static ResponseStatusException notFound(UUID jobId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + jobId);
    }

    static long startPosition(Long from, String lastEventId) {
        if (from != null) {
            return from;
        }
        if (lastEventId != null) {
            try {
                return Long.parseLong(lastEventId.trim()) + 1;
            } catch (NumberFormatException e) {
                log.debug("Ignoring malformed Last-Event-ID '{}'", lastEventId);
            }
        }
        return 0;
    }

    private static void send(SseEmitter emitter, ProgressEvent event) {
        SseEmitter.SseEventBuilder builder = SseEmitter.event().name(event.event()).data(event);
        if (event.sequence() > 0) {
            builder.id(String.valueOf(event.sequence()));
        }
        try {
            emitter.send(builder);
        } catch (IOException e) {
            // Client went away; the broadcaster detaches this subscriber.
            throw new UncheckedIOException(e);
        }
    }
}
