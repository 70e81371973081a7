package com.researchflow.orchestrator.service;

import com.researchflow.orchestrator.events.ProgressBroadcaster;
import com.researchflow.orchestrator.events.ProgressEvent;
import com.researchflow.orchestrator.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Closes event streams for jobs that finished somewhere else.
 *
 * A job may run in another process sharing the queue, and then no terminal
 * event reaches this process's log. Every few seconds the jobs being
 * streamed here are looked up; a finished row gets its terminal event
 * appended, which ends the streams and starts the log's retention clock.
 */
@Component
public class EventStreamReconciler {

    private static final Logger log = LoggerFactory.getLogger(EventStreamReconciler.class);

    private final JobService          jobService;
    private final ProgressBroadcaster broadcaster;

    public EventStreamReconciler(JobService jobService, ProgressBroadcaster broadcaster) {
        this.jobService  = jobService;
        this.broadcaster = broadcaster;
    }

    @Scheduled(fixedDelayString = "${researchflow.events.reconcile-interval-ms:5000}")
    public void reconcile() {
        Set<UUID> open = broadcaster.openStreams();
        if (open.isEmpty()) {
            return;
        }
        List<Job> finished;
        try {
            finished = jobService.findFinished(open);
        } catch (DataAccessException e) {
            log.warn("Could not check {} streamed job(s): {}", open.size(), e.getMessage());
            return;
        }
        for (Job job : finished) {
            broadcaster.publish(job.getId(), ProgressEvent.finished(job))
                    .ifPresent(e -> log.info("Job {} finished elsewhere as {}; closed its event streams",
                            job.getId(), job.getStatus()));
        }
    }
}
