package com.researchflow.orchestrator.support;

import com.researchflow.orchestrator.model.GovernanceMode;
import com.researchflow.orchestrator.model.Job;

import java.time.Instant;
import java.util.UUID;

/** Builders for Job rows as the database would hand them back. */
public final class TestJobs {

    private TestJobs() {}

    public static Job queued(int stageId, String workflowId, GovernanceMode mode, Instant now) {
        Job job = new Job(stageId, workflowId, mode, workflowId + ":" + stageId, "{}", now);
        return withId(job);
    }

    /** A job claimed by a worker, on its first attempt. */
    public static Job active(int stageId, String workflowId, GovernanceMode mode, Instant now) {
        Job job = queued(stageId, workflowId, mode, now);
        job.claim("worker-test", now);
        return job;
    }

    public static Job withId(Job job) {
        return withId(job, UUID.randomUUID());
    }

    /** Give {@code job} the id of a row loaded earlier, as a later read of that row. */
    public static Job withId(Job job, UUID id) {
        try {
            var f = Job.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(job, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return job;
    }
}
