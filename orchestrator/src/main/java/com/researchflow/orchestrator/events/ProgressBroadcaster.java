package com.researchflow.orchestrator.events;

import com.researchflow.orchestrator.config.ResearchFlowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Per-job progress logs with replay + tail subscribers.
 *
 * Writers append after the matching state change is committed, so a reader
 * that sees an event and then polls the status API finds that state or a
 * later one. Appending only queues the event for each subscriber; listeners
 * run on the delivery executor, so a slow stream never holds up a worker.
 *
 * Logs live in this process only. A job's log is created by its first event
 * (or first subscriber) and reclaimed by {@link #reclaimExpired()} once the
 * terminal event is older than the retention period, or once a log that
 * never saw a terminal event has had no subscriber and no activity for the
 * idle retention period.
 */
@Component
public class ProgressBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);

    private final Map<UUID, JobEventLog> logs = new ConcurrentHashMap<>();

    private final int      capacity;
    private final Duration retention;
    private final Duration idleRetention;
    private final Clock    clock;
    private final Executor delivery;

    @Autowired
    public ProgressBroadcaster(ResearchFlowProperties properties,
                               Clock clock,
                               @Qualifier("eventDeliveryExecutor") Executor delivery) {
        this(properties.getEvents().getMaxEventsPerJob(), properties.getEvents().getRetention(),
                properties.getEvents().getIdleRetention(), clock, delivery);
    }

    /** Delivers on the publishing thread, after the log's lock is released. */
    public ProgressBroadcaster(int capacity, Duration retention, Clock clock) {
        this(capacity, retention, Duration.ofMinutes(30), clock, Runnable::run);
    }

    public ProgressBroadcaster(int capacity, Duration retention, Duration idleRetention,
                               Clock clock, Executor delivery) {
        this.capacity      = capacity;
        this.retention     = retention;
        this.idleRetention = idleRetention;
        this.clock         = clock;
        this.delivery      = delivery;
    }

    // ------------------------------------------------------------------
    // Writers
    // ------------------------------------------------------------------

    /**
     * Append an event to the job's log and queue it for live subscribers.
     *
     * @return the event with its sequence number, or empty when the log is
     *         already closed by a terminal event
     */
    public Optional<ProgressEvent> publish(UUID jobId, ProgressEvent event) {
        Optional<ProgressEvent> appended = withLog(jobId, jobLog -> jobLog.append(event));
        if (appended.isEmpty()) {
            log.debug("Dropped '{}' event for job {}: log already closed", event.event(), jobId);
        }
        return appended;
    }

    // ------------------------------------------------------------------
    // Readers
    // ------------------------------------------------------------------

    /**
     * Replay events from sequence {@code from} (inclusive), then stream new
     * ones until the terminal event or until the subscription is closed.
     * A listener that throws, or falls too far behind, is detached.
     */
    public EventSubscription subscribe(UUID jobId, long from, Consumer<ProgressEvent> listener) {
        return withLog(jobId, jobLog -> jobLog.subscribe(from, listener));
    }

    /** Snapshot of the retained events from {@code from} onward; empty for an unknown job. */
    public List<ProgressEvent> read(UUID jobId, long from) {
        JobEventLog jobLog = logs.get(jobId);
        return jobLog == null ? List.of() : jobLog.readFrom(from);
    }

    public boolean hasLog(UUID jobId) {
        return logs.containsKey(jobId);
    }

    /** Jobs somebody is streaming whose log has not seen a terminal event. */
    public Set<UUID> openStreams() {
        Set<UUID> result = new TreeSet<>();
        logs.forEach((id, jobLog) -> {
            if (jobLog.isWatchedAndOpen()) {
                result.add(id);
            }
        });
        return result;
    }

    // ------------------------------------------------------------------
    // Reclamation
    // ------------------------------------------------------------------

    @Scheduled(fixedDelayString = "${researchflow.events.sweep-interval-ms:30000}")
    public void reclaimExpired() {
        Instant now = clock.instant();
        Instant finishedCutoff = now.minus(retention);
        Instant idleCutoff     = now.minus(idleRetention);
        int removed = 0;
        for (Map.Entry<UUID, JobEventLog> e : logs.entrySet()) {
            // Conditional remove: a writer may already have swapped in a fresh log.
            if (e.getValue().retireIfExpired(finishedCutoff, idleCutoff) && logs.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Reclaimed {} event logs", removed);
        }
    }

    // A retired log answers null; drop it and retry on a fresh one.
    private <T> T withLog(UUID jobId, Function<JobEventLog, T> action) {
        while (true) {
            JobEventLog jobLog = logs.computeIfAbsent(jobId, id -> new JobEventLog(id, capacity, clock, delivery));
            T result = action.apply(jobLog);
            if (result != null) {
                return result;
            }
            logs.remove(jobId, jobLog);
        }
    }
}
