package com.researchflow.orchestrator.events;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Append-only, bounded event log for one job.
 *
 * Sequences start at 1 and increase by one per append. When the log is full
 * the oldest event is evicted; readers asking for an evicted position start
 * at the oldest one still held.
 *
 * The log's lock covers appending and handing events to subscriber queues,
 * never a listener call. A subscriber's replay is queued in the same
 * critical section that registers it, so it sees each event exactly once
 * and in sequence order.
 *
 * Once retired by the sweeper the log accepts nothing; {@link #append} and
 * {@link #subscribe} return null and the caller starts a fresh log.
 */
class JobEventLog {

    private final UUID     jobId;
    private final int      capacity;
    private final Clock    clock;
    private final Executor delivery;

    private final Deque<ProgressEvent>  events      = new ArrayDeque<>();
    private final List<EventSubscriber> subscribers = new ArrayList<>();

    private long    nextSequence = 1;
    private Instant terminalAt;
    private Instant lastActivityAt;
    private boolean retired;

    JobEventLog(UUID jobId, int capacity, Clock clock, Executor delivery) {
        this.jobId          = jobId;
        this.capacity       = capacity;
        this.clock          = clock;
        this.delivery       = delivery;
        this.lastActivityAt = clock.instant();
    }

    /**
     * @return the sequenced event; empty when the log already holds a terminal
     *         event (nothing follows it); null when the log has been retired
     */
    Optional<ProgressEvent> append(ProgressEvent event) {
        ProgressEvent sequenced;
        List<EventSubscriber> targets;
        synchronized (this) {
            if (retired) {
                return null;
            }
            if (terminalAt != null) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            sequenced = event.withSequence(nextSequence++);
            events.addLast(sequenced);
            if (events.size() > capacity) {
                events.removeFirst();
            }
            lastActivityAt = now;
            if (sequenced.isTerminal()) {
                terminalAt = now;
            }
            for (Iterator<EventSubscriber> it = subscribers.iterator(); it.hasNext(); ) {
                if (!it.next().offer(sequenced)) {
                    it.remove();
                }
            }
            targets = List.copyOf(subscribers);
            if (sequenced.isTerminal()) {
                subscribers.clear();
            }
        }
        targets.forEach(EventSubscriber::flush);
        return Optional.of(sequenced);
    }

    synchronized List<ProgressEvent> readFrom(long from) {
        List<ProgressEvent> result = new ArrayList<>();
        for (ProgressEvent e : events) {
            if (e.sequence() >= from) {
                result.add(e);
            }
        }
        return result;
    }

    /**
     * Replay from {@code from}, then keep delivering until the terminal event
     * or close. Null when the log has been retired.
     */
    EventSubscription subscribe(long from, Consumer<ProgressEvent> listener) {
        EventSubscriber subscriber;
        synchronized (this) {
            if (retired) {
                return null;
            }
            // Room for a full replay plus a full log of live events.
            subscriber = new EventSubscriber(jobId, listener, delivery, capacity * 2, this::unsubscribe);
            readFrom(from).forEach(subscriber::offer);
            lastActivityAt = clock.instant();
            if (terminalAt == null) {
                subscribers.add(subscriber);
            }
        }
        subscriber.flush();
        return subscriber;
    }

    private synchronized void unsubscribe(EventSubscriber subscriber) {
        if (subscribers.remove(subscriber)) {
            lastActivityAt = clock.instant();
        }
    }

    /**
     * Retire the log when its terminal event is older than {@code finishedCutoff},
     * or when it never got one, nobody is subscribed and nothing happened
     * since {@code idleCutoff}.
     */
    synchronized boolean retireIfExpired(Instant finishedCutoff, Instant idleCutoff) {
        subscribers.removeIf(EventSubscriber::isClosed);
        boolean expired = terminalAt != null
                ? terminalAt.isBefore(finishedCutoff)
                : subscribers.isEmpty() && lastActivityAt.isBefore(idleCutoff);
        if (expired) {
            retired = true;
        }
        return expired;
    }

    /** Open with at least one subscriber and no terminal event yet. */
    synchronized boolean isWatchedAndOpen() {
        return terminalAt == null && subscribers.stream().anyMatch(s -> !s.isClosed());
    }
}
