package com.researchflow.orchestrator.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * One stream subscriber: a bounded queue of events waiting for delivery and
 * at most one drain running on the delivery executor.
 *
 * The log enqueues under its own lock, in sequence order, and never calls
 * the listener itself. A listener that throws, or that falls more than
 * {@code maxPending} events behind, is detached; a client can resume from
 * its last event id.
 */
final class EventSubscriber implements EventSubscription {

    private static final Logger log = LoggerFactory.getLogger(EventSubscriber.class);

    private final UUID                      jobId;
    private final Consumer<ProgressEvent>   listener;
    private final Executor                  executor;
    private final int                       maxPending;
    private final Consumer<EventSubscriber> onDetach;

    private final Queue<ProgressEvent> pending  = new ConcurrentLinkedQueue<>();
    private final AtomicInteger        queued   = new AtomicInteger();
    private final AtomicBoolean        draining = new AtomicBoolean();
    private volatile boolean           closed;

    EventSubscriber(UUID jobId, Consumer<ProgressEvent> listener, Executor executor,
                    int maxPending, Consumer<EventSubscriber> onDetach) {
        this.jobId      = jobId;
        this.listener   = listener;
        this.executor   = executor;
        this.maxPending = maxPending;
        this.onDetach   = onDetach;
    }

    /** Queue an event; never blocks. Returns false once the subscriber is gone. */
    boolean offer(ProgressEvent event) {
        if (closed) {
            return false;
        }
        if (queued.incrementAndGet() > maxPending) {
            log.debug("Detaching subscriber of job {}: {} events behind", jobId, maxPending);
            closed = true;
            return false;
        }
        pending.add(event);
        return true;
    }

    /** Start a drain unless one is already running. Call without holding the log's lock. */
    void flush() {
        if (closed || pending.isEmpty() || !draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.debug("Delivery executor rejected events for job {}; detaching subscriber", jobId);
            close();
        }
    }

    private void drain() {
        do {
            ProgressEvent event;
            while (!closed && (event = pending.poll()) != null) {
                queued.decrementAndGet();
                deliver(event);
            }
            draining.set(false);
        } while (!closed && !pending.isEmpty() && draining.compareAndSet(false, true));
        if (closed) {
            pending.clear();
        }
    }

    private void deliver(ProgressEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.debug("Detaching subscriber of job {}: {}", jobId, e.getClass().getSimpleName());
            close();
            return;
        }
        if (event.isTerminal()) {
            closed = true;
        }
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        onDetach.accept(this);
    }
}
