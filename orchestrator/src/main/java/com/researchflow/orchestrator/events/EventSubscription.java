package com.researchflow.orchestrator.events;

/**
 * Handle returned by {@link ProgressBroadcaster#subscribe}; closing it stops delivery.
 */
public interface EventSubscription extends AutoCloseable {

    @Override
    void close();
}
