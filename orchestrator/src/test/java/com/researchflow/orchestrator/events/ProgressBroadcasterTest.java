package com.researchflow.orchestrator.events;

import com.researchflow.orchestrator.model.ErrorCode;
import com.researchflow.orchestrator.model.StepStatus;
import com.researchflow.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ProgressBroadcasterTest {

    private MutableClock        clock;
    private ProgressBroadcaster broadcaster;
    private UUID                jobId;

    @BeforeEach
    void setUp() {
        clock       = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
        broadcaster = new ProgressBroadcaster(5, Duration.ofMinutes(5), clock);
        jobId       = UUID.randomUUID();
    }

    private void publishSteps(String... names) {
        for (String name : names) {
            broadcaster.publish(jobId, ProgressEvent.step(name, StepStatus.RUNNING, 0, clock.instant()));
        }
    }

    @Test
    void sequencesStartAtOneAndIncrease() {
        publishSteps("lit_retrieval", "lit_triage");

        assertThat(broadcaster.read(jobId, 0)).extracting(ProgressEvent::sequence).containsExactly(1L, 2L);
        assertThat(broadcaster.read(jobId, 2)).extracting(ProgressEvent::step).containsExactly("lit_triage");
    }

    @Test
    void lateSubscriber_receivesFullHistoryThenLiveEvents() {
        publishSteps("lit_retrieval", "lit_triage");
        List<ProgressEvent> received = new ArrayList<>();

        broadcaster.subscribe(jobId, 0, received::add);
        publishSteps("screen");
        broadcaster.publish(jobId, ProgressEvent.complete(clock.instant()));

        assertThat(received).extracting(ProgressEvent::sequence).containsExactly(1L, 2L, 3L, 4L);
        assertThat(received.get(3).event()).isEqualTo(ProgressEvent.COMPLETE);
    }

    @Test
    void subscriberBeforeFirstEvent_seesEverything() {
        List<ProgressEvent> received = new CopyOnWriteArrayList<>();

        broadcaster.subscribe(jobId, 0, received::add);
        publishSteps("lit_retrieval");

        assertThat(received).hasSize(1);
    }

    @Test
    void resumeFromPosition_skipsWhatWasSeen() {
        publishSteps("a", "b", "c");
        List<ProgressEvent> received = new ArrayList<>();

        broadcaster.subscribe(jobId, 3, received::add);

        assertThat(received).extracting(ProgressEvent::step).containsExactly("c");
    }

    @Test
    void boundedLog_evictsOldestAndStartsAtOldestRetained() {
        publishSteps("s1", "s2", "s3", "s4", "s5", "s6", "s7");
        List<ProgressEvent> received = new ArrayList<>();

        broadcaster.subscribe(jobId, 1, received::add);

        assertThat(received).extracting(ProgressEvent::sequence).containsExactly(3L, 4L, 5L, 6L, 7L);
    }

    @Test
    void nothingIsAppendedAfterTheTerminalEvent() {
        broadcaster.publish(jobId, ProgressEvent.error(ErrorCode.AGENT_ERROR, "Step 'screen' failed", clock.instant()));

        assertThat(broadcaster.publish(jobId, ProgressEvent.complete(clock.instant()))).isEmpty();
        assertThat(broadcaster.read(jobId, 0)).hasSize(1);
    }

    @Test
    void closedSubscription_stopsDelivery() {
        List<ProgressEvent> received = new ArrayList<>();
        EventSubscription subscription = broadcaster.subscribe(jobId, 0, received::add);
        publishSteps("a");

        subscription.close();
        publishSteps("b");

        assertThat(received).hasSize(1);
    }

    @Test
    void failingSubscriber_isDetachedWithoutHurtingTheWriter() {
        List<ProgressEvent> healthy = new ArrayList<>();
        int[] attempts = {0};
        broadcaster.subscribe(jobId, 0, e -> {
            attempts[0]++;
            throw new IllegalStateException("connection reset");
        });
        broadcaster.subscribe(jobId, 0, healthy::add);

        publishSteps("a", "b");

        assertThat(attempts[0]).isEqualTo(1);
        assertThat(healthy).hasSize(2);
    }

    @Test
    void finishedLogs_areReclaimedAfterRetention() {
        UUID running = UUID.randomUUID();
        broadcaster.publish(running, ProgressEvent.step("a", StepStatus.RUNNING, 0, clock.instant()));
        broadcaster.publish(jobId, ProgressEvent.complete(clock.instant()));

        clock.advance(Duration.ofMinutes(4));
        broadcaster.reclaimExpired();
        assertThat(broadcaster.hasLog(jobId)).isTrue();

        clock.advance(Duration.ofMinutes(2));
        broadcaster.reclaimExpired();
        assertThat(broadcaster.hasLog(jobId)).isFalse();
        assertThat(broadcaster.hasLog(running)).isTrue();
    }

    @Test
    void closedSubscriptionWithoutTerminalEvent_isReclaimedOnceIdle() {
        EventSubscription subscription = broadcaster.subscribe(jobId, 0, e -> { });
        subscription.close();

        clock.advance(Duration.ofMinutes(29));
        broadcaster.reclaimExpired();
        assertThat(broadcaster.hasLog(jobId)).isTrue();

        clock.advance(Duration.ofDays(7));
        broadcaster.reclaimExpired();
        assertThat(broadcaster.hasLog(jobId)).isFalse();
    }

    @Test
    void logWithLiveSubscriber_isKeptWhileIdle() {
        broadcaster.subscribe(jobId, 0, e -> { });

        clock.advance(Duration.ofDays(7));
        broadcaster.reclaimExpired();

        assertThat(broadcaster.hasLog(jobId)).isTrue();
        assertThat(broadcaster.openStreams()).containsExactly(jobId);
    }

    @Test
    void publishAfterIdleReclaim_startsAFreshLog() {
        publishSteps("a", "b");
        clock.advance(Duration.ofHours(1));
        broadcaster.reclaimExpired();
        assertThat(broadcaster.hasLog(jobId)).isFalse();

        publishSteps("c");

        assertThat(broadcaster.read(jobId, 0)).extracting(ProgressEvent::sequence).containsExactly(1L);
    }

    @Test
    void openStreams_listsOnlyWatchedJobsWithoutTerminalEvent() {
        UUID finished = UUID.randomUUID();
        UUID unwatched = UUID.randomUUID();
        broadcaster.subscribe(jobId, 0, e -> { });
        broadcaster.subscribe(finished, 0, e -> { });
        broadcaster.publish(finished, ProgressEvent.complete(clock.instant()));
        broadcaster.publish(unwatched, ProgressEvent.step("a", StepStatus.RUNNING, 0, clock.instant()));

        assertThat(broadcaster.openStreams()).containsExactly(jobId);
    }

    // ------------------------------------------------------------------
    // Delivery on a separate executor
    // ------------------------------------------------------------------

    @Test
    void slowSubscriber_doesNotHoldUpThePublisher() throws Exception {
        ExecutorService delivery = Executors.newCachedThreadPool();
        try {
            ProgressBroadcaster async = new ProgressBroadcaster(100, Duration.ofMinutes(5), Duration.ofMinutes(30),
                    clock, delivery);
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(1);
            List<ProgressEvent> slow = new CopyOnWriteArrayList<>();
            async.subscribe(jobId, 0, e -> {
                try {
                    release.await(5, TimeUnit.SECONDS);     // a client that cannot keep up
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                slow.add(e);
                if (e.isTerminal()) done.countDown();
            });

            long started = System.nanoTime();
            for (int i = 0; i < 3; i++) {
                async.publish(jobId, ProgressEvent.step("s" + i, StepStatus.RUNNING, i * 30, clock.instant()));
            }
            async.publish(jobId, ProgressEvent.complete(clock.instant()));
            Duration publishing = Duration.ofNanos(System.nanoTime() - started);

            assertThat(publishing).isLessThan(Duration.ofMillis(500));
            release.countDown();
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(slow).extracting(ProgressEvent::sequence).containsExactly(1L, 2L, 3L, 4L);
        } finally {
            delivery.shutdownNow();
        }
    }

    @Test
    void asyncDelivery_replaysThenTailsEachEventOnceInOrder() throws Exception {
        ExecutorService delivery = Executors.newFixedThreadPool(4);
        ExecutorService writer = Executors.newSingleThreadExecutor();
        try {
            ProgressBroadcaster async = new ProgressBroadcaster(1000, Duration.ofMinutes(5), Duration.ofMinutes(30),
                    clock, delivery);
            for (int i = 0; i < 20; i++) {
                async.publish(jobId, ProgressEvent.step("early" + i, StepStatus.RUNNING, 0, clock.instant()));
            }
            writer.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    async.publish(jobId, ProgressEvent.step("late" + i, StepStatus.RUNNING, 50, clock.instant()));
                }
                async.publish(jobId, ProgressEvent.complete(clock.instant()));
            });

            CountDownLatch done = new CountDownLatch(1);
            List<ProgressEvent> received = new CopyOnWriteArrayList<>();
            async.subscribe(jobId, 0, e -> {
                received.add(e);
                if (e.isTerminal()) done.countDown();
            });

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(received).hasSize(221);
            for (int i = 0; i < received.size(); i++) {
                assertThat(received.get(i).sequence()).isEqualTo(i + 1L);
            }
        } finally {
            writer.shutdownNow();
            delivery.shutdownNow();
        }
    }

    @Test
    void subscriberTooFarBehind_isDetachedAndTheWriterCarriesOn() throws Exception {
        ExecutorService delivery = Executors.newSingleThreadExecutor();
        try {
            ProgressBroadcaster async = new ProgressBroadcaster(5, Duration.ofMinutes(5), Duration.ofMinutes(30),
                    clock, delivery);
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            List<ProgressEvent> received = new CopyOnWriteArrayList<>();
            async.subscribe(jobId, 0, e -> {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                received.add(e);
            });
            async.publish(jobId, ProgressEvent.step("s0", StepStatus.RUNNING, 0, clock.instant()));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            // Up to twice the log size may wait; the twelfth pending event detaches the subscriber.
            assertThatCode(() -> {
                for (int i = 1; i <= 15; i++) {
                    async.publish(jobId, ProgressEvent.step("s" + i, StepStatus.RUNNING, 0, clock.instant()));
                }
            }).doesNotThrowAnyException();
            release.countDown();
            delivery.shutdown();
            assertThat(delivery.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

            assertThat(received).extracting(ProgressEvent::sequence).containsExactly(1L);
            assertThat(async.read(jobId, 0)).extracting(ProgressEvent::sequence).containsExactly(12L, 13L, 14L, 15L, 16L);
            assertThat(async.openStreams()).isEmpty();
        } finally {
            delivery.shutdownNow();
        }
    }
}
