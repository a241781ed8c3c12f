package com.phillippitts.voicetutor.service.queue;

import com.phillippitts.voicetutor.service.queue.event.BargeInEvent;
import com.phillippitts.voicetutor.testutil.EventCapturingPublisher;
import com.phillippitts.voicetutor.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class UserQueueManagerTest {

    private EventCapturingPublisher publisher;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        publisher = new EventCapturingPublisher();
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void returnsSameQueuePerSession() {
        UserQueueManager manager = new UserQueueManager(new SyncExecutor(), publisher);

        UserQueue first = manager.getQueue("s1");
        UserQueue again = manager.getQueue("s1");
        UserQueue other = manager.getQueue("s2");

        assertThat(again).isSameAs(first);
        assertThat(other).isNotSameAs(first);
        assertThat(manager.activeSessions()).isEqualTo(2);
        assertThat(manager.getGlobalMetrics().totalSessions()).isEqualTo(2);
    }

    @Test
    void aggregatesOperationsAndErrors() {
        SyncExecutor executor = new SyncExecutor();
        UserQueueManager manager = new UserQueueManager(executor, publisher);
        UserQueue queue = manager.getQueue("s1");

        queue.enqueue(() -> "ok", true).join();
        queue.enqueue(() -> {
            throw new IllegalStateException("boom");
        }, true).exceptionally(e -> null).join();

        GlobalQueueMetrics metrics = manager.getGlobalMetrics();
        assertThat(metrics.totalOperations()).isEqualTo(2);
        assertThat(metrics.totalErrors()).isEqualTo(1);
        assertThat(metrics.totalQueueDepth()).isZero();
        assertThat(executor.dispatchedCount()).isEqualTo(2);
    }

    @Test
    void cancelInFlightForSessionCancelsBacklogAndPublishesEvent() throws Exception {
        UserQueueManager manager = new UserQueueManager(pool, publisher);
        UserQueue queue = manager.getQueue("s1");
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        queue.enqueue(() -> {
            started.countDown();
            awaitQuietly(release);
            return "running";
        }, false);
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<String> pending1 = queue.enqueue(() -> "a", false);
        queue.enqueue(() -> "b", false);

        assertThat(manager.getQueueDepth("s1")).isEqualTo(2);
        GlobalQueueMetrics during = manager.getGlobalMetrics();
        assertThat(during.maxQueueDepth()).isEqualTo(2);
        assertThat(during.avgQueueDepth()).isEqualTo(2.0);

        int cancelled = manager.cancelInFlightForSession("s1");

        assertThat(cancelled).isEqualTo(2);
        assertThat(pending1).isCompletedExceptionally();
        assertThat(manager.getGlobalMetrics().totalCancellations()).isEqualTo(2);
        BargeInEvent event = publisher.lastEventOf(BargeInEvent.class);
        assertThat(event.sessionId()).isEqualTo("s1");
        assertThat(event.cancelledCount()).isEqualTo(2);
        release.countDown();
    }

    @Test
    void unknownSessionsAreHarmless() {
        UserQueueManager manager = new UserQueueManager(new SyncExecutor(), publisher);

        assertThat(manager.cancelInFlightForSession("missing")).isZero();
        assertThat(manager.getQueueDepth("missing")).isZero();
        manager.removeQueue("missing");

        assertThat(manager.activeSessions()).isZero();
    }

    @Test
    void removeQueueAndCleanupDropQueues() {
        UserQueueManager manager = new UserQueueManager(new SyncExecutor(), publisher);
        manager.getQueue("s1");
        manager.getQueue("s2");
        manager.getQueue("s3");

        manager.removeQueue("s1");
        assertThat(manager.activeSessions()).isEqualTo(2);

        manager.cleanup();
        assertThat(manager.activeSessions()).isZero();
        assertThat(manager.getGlobalMetrics().avgQueueDepth()).isZero();
        assertThat(manager.getGlobalMetrics().totalSessions()).isEqualTo(3);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
