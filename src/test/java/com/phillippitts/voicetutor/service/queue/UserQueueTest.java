package com.phillippitts.voicetutor.service.queue;

import com.phillippitts.voicetutor.exception.TurnCancelledException;
import com.phillippitts.voicetutor.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class UserQueueTest {

    private QueueListener listener;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        listener = mock(QueueListener.class);
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void deliversResultAndCountsProcessedItem() {
        UserQueue queue = new UserQueue("s1", new SyncExecutor(), listener);

        CompletableFuture<String> future = queue.enqueue(() -> "answer", true);

        assertThat(future.join()).isEqualTo("answer");
        QueueMetrics metrics = queue.getMetrics();
        assertThat(metrics.processed()).isEqualTo(1);
        assertThat(metrics.currentDepth()).isZero();
        assertThat(queue.isProcessing()).isFalse();
        verify(listener).onEnqueued("s1", 1);
        verify(listener).onProcessed(eq("s1"), anyString(), anyLong());
    }

    @Test
    void propagatesOperationFailureAndCountsError() {
        UserQueue queue = new UserQueue("s1", new SyncExecutor(), listener);
        IllegalStateException failure = new IllegalStateException("backend down");

        CompletableFuture<String> future = queue.enqueue(() -> {
            throw failure;
        }, true);

        assertThatThrownBy(future::join).hasCause(failure);
        assertThat(queue.getMetrics().errors()).isEqualTo(1);
        assertThat(queue.getMetrics().processed()).isZero();
        verify(listener).onError(eq("s1"), anyString(), eq(failure));
    }

    @Test
    void runsOneOperationAtATimeInSubmissionOrder() {
        UserQueue queue = new UserQueue("s1", pool, listener);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Integer> order = new CopyOnWriteArrayList<>();
        List<CompletableFuture<Integer>> futures = new ArrayList<>();

        for (int i = 0; i < 5; i++) {
            int n = i;
            futures.add(queue.enqueue(() -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                sleepQuietly(20);
                order.add(n);
                running.decrementAndGet();
                return n;
            }, false));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        assertThat(maxRunning.get()).isEqualTo(1);
        assertThat(order).containsExactly(0, 1, 2, 3, 4);
        assertThat(queue.getMetrics().processed()).isEqualTo(5);
        assertThat(queue.getMetrics().avgProcessingTimeMs()).isGreaterThanOrEqualTo(15.0);
    }

    @Test
    void bargeInCancelsPendingItemsButNotTheExecutingOne() throws Exception {
        UserQueue queue = new UserQueue("s1", pool, listener);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<String> executing = queue.enqueue(() -> {
            started.countDown();
            awaitQuietly(release);
            return "first";
        }, true);
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<String> pending1 = queue.enqueue(() -> "second", false);
        CompletableFuture<String> pending2 = queue.enqueue(() -> "third", false);
        assertThat(queue.getQueueDepth()).isEqualTo(2);

        CompletableFuture<String> latest = queue.enqueue(() -> "latest", true);

        assertThat(pending1).isCompletedExceptionally();
        assertThat(pending2).isCompletedExceptionally();
        assertThatThrownBy(pending1::join)
                .hasCauseInstanceOf(TurnCancelledException.class)
                .hasMessageContaining("Operation cancelled due to barge-in");
        assertThat(executing).isNotDone();

        release.countDown();

        assertThat(executing.get(2, TimeUnit.SECONDS)).isEqualTo("first");
        assertThat(latest.get(2, TimeUnit.SECONDS)).isEqualTo("latest");
        assertThat(queue.getMetrics().cancelled()).isEqualTo(2);
        assertThat(queue.getMetrics().processed()).isEqualTo(2);
        verify(listener).onCancelled("s1", 2);
    }

    @Test
    void bargeInOnIdleQueueCancelsNothing() {
        UserQueue queue = new UserQueue("s1", new SyncExecutor(), listener);

        queue.enqueue(() -> "one", true).join();
        queue.enqueue(() -> "two", true).join();

        assertThat(queue.getMetrics().cancelled()).isZero();
        verify(listener, never()).onCancelled(anyString(), anyInt());
    }

    @Test
    void cancelPendingOperationsReportsCount() throws Exception {
        UserQueue queue = new UserQueue("s1", pool, listener);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> executing = queue.enqueue(() -> {
            started.countDown();
            awaitQuietly(release);
            return "running";
        }, false);
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        queue.enqueue(() -> "pending", false);

        int cancelled = queue.cancelPendingOperations();

        assertThat(cancelled).isEqualTo(1);
        assertThat(queue.getQueueDepth()).isZero();
        assertThat(queue.isProcessing()).isTrue();
        release.countDown();
        assertThat(executing.get(2, TimeUnit.SECONDS)).isEqualTo("running");
        await().atMost(Duration.ofSeconds(2)).until(() -> !queue.isProcessing());
    }

    @Test
    void clearEmptiesQueue() throws Exception {
        UserQueue queue = new UserQueue("s1", pool, listener);
        CountDownLatch release = new CountDownLatch(1);
        queue.enqueue(() -> {
            awaitQuietly(release);
            return "running";
        }, false);
        CompletableFuture<String> pending = queue.enqueue(() -> "pending", false);

        queue.clear();

        assertThat(pending).isCompletedExceptionally();
        assertThat(queue.getQueueDepth()).isZero();
        release.countDown();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
