package com.github.salilvnair.convflow.engine.queue;

import com.github.salilvnair.convflow.config.ConvFlowQueueConfig;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowException;
import com.github.salilvnair.convflow.engine.navigation.NavigationResult;
import com.github.salilvnair.convflow.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.salilvnair.convflow.support.TestConstants.BOOM;
import static com.github.salilvnair.convflow.support.TestConstants.NODE_ASK_NAME;
import static com.github.salilvnair.convflow.support.TestConstants.NODE_WELCOME;
import static com.github.salilvnair.convflow.support.TestConstants.SESSION_ID;
import static com.github.salilvnair.convflow.support.TestConstants.TENANT_ACME;
import static com.github.salilvnair.convflow.support.TestConstants.USER_JUAN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeProcessingQueueTest {

    private MutableClock clock;
    private ConvFlowQueueConfig config;
    private List<String> processed;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-15T10:00:00Z");
        config = new ConvFlowQueueConfig();
        config.setRetryDelay(Duration.ofSeconds(1));
        config.setProcessingTimeout(Duration.ZERO);
        processed = new CopyOnWriteArrayList<>();
    }

    @Test
    void dispatchRunsHigherPriorityFirstAndFifoWithinPriority() {
        NodeProcessingQueue queue = directQueue(succeeding());
        queue.enqueue(request("low"), EnqueueOptions.builder().priority(QueuePriority.LOW).build());
        queue.enqueue(request("normal-1"), EnqueueOptions.defaults());
        queue.enqueue(request("immediate"), EnqueueOptions.builder().priority(QueuePriority.IMMEDIATE).build());
        queue.enqueue(request("normal-2"), EnqueueOptions.defaults());
        queue.enqueue(request("critical"), EnqueueOptions.builder().priority(QueuePriority.CRITICAL).build());

        assertEquals(5, queue.dispatchOnce());

        assertEquals(List.of("immediate", "critical", "normal-1", "normal-2", "low"), processed);
    }

    @Test
    void dispatchAdmitsAtMostMaxConcurrency() {
        config.setMaxConcurrency(2);
        List<Runnable> parked = new ArrayList<>();
        NodeProcessingQueue queue = new NodeProcessingQueue(succeeding(), config, clock, parked::add);
        queue.enqueue(request("a"));
        queue.enqueue(request("b"));
        queue.enqueue(request("c"));

        assertEquals(2, queue.dispatchOnce());
        assertEquals(0, queue.dispatchOnce());
        assertEquals(2, queue.metrics().processing());
        assertEquals(1, queue.metrics().pending());

        parked.get(0).run();

        assertEquals(1, queue.dispatchOnce());
    }

    @Test
    void dependentRequestWaitsUntilDependencyCompletes() {
        NodeProcessingQueue queue = directQueue(succeeding());
        String first = queue.enqueue(request("first"));
        String second = queue.enqueue(request("second"), EnqueueOptions.builder().dependencies(List.of(first)).build());

        assertEquals(QueueRequestStatus.WAITING, queue.getStatus(second).orElseThrow().getStatus());
        queue.dispatchOnce();

        assertEquals(QueueRequestStatus.COMPLETED, queue.getStatus(first).orElseThrow().getStatus());
        assertEquals(QueueRequestStatus.PENDING, queue.getStatus(second).orElseThrow().getStatus());

        queue.dispatchOnce();

        assertEquals(QueueRequestStatus.COMPLETED, queue.getStatus(second).orElseThrow().getStatus());
        assertEquals(List.of("first", "second"), processed);
    }

    @Test
    void failedAttemptsBackOffExponentiallyThenFail() {
        NodeProcessingQueue queue = directQueue(request -> {
            processed.add(request.getRequestId());
            return NavigationResult.failure(ConversationFlowErrorCode.NODE_NOT_FOUND, null, null);
        });
        String id = queue.enqueue(request("flaky"));
        Instant start = clock.instant();

        queue.dispatchOnce();
        assertEquals(start.plusMillis(1000), queue.getStatus(id).orElseThrow().getScheduledAt());
        assertEquals(0, queue.dispatchOnce());

        clock.advance(Duration.ofMillis(1000));
        queue.dispatchOnce();
        assertEquals(start.plusMillis(1000 + 2000), queue.getStatus(id).orElseThrow().getScheduledAt());

        clock.advance(Duration.ofMillis(2000));
        queue.dispatchOnce();
        assertEquals(start.plusMillis(1000 + 2000 + 4000), queue.getStatus(id).orElseThrow().getScheduledAt());

        clock.advance(Duration.ofMillis(4000));
        queue.dispatchOnce();

        QueuedNavigationRequest finished = queue.getStatus(id).orElseThrow();
        assertEquals(QueueRequestStatus.FAILED, finished.getStatus());
        assertEquals(4, finished.getAttempts());
        assertEquals(ConversationFlowErrorCode.NODE_NOT_FOUND, finished.getErrorCode());
        assertEquals(4, processed.size());
        assertEquals(3, queue.metrics().totalRetries());
    }

    @Test
    void slowProcessorTimesOutReleasesSlotAndIsRetried() throws Exception {
        config.setProcessingTimeout(Duration.ofMillis(200));
        config.setMaxConcurrency(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService workers = Executors.newSingleThreadExecutor();
        try {
            NodeProcessingQueue queue = new NodeProcessingQueue(request -> {
                processed.add(request.getRequestId());
                try {
                    release.await(5, TimeUnit.SECONDS);
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return NavigationResult.builder().success(true).nextNodeId(request.getTargetNodeId()).build();
            }, config, clock, workers);
            String id = queue.enqueue(request("slow"));
            Instant start = clock.instant();

            assertEquals(1, queue.dispatchOnce());
            QueuedNavigationRequest timedOut = awaitRetryScheduled(queue, id);

            assertEquals(ConversationFlowErrorCode.REQUEST_TIMEOUT, timedOut.getErrorCode());
            assertEquals(1, timedOut.getAttempts());
            assertEquals(start.plusMillis(1000), timedOut.getScheduledAt());
            assertEquals(0, queue.metrics().processing());
            assertEquals(1, queue.metrics().totalRetries());

            release.countDown();
            clock.advance(Duration.ofMillis(1000));
            assertEquals(1, queue.dispatchOnce());
            QueuedNavigationRequest done = queue.completion(id).get(5, TimeUnit.SECONDS);

            assertEquals(QueueRequestStatus.COMPLETED, done.getStatus());
            assertEquals(2, done.getAttempts());
            assertEquals(List.of("slow", "slow"), processed);
        }
        finally {
            release.countDown();
            workers.shutdownNow();
        }
    }

    @Test
    void processorExceptionIsRecordedAsFailure() {
        NodeProcessingQueue queue = directQueue(request -> {
            throw new ConversationFlowException(ConversationFlowErrorCode.ACTION_FAILED, BOOM);
        });
        String id = queue.enqueue(request("explodes"), EnqueueOptions.builder().maxRetries(0).build());

        queue.dispatchOnce();

        QueuedNavigationRequest finished = queue.getStatus(id).orElseThrow();
        assertEquals(QueueRequestStatus.FAILED, finished.getStatus());
        assertEquals(ConversationFlowErrorCode.ACTION_FAILED, finished.getErrorCode());
        assertEquals(BOOM, finished.getLastError());
    }

    @Test
    void failureCascadesToDependentsAndTriggersRollback() {
        AtomicInteger rollbacks = new AtomicInteger();
        NavigationRequestProcessor processor = new NavigationRequestProcessor() {
            @Override
            public NavigationResult process(QueuedNavigationRequest request) {
                return NavigationResult.failure(ConversationFlowErrorCode.INTERNAL_ERROR, BOOM, null);
            }

            @Override
            public void rollback(QueuedNavigationRequest request) {
                rollbacks.incrementAndGet();
            }
        };
        NodeProcessingQueue queue = directQueue(processor);
        String parent = queue.enqueue(request("parent"),
                EnqueueOptions.builder().maxRetries(0).rollbackOnFailure(true).build());
        String child = queue.enqueue(request("child"), EnqueueOptions.builder().dependencies(List.of(parent)).build());
        String grandChild = queue.enqueue(request("grand-child"), EnqueueOptions.builder().dependencies(List.of(child)).build());

        queue.dispatchOnce();

        assertEquals(QueueRequestStatus.FAILED, queue.getStatus(parent).orElseThrow().getStatus());
        assertEquals(ConversationFlowErrorCode.DEPENDENCY_UNRESOLVED, queue.getStatus(child).orElseThrow().getErrorCode());
        assertEquals(ConversationFlowErrorCode.DEPENDENCY_UNRESOLVED, queue.getStatus(grandChild).orElseThrow().getErrorCode());
        assertEquals(1, rollbacks.get());
        assertEquals(0, queue.outstanding());
    }

    @Test
    void cancelRemovesPendingRequestOnly() {
        NodeProcessingQueue queue = directQueue(succeeding());
        String done = queue.enqueue(request("done"));
        queue.dispatchOnce();
        String waiting = queue.enqueue(request("waiting"));

        assertTrue(queue.cancel(waiting));
        assertFalse(queue.cancel(done));
        assertFalse(queue.cancel("unknown"));

        QueuedNavigationRequest cancelled = queue.getStatus(waiting).orElseThrow();
        assertEquals(QueueRequestStatus.CANCELLED, cancelled.getStatus());
        assertEquals(ConversationFlowErrorCode.REQUEST_CANCELLED, cancelled.getErrorCode());
        assertEquals(0, queue.dispatchOnce());
    }

    @Test
    void enqueueRejectsWhenQueueIsFull() {
        config.setMaxQueueSize(2);
        NodeProcessingQueue queue = directQueue(succeeding());
        queue.enqueue(request("a"));
        queue.enqueue(request("b"));

        ConversationFlowException error = assertThrows(ConversationFlowException.class, () -> queue.enqueue(request("c")));

        assertEquals(ConversationFlowErrorCode.QUEUE_FULL, error.getCode());
        assertTrue(error.isRecoverable());
    }

    @Test
    void batchIsAdmittedAtomically() {
        config.setMaxQueueSize(2);
        NodeProcessingQueue queue = directQueue(succeeding());
        queue.enqueue(request("a"));

        assertThrows(ConversationFlowException.class,
                () -> queue.enqueueBatch(List.of(request("b"), request("c")), BatchOptions.defaults()));
        assertEquals(1, queue.outstanding());
    }

    @Test
    void orderedBatchRunsInListOrderOneTickAtATime() {
        NodeProcessingQueue queue = directQueue(succeeding());
        List<String> ids = queue.enqueueBatch(
                List.of(request("step-1"), request("step-2"), request("step-3")),
                BatchOptions.builder().preserveOrder(true).priority(QueuePriority.HIGH).build());

        queue.dispatchOnce();
        queue.dispatchOnce();
        queue.dispatchOnce();

        assertEquals(List.of("step-1", "step-2", "step-3"), processed);
        String batchId = queue.getStatus(ids.get(0)).orElseThrow().getBatchId();
        assertEquals(batchId, queue.getStatus(ids.get(2)).orElseThrow().getBatchId());
        assertEquals(List.of(ids.get(1)), queue.getStatus(ids.get(2)).orElseThrow().getDependencies());
    }

    @Test
    void scheduledRequestWaitsForItsTime() {
        NodeProcessingQueue queue = directQueue(succeeding());
        queue.enqueue(request("later"), EnqueueOptions.builder().scheduledAt(clock.instant().plusSeconds(30)).build());

        assertEquals(0, queue.dispatchOnce());
        clock.advance(Duration.ofSeconds(30));

        assertEquals(1, queue.dispatchOnce());
    }

    @Test
    void pausedQueueDoesNotDispatch() {
        NodeProcessingQueue queue = directQueue(succeeding());
        queue.enqueue(request("held"));
        queue.pause();

        assertEquals(0, queue.dispatchOnce());
        assertTrue(queue.metrics().paused());

        queue.resume();
        assertEquals(1, queue.dispatchOnce());
    }

    @Test
    void completionFutureAndListenersReceiveFinalSnapshot() throws Exception {
        NodeProcessingQueue queue = directQueue(succeeding());
        List<String> completed = new ArrayList<>();
        queue.addListener(new QueueCompletionListener() {
            @Override
            public void onCompleted(QueuedNavigationRequest request) {
                completed.add(request.getRequestId());
            }

            @Override
            public void onFailed(QueuedNavigationRequest request) {
                throw new IllegalStateException(BOOM);
            }
        });
        String id = queue.enqueue(request("observed"));
        CompletableFuture<QueuedNavigationRequest> completion = queue.completion(id);

        queue.dispatchOnce();

        QueuedNavigationRequest finished = completion.get(1, TimeUnit.SECONDS);
        assertEquals(QueueRequestStatus.COMPLETED, finished.getStatus());
        assertTrue(finished.getResult().isSuccess());
        assertEquals(List.of(id), completed);
    }

    @Test
    void cleanupDropsFinishedRequestsAfterRetention() {
        NodeProcessingQueue queue = directQueue(succeeding());
        String id = queue.enqueue(request("old"));
        queue.dispatchOnce();

        clock.advance(config.getCleanupCompletedAfter().plusSeconds(1));

        assertEquals(1, queue.cleanup());
        assertTrue(queue.getStatus(id).isEmpty());
    }

    @Test
    void metricsReportErrorRateAndHealth() {
        AtomicInteger calls = new AtomicInteger();
        NodeProcessingQueue queue = directQueue(request -> calls.incrementAndGet() % 2 == 0
                ? NavigationResult.builder().success(true).build()
                : NavigationResult.failure(ConversationFlowErrorCode.INTERNAL_ERROR, BOOM, null));
        queue.enqueue(request("fails"), EnqueueOptions.builder().maxRetries(0).build());
        queue.enqueue(request("succeeds"), EnqueueOptions.builder().maxRetries(0).build());

        queue.dispatchOnce();

        QueueMetrics metrics = queue.metrics();
        assertEquals(1, metrics.totalCompleted());
        assertEquals(1, metrics.totalFailed());
        assertEquals(0.5, metrics.errorRate());
        assertEquals(QueueHealth.CRITICAL, metrics.health());
    }

    private QueuedNavigationRequest awaitRetryScheduled(NodeProcessingQueue queue, String requestId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            QueuedNavigationRequest current = queue.getStatus(requestId).orElseThrow();
            if (current.getStatus() == QueueRequestStatus.PENDING && current.getErrorCode() != null) {
                return current;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("Request " + requestId + " was not rescheduled after timing out");
    }

    private NodeProcessingQueue directQueue(NavigationRequestProcessor processor) {
        return new NodeProcessingQueue(processor, config, clock, Runnable::run);
    }

    private NavigationRequestProcessor succeeding() {
        return request -> {
            processed.add(request.getRequestId());
            return NavigationResult.builder().success(true).nextNodeId(request.getTargetNodeId()).build();
        };
    }

    private QueuedNavigationRequest request(String requestId) {
        return QueuedNavigationRequest.builder()
                .requestId(requestId)
                .sessionId(SESSION_ID)
                .userId(USER_JUAN)
                .tenantId(TENANT_ACME)
                .fromNodeId(NODE_WELCOME)
                .targetNodeId(NODE_ASK_NAME)
                .build();
    }
}
