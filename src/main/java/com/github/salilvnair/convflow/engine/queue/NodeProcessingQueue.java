package com.github.salilvnair.convflow.engine.queue;

import com.github.salilvnair.convflow.config.ConvFlowQueueConfig;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowException;
import com.github.salilvnair.convflow.engine.navigation.NavigationResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority and dependency aware work queue for navigation requests.
 * <p>
 * Every request id lives in exactly one of four buckets: pending (including requests waiting on
 * dependencies or a retry delay), processing, completed and failed (including cancelled). A
 * dispatcher tick admits eligible pending requests, highest priority first and FIFO within a
 * priority, while fewer than {@code maxConcurrency} are processing.
 */
@Slf4j
@Component
public class NodeProcessingQueue {

    private static final Comparator<QueuedNavigationRequest> DISPATCH_ORDER =
            Comparator.comparingInt((QueuedNavigationRequest request) -> request.getPriority().weight()).reversed()
                    .thenComparingLong(QueuedNavigationRequest::getSequence);

    private final NavigationRequestProcessor processor;
    private final ConvFlowQueueConfig config;
    private final Clock clock;
    private final List<QueueCompletionListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, QueuedNavigationRequest> pending = new LinkedHashMap<>();
    private final Map<String, QueuedNavigationRequest> processing = new LinkedHashMap<>();
    private final Map<String, QueuedNavigationRequest> completed = new LinkedHashMap<>();
    private final Map<String, QueuedNavigationRequest> failed = new LinkedHashMap<>();
    private final Map<String, CompletableFuture<QueuedNavigationRequest>> completions = new ConcurrentHashMap<>();

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong totalEnqueued = new AtomicLong();
    private final AtomicLong totalCompleted = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final AtomicLong totalRetries = new AtomicLong();
    private volatile boolean paused;

    private volatile Executor workerExecutor;
    private ThreadPoolExecutor ownedWorkers;
    private ScheduledExecutorService dispatcher;

    @Autowired
    public NodeProcessingQueue(NavigationRequestProcessor processor,
                               ConvFlowQueueConfig config,
                               Clock clock,
                               ObjectProvider<QueueCompletionListener> listenerProvider) {
        this.processor = processor;
        this.config = config;
        this.clock = clock;
        if (listenerProvider != null) {
            listenerProvider.orderedStream().forEach(listeners::add);
        }
    }

    /**
     * Runs work on {@code workerExecutor} and never starts a dispatcher thread; ticks are driven
     * through {@link #dispatchOnce()}.
     */
    public NodeProcessingQueue(NavigationRequestProcessor processor,
                               ConvFlowQueueConfig config,
                               Clock clock,
                               Executor workerExecutor) {
        this.processor = processor;
        this.config = config;
        this.clock = clock;
        this.workerExecutor = workerExecutor;
    }

    @PostConstruct
    void init() {
        if (workerExecutor == null) {
            int workers = Math.max(1, config.getMaxConcurrency());
            AtomicInteger threadIndex = new AtomicInteger();
            ownedWorkers = new ThreadPoolExecutor(
                    workers,
                    workers,
                    60L,
                    TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(),
                    runnable -> {
                        Thread thread = new Thread(runnable, "convflow-queue-worker-" + threadIndex.incrementAndGet());
                        thread.setDaemon(true);
                        return thread;
                    });
            workerExecutor = ownedWorkers;
        }
        if (config.isAutoStart()) {
            start();
        }
    }

    public void start() {
        lock.lock();
        try {
            if (dispatcher != null) {
                return;
            }
            dispatcher = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "convflow-queue-dispatcher");
                thread.setDaemon(true);
                return thread;
            });
        }
        finally {
            lock.unlock();
        }
        long interval = Math.max(1L, config.getDispatchInterval().toMillis());
        dispatcher.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Node processing queue started maxConcurrency={} maxQueueSize={} dispatchIntervalMs={}",
                config.getMaxConcurrency(), config.getMaxQueueSize(), interval);
    }

    @PreDestroy
    public void shutdown() {
        ScheduledExecutorService scheduled = dispatcher;
        dispatcher = null;
        if (scheduled != null) {
            scheduled.shutdownNow();
        }
        if (ownedWorkers != null) {
            ownedWorkers.shutdown();
        }
    }

    public void addListener(QueueCompletionListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public String enqueue(QueuedNavigationRequest request) {
        return enqueue(request, EnqueueOptions.defaults());
    }

    /**
     * Admits a request into the pending bucket.
     *
     * @throws ConversationFlowException with {@code QUEUE_FULL} when pending plus processing
     *                                   already reaches {@code maxQueueSize}
     */
    public String enqueue(QueuedNavigationRequest request, EnqueueOptions options) {
        lock.lock();
        try {
            ensureCapacity(1);
            return admit(request, options == null ? EnqueueOptions.defaults() : options);
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Admits all requests or none. With {@code preserveOrder} every request depends on the one
     * before it.
     */
    public List<String> enqueueBatch(List<QueuedNavigationRequest> requests, BatchOptions options) {
        BatchOptions opts = options == null ? BatchOptions.defaults() : options;
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        String batchId = opts.batchId() != null ? opts.batchId() : UUID.randomUUID().toString();
        List<String> ids = new ArrayList<>();
        lock.lock();
        try {
            ensureCapacity(requests.size());
            String previous = null;
            for (QueuedNavigationRequest request : requests) {
                List<String> dependencies = new ArrayList<>(request.getDependencies() == null ? List.of() : request.getDependencies());
                if (opts.preserveOrder() && previous != null) {
                    dependencies.add(previous);
                }
                EnqueueOptions enqueueOptions = EnqueueOptions.builder()
                        .priority(opts.priority())
                        .dependencies(dependencies)
                        .batchId(batchId)
                        .rollbackOnFailure(opts.rollbackOnFailure())
                        .build();
                previous = admit(request, enqueueOptions);
                ids.add(previous);
            }
        }
        finally {
            lock.unlock();
        }
        log.debug("Enqueued batch batchId={} size={} preserveOrder={}", batchId, ids.size(), opts.preserveOrder());
        return ids;
    }

    /**
     * Removes a not-yet-started request. Processing or finished requests are not cancellable.
     */
    public boolean cancel(String requestId) {
        List<QueuedNavigationRequest> cancelled = new ArrayList<>();
        lock.lock();
        try {
            QueuedNavigationRequest request = pending.remove(requestId);
            if (request == null) {
                return false;
            }
            Instant now = clock.instant();
            request.setStatus(QueueRequestStatus.CANCELLED);
            request.setErrorCode(ConversationFlowErrorCode.REQUEST_CANCELLED);
            request.setLastError(ConversationFlowErrorCode.REQUEST_CANCELLED.defaultMessage());
            request.setCompletedAt(now);
            failed.put(requestId, request);
            cancelled.add(request);
            cancelled.addAll(failDependents(requestId, now));
        }
        finally {
            lock.unlock();
        }
        log.info("Cancelled queued request requestId={} cascaded={}", requestId, cancelled.size() - 1);
        cancelled.forEach(this::notifyFailed);
        return true;
    }

    public Optional<QueuedNavigationRequest> getStatus(String requestId) {
        lock.lock();
        try {
            return Optional.ofNullable(find(requestId)).map(QueuedNavigationRequest::snapshot);
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Completes with the final snapshot once the request reaches a terminal status.
     */
    public CompletableFuture<QueuedNavigationRequest> completion(String requestId) {
        lock.lock();
        try {
            QueuedNavigationRequest request = find(requestId);
            if (request != null && request.getStatus().isTerminal()) {
                return CompletableFuture.completedFuture(request.snapshot());
            }
            CompletableFuture<QueuedNavigationRequest> future = completions.get(requestId);
            if (future == null) {
                return CompletableFuture.failedFuture(new ConversationFlowException(
                        ConversationFlowErrorCode.INTERNAL_ERROR, "Unknown request " + requestId));
            }
            return future;
        }
        finally {
            lock.unlock();
        }
    }

    public void pause() {
        paused = true;
        log.info("Node processing queue paused");
    }

    public void resume() {
        paused = false;
        log.info("Node processing queue resumed");
    }

    public boolean isPaused() {
        return paused;
    }

    void tick() {
        try {
            dispatchOnce();
            cleanup();
        }
        catch (RuntimeException e) {
            log.error("Queue dispatch tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One dispatcher pass. Fails requests whose dependencies failed, then admits eligible
     * requests up to the free concurrency.
     *
     * @return number of requests handed to workers
     */
    public int dispatchOnce() {
        if (paused) {
            return 0;
        }
        List<QueuedNavigationRequest> admitted = new ArrayList<>();
        List<QueuedNavigationRequest> cascaded = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            List<QueuedNavigationRequest> eligible = new ArrayList<>();
            for (QueuedNavigationRequest request : new ArrayList<>(pending.values())) {
                DependencyState dependencyState = dependencyState(request);
                if (dependencyState == DependencyState.FAILED) {
                    pending.remove(request.getRequestId());
                    markDependencyFailure(request, now);
                    cascaded.add(request);
                    continue;
                }
                if (dependencyState == DependencyState.UNRESOLVED) {
                    request.setStatus(QueueRequestStatus.WAITING);
                    continue;
                }
                request.setStatus(QueueRequestStatus.PENDING);
                if (request.getScheduledAt() == null || !request.getScheduledAt().isAfter(now)) {
                    eligible.add(request);
                }
            }
            eligible.sort(DISPATCH_ORDER);
            int free = Math.max(0, config.getMaxConcurrency() - processing.size());
            for (QueuedNavigationRequest request : eligible) {
                if (admitted.size() >= free) {
                    break;
                }
                pending.remove(request.getRequestId());
                request.setStatus(QueueRequestStatus.PROCESSING);
                request.setStartedAt(now);
                request.setAttempts(request.getAttempts() + 1);
                processing.put(request.getRequestId(), request);
                admitted.add(request);
            }
        }
        finally {
            lock.unlock();
        }
        cascaded.forEach(this::notifyFailed);
        admitted.forEach(this::submit);
        return admitted.size();
    }

    /**
     * Drops completed and failed requests older than their retention window.
     *
     * @return number of requests removed
     */
    public int cleanup() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int removed = purge(completed, now.minus(config.getCleanupCompletedAfter()));
            removed += purge(failed, now.minus(config.getCleanupFailedAfter()));
            if (removed > 0) {
                log.debug("Queue cleanup removed={} requests", removed);
            }
            return removed;
        }
        finally {
            lock.unlock();
        }
    }

    public QueueMetrics metrics() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int waiting = (int) pending.values().stream()
                    .filter(request -> request.getStatus() == QueueRequestStatus.WAITING)
                    .count();
            double averageProcessing = completed.values().stream()
                    .mapToLong(request -> request.processingTime().toMillis())
                    .average()
                    .orElse(0);
            double averageWait = completed.values().stream()
                    .mapToLong(request -> request.waitTime(now).toMillis())
                    .average()
                    .orElse(0);
            long longestWait = pending.values().stream()
                    .mapToLong(request -> request.waitTime(now).toMillis())
                    .max()
                    .orElse(0);
            Instant minuteAgo = now.minus(Duration.ofMinutes(1));
            long lastMinute = completed.values().stream()
                    .filter(request -> request.getCompletedAt() != null && request.getCompletedAt().isAfter(minuteAgo))
                    .count();
            long finished = totalCompleted.get() + totalFailed.get();
            double errorRate = finished == 0 ? 0 : (double) totalFailed.get() / finished;
            return QueueMetrics.builder()
                    .pending(pending.size() - waiting)
                    .waiting(waiting)
                    .processing(processing.size())
                    .completed(completed.size())
                    .failed(failed.size())
                    .totalEnqueued(totalEnqueued.get())
                    .totalCompleted(totalCompleted.get())
                    .totalFailed(totalFailed.get())
                    .totalRetries(totalRetries.get())
                    .averageProcessingMs(averageProcessing)
                    .averageWaitMs(averageWait)
                    .longestWaitMs(longestWait)
                    .throughputPerMinute(lastMinute)
                    .errorRate(errorRate)
                    .paused(paused)
                    .health(health(errorRate, longestWait))
                    .build();
        }
        finally {
            lock.unlock();
        }
    }

    /** Pending plus processing. */
    public int outstanding() {
        lock.lock();
        try {
            return pending.size() + processing.size();
        }
        finally {
            lock.unlock();
        }
    }

    private void submit(QueuedNavigationRequest request) {
        CompletableFuture<NavigationResult> work;
        try {
            work = CompletableFuture.supplyAsync(() -> processor.process(request), workerExecutor);
        }
        catch (RuntimeException e) {
            log.error("Queue worker rejected requestId={}: {}", request.getRequestId(), e.getMessage(), e);
            onFinished(request, null, e);
            return;
        }
        long timeoutMs = config.getProcessingTimeout().toMillis();
        if (timeoutMs > 0) {
            work = work.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        }
        work.whenComplete((result, error) -> onFinished(request, result, error));
    }

    private void onFinished(QueuedNavigationRequest request, NavigationResult result, Throwable error) {
        boolean success = error == null && result != null && result.isSuccess();
        QueuedNavigationRequest terminal = null;
        List<QueuedNavigationRequest> cascaded = List.of();
        boolean rollback = false;
        lock.lock();
        try {
            if (processing.remove(request.getRequestId()) == null) {
                return;
            }
            Instant now = clock.instant();
            request.setResult(result);
            if (success) {
                request.setStatus(QueueRequestStatus.COMPLETED);
                request.setCompletedAt(now);
                request.setErrorCode(null);
                request.setLastError(null);
                completed.put(request.getRequestId(), request);
                totalCompleted.incrementAndGet();
                promoteWaiters();
                terminal = request;
            }
            else {
                recordError(request, result, error);
                if (request.getAttempts() <= request.getMaxRetries()) {
                    long delay = config.getRetryDelay().toMillis() * (1L << Math.min(30, request.getAttempts() - 1));
                    request.setStatus(QueueRequestStatus.PENDING);
                    request.setScheduledAt(now.plusMillis(delay));
                    pending.put(request.getRequestId(), request);
                    totalRetries.incrementAndGet();
                    log.warn("Queued request failed, retrying requestId={} attempt={} delayMs={} errorCode={}",
                            request.getRequestId(), request.getAttempts(), delay, request.getErrorCode());
                }
                else {
                    request.setStatus(QueueRequestStatus.FAILED);
                    request.setCompletedAt(now);
                    failed.put(request.getRequestId(), request);
                    totalFailed.incrementAndGet();
                    cascaded = failDependents(request.getRequestId(), now);
                    rollback = request.isRollbackOnFailure();
                    terminal = request;
                    log.error("Queued request failed permanently requestId={} attempts={} errorCode={} error={}",
                            request.getRequestId(), request.getAttempts(), request.getErrorCode(), request.getLastError());
                }
            }
        }
        finally {
            lock.unlock();
        }
        if (rollback) {
            rollback(request);
        }
        if (terminal != null) {
            if (success) {
                notifyCompleted(terminal);
            }
            else {
                notifyFailed(terminal);
            }
        }
        cascaded.forEach(this::notifyFailed);
    }

    private void recordError(QueuedNavigationRequest request, NavigationResult result, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            request.setErrorCode(ConversationFlowErrorCode.REQUEST_TIMEOUT);
            request.setLastError("Processing exceeded " + config.getProcessingTimeout().toMillis() + "ms");
        }
        else if (cause instanceof ConversationFlowException flowException) {
            request.setErrorCode(flowException.getCode());
            request.setLastError(flowException.getMessage());
        }
        else if (cause != null) {
            request.setErrorCode(ConversationFlowErrorCode.INTERNAL_ERROR);
            request.setLastError(String.valueOf(cause.getMessage()));
        }
        else if (result != null) {
            request.setErrorCode(result.getErrorCode() == null ? ConversationFlowErrorCode.INTERNAL_ERROR : result.getErrorCode());
            request.setLastError(result.getError());
        }
        else {
            request.setErrorCode(ConversationFlowErrorCode.INTERNAL_ERROR);
            request.setLastError("Processor returned no result");
        }
    }

    private void rollback(QueuedNavigationRequest request) {
        try {
            processor.rollback(request.snapshot());
        }
        catch (RuntimeException e) {
            log.error("Rollback after failed request failed requestId={} sessionId={}: {}",
                    request.getRequestId(), request.getSessionId(), e.getMessage(), e);
        }
    }

    private String admit(QueuedNavigationRequest request, EnqueueOptions options) {
        Instant now = clock.instant();
        if (request.getRequestId() == null || request.getRequestId().isBlank()) {
            request.setRequestId(UUID.randomUUID().toString());
        }
        if (find(request.getRequestId()) != null) {
            throw new ConversationFlowException(ConversationFlowErrorCode.INTERNAL_ERROR,
                    "Request " + request.getRequestId() + " is already queued");
        }
        if (options.priority() != null) {
            request.setPriority(options.priority());
        }
        else if (request.getPriority() == null) {
            request.setPriority(QueuePriority.NORMAL);
        }
        List<String> dependencies = new ArrayList<>(request.getDependencies() == null ? List.of() : request.getDependencies());
        if (options.dependencies() != null) {
            options.dependencies().stream().filter(id -> !dependencies.contains(id)).forEach(dependencies::add);
        }
        request.setDependencies(dependencies);
        request.setMaxRetries(options.maxRetries() != null ? options.maxRetries() : config.getMaxRetries());
        request.setRollbackOnFailure(request.isRollbackOnFailure() || options.rollbackOnFailure());
        if (options.batchId() != null) {
            request.setBatchId(options.batchId());
        }
        request.setCreatedAt(now);
        request.setScheduledAt(options.scheduledAt() != null ? options.scheduledAt() : now);
        request.setSequence(sequence.incrementAndGet());
        request.setAttempts(0);
        request.setStatus(dependencies.isEmpty() ? QueueRequestStatus.PENDING : QueueRequestStatus.WAITING);
        pending.put(request.getRequestId(), request);
        completions.put(request.getRequestId(), new CompletableFuture<>());
        totalEnqueued.incrementAndGet();
        log.debug("Enqueued requestId={} sessionId={} target={} priority={} dependencies={}",
                request.getRequestId(), request.getSessionId(), request.getTargetNodeId(),
                request.getPriority(), dependencies);
        return request.getRequestId();
    }

    private void ensureCapacity(int incoming) {
        int outstanding = pending.size() + processing.size();
        if (outstanding + incoming > config.getMaxQueueSize()) {
            throw new ConversationFlowException(ConversationFlowErrorCode.QUEUE_FULL,
                    "Queue is full (" + outstanding + "/" + config.getMaxQueueSize() + ")")
                    .withMetaData(Map.of("outstanding", outstanding, "incoming", incoming));
        }
    }

    private DependencyState dependencyState(QueuedNavigationRequest request) {
        DependencyState state = DependencyState.RESOLVED;
        for (String dependency : request.getDependencies()) {
            if (failed.containsKey(dependency)) {
                return DependencyState.FAILED;
            }
            QueuedNavigationRequest done = completed.get(dependency);
            if (done == null || done.getStatus() != QueueRequestStatus.COMPLETED) {
                state = DependencyState.UNRESOLVED;
            }
        }
        return state;
    }

    private void promoteWaiters() {
        for (QueuedNavigationRequest request : pending.values()) {
            if (request.getStatus() == QueueRequestStatus.WAITING && dependencyState(request) == DependencyState.RESOLVED) {
                request.setStatus(QueueRequestStatus.PENDING);
            }
        }
    }

    // caller holds the lock
    private List<QueuedNavigationRequest> failDependents(String failedId, Instant now) {
        List<QueuedNavigationRequest> cascaded = new ArrayList<>();
        List<String> frontier = new ArrayList<>(List.of(failedId));
        while (!frontier.isEmpty()) {
            String current = frontier.remove(0);
            for (QueuedNavigationRequest request : new ArrayList<>(pending.values())) {
                if (request.getDependencies().contains(current)) {
                    pending.remove(request.getRequestId());
                    markDependencyFailure(request, now);
                    cascaded.add(request);
                    frontier.add(request.getRequestId());
                }
            }
        }
        return cascaded;
    }

    private void markDependencyFailure(QueuedNavigationRequest request, Instant now) {
        request.setStatus(QueueRequestStatus.FAILED);
        request.setErrorCode(ConversationFlowErrorCode.DEPENDENCY_UNRESOLVED);
        request.setLastError("A dependency of request " + request.getRequestId() + " failed");
        request.setCompletedAt(now);
        failed.put(request.getRequestId(), request);
        totalFailed.incrementAndGet();
    }

    private int purge(Map<String, QueuedNavigationRequest> bucket, Instant cutoff) {
        List<String> expired = bucket.values().stream()
                .filter(request -> request.getCompletedAt() != null && request.getCompletedAt().isBefore(cutoff))
                .map(QueuedNavigationRequest::getRequestId)
                .toList();
        expired.forEach(id -> {
            bucket.remove(id);
            completions.remove(id);
        });
        return expired.size();
    }

    private QueuedNavigationRequest find(String requestId) {
        for (Map<String, QueuedNavigationRequest> bucket : buckets()) {
            QueuedNavigationRequest request = bucket.get(requestId);
            if (request != null) {
                return request;
            }
        }
        return null;
    }

    private Collection<Map<String, QueuedNavigationRequest>> buckets() {
        return List.of(pending, processing, completed, failed);
    }

    private QueueHealth health(double errorRate, long longestWaitMs) {
        ConvFlowQueueConfig.Health thresholds = config.getHealth();
        if (errorRate >= thresholds.getCriticalErrorRate() || longestWaitMs >= thresholds.getCriticalWait().toMillis()) {
            return QueueHealth.CRITICAL;
        }
        if (errorRate >= thresholds.getWarningErrorRate() || longestWaitMs >= thresholds.getWarningWait().toMillis()) {
            return QueueHealth.WARNING;
        }
        return QueueHealth.HEALTHY;
    }

    private void notifyCompleted(QueuedNavigationRequest request) {
        QueuedNavigationRequest snapshot = snapshotOf(request);
        completeFuture(snapshot);
        for (QueueCompletionListener listener : listeners) {
            try {
                listener.onCompleted(snapshot);
            }
            catch (RuntimeException e) {
                log.warn("Queue listener failed requestId={} listener={}: {}",
                        request.getRequestId(), listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private void notifyFailed(QueuedNavigationRequest request) {
        QueuedNavigationRequest snapshot = snapshotOf(request);
        completeFuture(snapshot);
        for (QueueCompletionListener listener : listeners) {
            try {
                listener.onFailed(snapshot);
            }
            catch (RuntimeException e) {
                log.warn("Queue listener failed requestId={} listener={}: {}",
                        request.getRequestId(), listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private QueuedNavigationRequest snapshotOf(QueuedNavigationRequest request) {
        lock.lock();
        try {
            return request.snapshot();
        }
        finally {
            lock.unlock();
        }
    }

    private void completeFuture(QueuedNavigationRequest snapshot) {
        CompletableFuture<QueuedNavigationRequest> future = completions.get(snapshot.getRequestId());
        if (future != null) {
            future.complete(snapshot);
        }
    }

    private enum DependencyState {
        RESOLVED,
        UNRESOLVED,
        FAILED
    }
}
