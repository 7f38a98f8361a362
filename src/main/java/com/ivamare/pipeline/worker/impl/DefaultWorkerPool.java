package com.ivamare.pipeline.worker.impl;

import com.ivamare.pipeline.event.EventBus;
import com.ivamare.pipeline.event.EventData;
import com.ivamare.pipeline.exception.FailureClassifier;
import com.ivamare.pipeline.exception.InvalidOperationException;
import com.ivamare.pipeline.exception.OperationCancelledException;
import com.ivamare.pipeline.model.FailureKind;
import com.ivamare.pipeline.model.Task;
import com.ivamare.pipeline.model.TaskState;
import com.ivamare.pipeline.operation.OperationResult;
import com.ivamare.pipeline.operation.ProgressListener;
import com.ivamare.pipeline.operation.StageOperation;
import com.ivamare.pipeline.queue.FailureOutcome;
import com.ivamare.pipeline.queue.TaskQueue;
import com.ivamare.pipeline.worker.Stage;
import com.ivamare.pipeline.worker.WorkerHandle;
import com.ivamare.pipeline.worker.WorkerPool;
import com.ivamare.pipeline.worker.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default worker pool backed by a fixed thread pool sized to the concurrency limit.
 *
 * <p>A slot is held from dispatch until the worker thread returns from the operation,
 * including after a cancel or timeout of an operation that does not honour its token.
 */
public class DefaultWorkerPool implements WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkerPool.class);

    private final Stage stage;
    private final TaskQueue queue;
    private final EventBus eventBus;
    private final StageOperation operation;
    private final int concurrency;
    private final Duration operationTimeout;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final Semaphore semaphore;
    private final ConcurrentHashMap<String, DefaultWorkerHandle> active = new ConcurrentHashMap<>();

    private final ExecutorService executor;
    private final ExecutorService progressExecutor;
    private final ScheduledExecutorService timeoutScheduler;

    /**
     * Creates a new DefaultWorkerPool.
     *
     * @param stage Stage served by this pool
     * @param queue Stage queue tasks are settled on
     * @param eventBus Bus for lifecycle and progress events
     * @param operation Operation run for each task
     * @param concurrency Number of concurrent workers
     * @param operationTimeout Maximum duration of one attempt, null for none
     */
    public DefaultWorkerPool(
            Stage stage,
            TaskQueue queue,
            EventBus eventBus,
            StageOperation operation,
            int concurrency,
            Duration operationTimeout) {
        this.stage = stage;
        this.queue = queue;
        this.eventBus = eventBus;
        this.operation = operation;
        this.concurrency = concurrency;
        this.operationTimeout = operationTimeout;
        this.semaphore = new Semaphore(concurrency);

        this.executor = Executors.newFixedThreadPool(concurrency, threadFactory("-worker-"));
        this.progressExecutor = Executors.newSingleThreadExecutor(threadFactory("-progress-"));
        this.timeoutScheduler = operationTimeout != null
            ? Executors.newSingleThreadScheduledExecutor(threadFactory("-timeout-"))
            : null;

        log.info("Started {} worker pool, concurrency={}, operationTimeout={}",
            stage.getValue(), concurrency, operationTimeout);
    }

    @Override
    public WorkerHandle dispatch(Task task) {
        if (task == null) {
            throw new IllegalArgumentException("task is required");
        }
        if (!running.get()) {
            throw new InvalidOperationException("Worker pool " + stage.getValue() + " is not running");
        }
        if (!semaphore.tryAcquire()) {
            throw new InvalidOperationException(
                "No free " + stage.getValue() + " worker for item " + task.itemId());
        }

        DefaultWorkerHandle handle = new DefaultWorkerHandle(this, task);
        if (active.putIfAbsent(task.itemId(), handle) != null) {
            semaphore.release();
            throw new InvalidOperationException(
                "Item " + task.itemId() + " is already in flight in the " + stage.getValue() + " pool");
        }
        inFlightCount.incrementAndGet();

        try {
            executor.execute(() -> run(handle));
        } catch (RejectedExecutionException e) {
            release(handle);
            throw new InvalidOperationException("Worker pool " + stage.getValue() + " rejected item " + task.itemId());
        }

        scheduleTimeout(handle);
        log.debug("Dispatched {} of item {} (retry={})", stage.getValue(), task.itemId(), task.retryCount());
        return handle;
    }

    @Override
    public boolean cancel(WorkerHandle handle) {
        if (!(handle instanceof DefaultWorkerHandle h) || h.pool() != this) {
            return false;
        }
        if (!h.requestCancel()) {
            log.debug("Cancel of {} item {} ignored, attempt already {}", stage.getValue(), h.itemId(), h.state());
            return false;
        }

        queue.cancelTask(h.itemId());
        log.info("Cancelled {} of item {}", stage.getValue(), h.itemId());

        Map<String, Object> data = EventData.itemOnly(h.itemId());
        data.put(EventData.RETRY_COUNT, h.task().retryCount());
        eventBus.publish(stage.cancelled(), data, stage.source());
        return true;
    }

    @Override
    public boolean cancel(String itemId) {
        DefaultWorkerHandle handle = active.get(itemId);
        return handle != null && cancel(handle);
    }

    @Override
    public int cancelAll() {
        int cancelled = 0;
        for (DefaultWorkerHandle handle : List.copyOf(active.values())) {
            if (cancel(handle)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    @Override
    public int availableSlots() {
        return running.get() ? semaphore.availablePermits() : 0;
    }

    @Override
    public int inFlightCount() {
        return inFlightCount.get();
    }

    @Override
    public boolean isInFlight(String itemId) {
        return active.containsKey(itemId);
    }

    @Override
    public int concurrency() {
        return concurrency;
    }

    @Override
    public Stage stage() {
        return stage;
    }

    @Override
    public List<WorkerHandle> activeHandles() {
        return new ArrayList<>(active.values());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public CompletableFuture<Void> shutdown(Duration timeout) {
        if (!running.getAndSet(false)) {
            return CompletableFuture.completedFuture(null);
        }

        int cancelled = cancelAll();
        log.info("Stopping {} worker pool, cancelled {} in-flight tasks", stage.getValue(), cancelled);

        return CompletableFuture.runAsync(() -> {
            try {
                // Wait for worker threads to leave their operations
                long deadline = System.currentTimeMillis() + timeout.toMillis();
                while (inFlightCount.get() > 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(50);
                }

                if (inFlightCount.get() > 0) {
                    log.warn("Timeout waiting for {} in-flight {} workers", inFlightCount.get(), stage.getValue());
                }

                executor.shutdown();
                long remaining = Math.max(100, deadline - System.currentTimeMillis());
                if (!executor.awaitTermination(remaining, TimeUnit.MILLISECONDS)) {
                    executor.shutdownNow();
                }
                shutdownAuxiliaryExecutors();

                log.info("{} worker pool stopped", stage.getValue());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                shutdownNow();
            }
        });
    }

    @Override
    public void shutdownNow() {
        running.set(false);
        cancelAll();
        executor.shutdownNow();
        shutdownAuxiliaryExecutors();
    }

    // --- Task Processing ---

    private void run(DefaultWorkerHandle handle) {
        Task task = handle.task();
        try {
            if (queue.getState(task.itemId()).orElse(null) != TaskState.PROCESSING) {
                // Removed from the queue between claim and start
                handle.requestCancel();
                log.info("Skipping {} of item {}, no longer claimed", stage.getValue(), task.itemId());
                return;
            }
            if (!handle.markRunning()) {
                log.debug("Skipping {} of item {}, attempt already {}", stage.getValue(), task.itemId(), handle.state());
                return;
            }

            Map<String, Object> started = EventData.itemOnly(task.itemId());
            started.put(EventData.RETRY_COUNT, task.retryCount());
            eventBus.publish(stage.started(), started, stage.source());

            OperationResult result;
            try {
                result = operation.execute(task, progressListener(handle), handle.token());
            } catch (OperationCancelledException e) {
                onFailure(handle, "Operation cancelled without a cancel request", FailureKind.TRANSIENT);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                onFailure(handle, "Operation interrupted", FailureKind.TRANSIENT);
                return;
            } catch (Exception e) {
                log.debug("{} of item {} threw", stage.getValue(), task.itemId(), e);
                onFailure(handle, FailureClassifier.describe(e), FailureClassifier.classify(e));
                return;
            }

            if (result != null && result.isDefiniteSuccess()) {
                onSuccess(handle, result);
            } else {
                String reason = result != null ? result.failureReason() : "Operation returned no result";
                onFailure(handle, reason, FailureClassifier.classify(reason));
            }
        } catch (Exception e) {
            log.error("{} worker crashed for item {}", stage.getValue(), task.itemId(), e);
            onFailure(handle, FailureClassifier.describe(e), FailureKind.TRANSIENT);
        } finally {
            release(handle);
        }
    }

    private void onSuccess(DefaultWorkerHandle handle, OperationResult result) {
        String itemId = handle.itemId();
        if (!handle.settle(WorkerState.SUCCEEDED)) {
            log.info("Discarding {} result of item {}, attempt already {}", stage.getValue(), itemId, handle.state());
            return;
        }

        if (!queue.markCompleted(itemId)) {
            return;
        }

        log.info("{} of item {} succeeded: {}", stage.getValue(), itemId, result.ref());
        Map<String, Object> data = EventData.completed(itemId, stage.refKey(), result.ref(), result.attributes());
        data.put(EventData.RETRY_COUNT, handle.task().retryCount());
        eventBus.publish(stage.completed(), data, stage.source());
    }

    private void onFailure(DefaultWorkerHandle handle, String error, FailureKind kind) {
        String itemId = handle.itemId();
        if (!handle.settle(WorkerState.FAILED)) {
            log.info("Discarding {} failure of item {}, attempt already {}: {}",
                stage.getValue(), itemId, handle.state(), error);
            return;
        }

        FailureOutcome outcome = queue.markFailed(itemId, error);
        if (outcome == FailureOutcome.IGNORED) {
            return;
        }

        Task task = handle.task();
        int retryCount = queue.getTask(itemId).map(Task::retryCount).orElse(task.retryCount());
        boolean terminal = outcome.isTerminal();

        if (terminal) {
            log.error("{} of item {} failed permanently after {} retries ({}): {}",
                stage.getValue(), itemId, retryCount, kind, error);
        } else {
            log.warn("{} of item {} failed ({}), retry {}/{} scheduled: {}",
                stage.getValue(), itemId, kind, retryCount, task.maxRetries(), error);
        }

        eventBus.publish(stage.failed(),
            EventData.failed(itemId, error, kind, retryCount, task.maxRetries(), terminal),
            stage.source());
    }

    private void onTimeout(DefaultWorkerHandle handle) {
        if (handle.state().isTerminal()) {
            return;
        }
        log.warn("{} of item {} exceeded {}", stage.getValue(), handle.itemId(), operationTimeout);
        onFailure(handle, stage.getValue() + " timed out after " + operationTimeout.toMillis() + "ms",
            FailureKind.TRANSIENT);
        handle.token().cancel();
    }

    private ProgressListener progressListener(DefaultWorkerHandle handle) {
        return progress -> {
            if (progress == null || handle.state() != WorkerState.RUNNING) {
                return;
            }
            try {
                progressExecutor.execute(() -> {
                    if (handle.state() == WorkerState.RUNNING) {
                        eventBus.publish(stage.progress(),
                            EventData.progress(handle.itemId(), progress), stage.source());
                    }
                });
            } catch (RejectedExecutionException e) {
                log.debug("Dropping {} progress of item {}, pool stopping", stage.getValue(), handle.itemId());
            }
        };
    }

    private void scheduleTimeout(DefaultWorkerHandle handle) {
        if (timeoutScheduler == null) {
            return;
        }
        try {
            handle.timeoutFuture(timeoutScheduler.schedule(
                () -> onTimeout(handle), operationTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule timeout for {} of item {}", stage.getValue(), handle.itemId());
        }
    }

    private void release(DefaultWorkerHandle handle) {
        if (active.remove(handle.itemId(), handle)) {
            inFlightCount.decrementAndGet();
            semaphore.release();
        }
        handle.finish();
    }

    private void shutdownAuxiliaryExecutors() {
        progressExecutor.shutdown();
        if (timeoutScheduler != null) {
            timeoutScheduler.shutdownNow();
        }
    }

    private ThreadFactory threadFactory(String suffix) {
        AtomicInteger threadCount = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, stage.getValue() + suffix + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
