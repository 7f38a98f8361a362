package com.ivamare.pipeline.worker;

import com.ivamare.pipeline.model.Task;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Bounded set of workers running the operation of one stage.
 */
public interface WorkerPool {

    /**
     * Run a claimed task on a free worker. Returns without waiting for the operation.
     *
     * @param task Task already moved to processing by the stage queue
     * @return handle of the started attempt
     * @throws com.ivamare.pipeline.exception.InvalidOperationException if the pool is
     *         stopped, has no free slot, or already runs the item
     */
    WorkerHandle dispatch(Task task);

    /**
     * Cancel an in-flight attempt. The task is removed from the queue and does not
     * count as a retry.
     *
     * @param handle Handle returned by dispatch
     * @return true if the cancel was accepted
     */
    boolean cancel(WorkerHandle handle);

    /**
     * Cancel the in-flight attempt of an item, if any.
     *
     * @param itemId Item id
     * @return true if an attempt was cancelled
     */
    boolean cancel(String itemId);

    /**
     * Cancel every in-flight attempt.
     *
     * @return number of cancelled attempts
     */
    int cancelAll();

    int availableSlots();

    int inFlightCount();

    /**
     * Whether a worker thread of this pool still holds the item, including an attempt that
     * timed out or was cancelled but has not returned yet.
     *
     * @param itemId Item id
     * @return true while the item occupies a slot
     */
    boolean isInFlight(String itemId);

    int concurrency();

    Stage stage();

    List<WorkerHandle> activeHandles();

    boolean isRunning();

    /**
     * Stop accepting work, cancel in-flight attempts and wait for worker threads.
     *
     * @param timeout Maximum time to wait for in-flight attempts
     * @return future that completes when stopped
     */
    CompletableFuture<Void> shutdown(Duration timeout);

    /**
     * Stop immediately, interrupting worker threads.
     */
    void shutdownNow();

    /**
     * Create a new pool builder.
     *
     * @return new builder instance
     */
    static WorkerPoolBuilder builder() {
        return new WorkerPoolBuilder();
    }
}
