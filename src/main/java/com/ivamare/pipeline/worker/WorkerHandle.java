package com.ivamare.pipeline.worker;

import com.ivamare.pipeline.model.Task;

import java.time.Duration;

/**
 * Handle to one in-flight task attempt.
 */
public interface WorkerHandle {

    String itemId();

    Stage stage();

    Task task();

    WorkerState state();

    /**
     * Request cooperative cancellation.
     *
     * @return true if the cancel was accepted, false if the attempt already settled
     */
    boolean cancel();

    /**
     * Whether the worker thread has returned from the operation.
     */
    boolean isDone();

    /**
     * Wait for the worker thread to return from the operation.
     *
     * @param timeout Maximum wait
     * @return true if done within the timeout
     */
    boolean awaitTermination(Duration timeout);
}
