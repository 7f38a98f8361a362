package com.ivamare.pipeline.worker;

import com.ivamare.pipeline.event.EventBus;
import com.ivamare.pipeline.operation.StageOperation;
import com.ivamare.pipeline.queue.TaskQueue;
import com.ivamare.pipeline.worker.impl.DefaultWorkerPool;

import java.time.Duration;

/**
 * Builder for creating WorkerPool instances.
 */
public class WorkerPoolBuilder {

    private Stage stage;
    private TaskQueue queue;
    private EventBus eventBus;
    private StageOperation operation;
    private int concurrency = 1;
    private Duration operationTimeout;

    /**
     * Set the stage the pool serves.
     *
     * @param stage Download or upload
     * @return this builder
     */
    public WorkerPoolBuilder stage(Stage stage) {
        this.stage = stage;
        return this;
    }

    /**
     * Set the queue tasks are claimed from and settled on.
     *
     * @param queue The stage queue
     * @return this builder
     */
    public WorkerPoolBuilder queue(TaskQueue queue) {
        this.queue = queue;
        return this;
    }

    /**
     * Set the bus lifecycle and progress events are published on.
     *
     * @param eventBus The event bus
     * @return this builder
     */
    public WorkerPoolBuilder eventBus(EventBus eventBus) {
        this.eventBus = eventBus;
        return this;
    }

    /**
     * Set the operation run for each task.
     *
     * @param operation The stage operation
     * @return this builder
     */
    public WorkerPoolBuilder operation(StageOperation operation) {
        this.operation = operation;
        return this;
    }

    /**
     * Set the number of concurrent workers (default: 1).
     *
     * @param concurrency Number of workers
     * @return this builder
     */
    public WorkerPoolBuilder concurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    /**
     * Set the maximum duration of one attempt (default: none).
     *
     * @param operationTimeout Timeout, null or zero for none
     * @return this builder
     */
    public WorkerPoolBuilder operationTimeout(Duration operationTimeout) {
        this.operationTimeout = operationTimeout;
        return this;
    }

    /**
     * Build the pool instance.
     *
     * @return configured WorkerPool
     * @throws IllegalStateException if required properties not set
     */
    public WorkerPool build() {
        if (stage == null) {
            throw new IllegalStateException("stage is required");
        }
        if (queue == null) {
            throw new IllegalStateException("queue is required");
        }
        if (eventBus == null) {
            throw new IllegalStateException("eventBus is required");
        }
        if (operation == null) {
            throw new IllegalStateException("operation is required");
        }
        if (concurrency < 1) {
            throw new IllegalStateException("concurrency must be at least 1");
        }

        Duration timeout = operationTimeout;
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            timeout = null;
        }

        return new DefaultWorkerPool(stage, queue, eventBus, operation, concurrency, timeout);
    }
}
