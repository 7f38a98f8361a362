package com.ivamare.pipeline.worker.impl;

import com.ivamare.pipeline.model.Task;
import com.ivamare.pipeline.operation.CancellationToken;
import com.ivamare.pipeline.worker.Stage;
import com.ivamare.pipeline.worker.WorkerHandle;
import com.ivamare.pipeline.worker.WorkerState;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Worker handle whose terminal state is decided by a single compare-and-set, so exactly
 * one of success, failure, timeout or cancel wins.
 */
class DefaultWorkerHandle implements WorkerHandle {

    private final DefaultWorkerPool pool;
    private final Task task;
    private final CancellationToken token;
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.CLAIMED);
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile Future<?> timeoutFuture;

    DefaultWorkerHandle(DefaultWorkerPool pool, Task task) {
        this.pool = pool;
        this.task = task;
        this.token = new CancellationToken(task.itemId());
    }

    @Override
    public String itemId() {
        return task.itemId();
    }

    @Override
    public Stage stage() {
        return pool.stage();
    }

    @Override
    public Task task() {
        return task;
    }

    @Override
    public WorkerState state() {
        return state.get();
    }

    @Override
    public boolean cancel() {
        return pool.cancel(this);
    }

    @Override
    public boolean isDone() {
        return done.getCount() == 0;
    }

    @Override
    public boolean awaitTermination(Duration timeout) {
        try {
            return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String toString() {
        return "WorkerHandle[" + pool.stage().getValue() + ":" + task.itemId() + ", " + state.get() + "]";
    }

    // --- Transitions used by the pool ---

    DefaultWorkerPool pool() {
        return pool;
    }

    CancellationToken token() {
        return token;
    }

    boolean markRunning() {
        return state.compareAndSet(WorkerState.CLAIMED, WorkerState.RUNNING);
    }

    /**
     * Settle a running attempt. Only FAILED may also settle an attempt that never started
     * (timeout before the worker thread picked it up).
     */
    boolean settle(WorkerState outcome) {
        if (state.compareAndSet(WorkerState.RUNNING, outcome)) {
            return true;
        }
        return outcome == WorkerState.FAILED && state.compareAndSet(WorkerState.CLAIMED, outcome);
    }

    boolean requestCancel() {
        while (true) {
            WorkerState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, WorkerState.CANCELLED)) {
                token.cancel();
                return true;
            }
        }
    }

    void timeoutFuture(Future<?> future) {
        this.timeoutFuture = future;
    }

    void finish() {
        Future<?> future = timeoutFuture;
        if (future != null) {
            future.cancel(false);
        }
        done.countDown();
    }
}
