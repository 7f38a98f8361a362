package com.ivamare.pipeline.worker;

/**
 * Lifecycle of one worker attempt.
 *
 * <pre>
 * CLAIMED -> RUNNING -> SUCCEEDED | FAILED | CANCELLED
 * CLAIMED -> CANCELLED | FAILED
 * </pre>
 */
public enum WorkerState {
    CLAIMED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
