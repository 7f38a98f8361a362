package com.ivamare.pipeline.model;

/**
 * The queue view a task currently sits in.
 */
public enum TaskState {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
