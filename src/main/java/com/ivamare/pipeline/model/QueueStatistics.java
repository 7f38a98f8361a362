package com.ivamare.pipeline.model;

/**
 * Snapshot of the sizes of the four queue views.
 */
public record QueueStatistics(
    int pending,
    int processing,
    int completed,
    int failed
) {
    public int total() {
        return pending + processing + completed + failed;
    }
}
