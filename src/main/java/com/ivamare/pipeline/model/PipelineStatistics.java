package com.ivamare.pipeline.model;

/**
 * Snapshot of both pipeline stages.
 *
 * @param downloads Download queue statistics
 * @param uploads Upload queue statistics
 * @param activeDownloads Download workers currently in flight
 * @param activeUploads Upload workers currently in flight
 */
public record PipelineStatistics(
    QueueStatistics downloads,
    QueueStatistics uploads,
    int activeDownloads,
    int activeUploads
) {
}
