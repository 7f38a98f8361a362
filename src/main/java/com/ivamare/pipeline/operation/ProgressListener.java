package com.ivamare.pipeline.operation;

import com.ivamare.pipeline.model.ProgressInfo;

/**
 * Receives progress reports from a running operation. Never blocks the caller.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ProgressInfo progress);
}
