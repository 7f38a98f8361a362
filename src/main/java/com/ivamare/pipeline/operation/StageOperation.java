package com.ivamare.pipeline.operation;

import com.ivamare.pipeline.event.EventData;
import com.ivamare.pipeline.model.Task;

/**
 * The operation a worker pool runs for each claimed task.
 */
@FunctionalInterface
public interface StageOperation {

    OperationResult execute(Task task, ProgressListener progress, CancellationToken token) throws Exception;

    static StageOperation forDownload(DownloadOperation download) {
        return (task, progress, token) -> download.download(task.itemId(), task.payload(), progress, token);
    }

    static StageOperation forUpload(UploadOperation upload) {
        return (task, progress, token) -> {
            Object artifactRef = task.payload().get(EventData.ARTIFACT_REF);
            return upload.upload(task.itemId(), artifactRef != null ? artifactRef.toString() : null,
                task.payload(), progress, token);
        };
    }
}
