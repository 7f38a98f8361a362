package com.ivamare.pipeline.operation;

import java.util.Map;

/**
 * Publishes a downloaded artifact. Supplied by the host application.
 */
@FunctionalInterface
public interface UploadOperation {

    /**
     * Upload the artifact.
     *
     * @param itemId Item id
     * @param artifactRef Reference produced by the download stage
     * @param payload Item payload plus download attributes
     * @param progress Progress sink
     * @param token Cancellation signal to honour
     * @return result whose ref is the published id
     * @throws Exception any failure; classified and retried by the pipeline
     */
    OperationResult upload(String itemId, String artifactRef, Map<String, Object> payload,
                           ProgressListener progress, CancellationToken token) throws Exception;
}
