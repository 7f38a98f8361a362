package com.ivamare.pipeline.operation;

import java.util.Map;

/**
 * Fetches an item's content. Supplied by the host application.
 */
@FunctionalInterface
public interface DownloadOperation {

    /**
     * Download the item.
     *
     * @param itemId Item id
     * @param payload Item payload as detected
     * @param progress Progress sink
     * @param token Cancellation signal to honour
     * @return result whose ref is the artifact reference (e.g. a file path)
     * @throws Exception any failure; classified and retried by the pipeline
     */
    OperationResult download(String itemId, Map<String, Object> payload,
                             ProgressListener progress, CancellationToken token) throws Exception;
}
