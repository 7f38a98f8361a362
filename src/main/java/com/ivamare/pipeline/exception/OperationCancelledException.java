package com.ivamare.pipeline.exception;

/**
 * Thrown by an operation that noticed its cancellation token was signalled.
 */
public class OperationCancelledException extends PipelineException {

    private final String itemId;

    public OperationCancelledException(String itemId) {
        super("Operation cancelled for item " + itemId);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
