package com.ivamare.pipeline.exception;

/**
 * Thrown when a task payload cannot be queued (missing or blank item id).
 */
public class InvalidTaskException extends PipelineException {

    public InvalidTaskException(String message) {
        super(message);
    }
}
