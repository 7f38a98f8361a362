package com.ivamare.pipeline.exception;

/**
 * Thrown when an invalid state transition or operation is attempted.
 */
public class InvalidOperationException extends PipelineException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
