package com.ivamare.pipeline.exception;

import java.util.Map;

/**
 * Raised for retryable failures (network, timeout, temporary unavailability).
 *
 * <p>Reported with failure kind TRANSIENT. The attempt is retried while the
 * task has retry budget left.
 */
public class TransientOperationException extends PipelineException {

    private final String code;
    private final String errorMessage;
    private final Map<String, Object> details;

    public TransientOperationException(String code, String message) {
        this(code, message, Map.of());
    }

    public TransientOperationException(String code, String message, Map<String, Object> details) {
        super("[" + code + "] " + message);
        this.code = code;
        this.errorMessage = message;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
