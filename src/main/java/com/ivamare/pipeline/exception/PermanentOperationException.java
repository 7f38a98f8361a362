package com.ivamare.pipeline.exception;

import java.util.Map;

/**
 * Raised for failures that will not go away on retry (content removed, invalid
 * payload, quota exceeded).
 *
 * <p>Reported with failure kind PERMANENT. The attempt still consumes the regular
 * retry budget.
 */
public class PermanentOperationException extends PipelineException {

    private final String code;
    private final String errorMessage;
    private final Map<String, Object> details;

    public PermanentOperationException(String code, String message) {
        this(code, message, Map.of());
    }

    public PermanentOperationException(String code, String message, Map<String, Object> details) {
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
