package com.ivamare.pipeline.operation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a download or upload attempt.
 *
 * @param success Whether the operation reports success
 * @param ref Artifact reference (download) or published id (upload)
 * @param error Error description when unsuccessful
 * @param attributes Extra data handed to the next stage (title, size, ...)
 */
public record OperationResult(
    boolean success,
    String ref,
    String error,
    Map<String, Object> attributes
) {
    public OperationResult {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static OperationResult success(String ref) {
        return new OperationResult(true, ref, null, Map.of());
    }

    public static OperationResult success(String ref, Map<String, Object> attributes) {
        return new OperationResult(true, ref, null, attributes);
    }

    public static OperationResult failure(String error) {
        return new OperationResult(false, null, error, Map.of());
    }

    /**
     * Success only counts with a usable reference; a bare success flag is not enough.
     *
     * @return true if the attempt produced a non-blank reference
     */
    public boolean isDefiniteSuccess() {
        return success && ref != null && !ref.isBlank();
    }

    /**
     * Error to record for an attempt that was not a definite success.
     *
     * @return non-null error description
     */
    public String failureReason() {
        if (error != null && !error.isBlank()) {
            return error;
        }
        return success ? "Operation reported success without a result reference" : "Operation failed";
    }
}
