package com.ivamare.pipeline.exception;

import com.ivamare.pipeline.model.FailureKind;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies failed download/upload attempts as transient or permanent.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>The pipeline's own {@link TransientOperationException} / {@link PermanentOperationException}</li>
 *   <li>Network and timeout exception types</li>
 *   <li>Known message patterns (checked case-insensitively)</li>
 *   <li>Wrapped cause exceptions (recursive)</li>
 * </ol>
 *
 * <p>Anything unrecognised is treated as transient.
 */
public final class FailureClassifier {

    private FailureClassifier() {
        // Utility class - no instantiation
    }

    private static final String[] PERMANENT_MESSAGE_PATTERNS = {
        "quota exceeded",
        "quotaexceeded",
        "not found",
        "404",
        "forbidden",
        "403",
        "unauthorized",
        "401",
        "video unavailable",
        "private video",
        "has been removed",
        "copyright",
        "invalid",
        "unsupported"
    };

    private static final String[] TRANSIENT_MESSAGE_PATTERNS = {
        "timed out",
        "timeout",
        "connection refused",
        "connection reset",
        "connection closed",
        "broken pipe",
        "temporarily unavailable",
        "service unavailable",
        "503",
        "502",
        "rate limit",
        "too many requests",
        "429",
        "network is unreachable"
    };

    /**
     * Classify an exception thrown by an operation.
     *
     * @param ex the exception to classify
     * @return the failure kind, TRANSIENT when unknown
     */
    public static FailureKind classify(Throwable ex) {
        FailureKind kind = classifyOrNull(ex);
        return kind != null ? kind : FailureKind.TRANSIENT;
    }

    /**
     * Classify the error text of an unsuccessful operation result.
     *
     * @param error the reported error, may be null
     * @return the failure kind, TRANSIENT when unknown
     */
    public static FailureKind classify(String error) {
        FailureKind kind = classifyMessage(error);
        return kind != null ? kind : FailureKind.TRANSIENT;
    }

    /**
     * Build a non-null description of an exception for events and logs.
     *
     * @param ex the exception
     * @return message, or the exception class name when there is none
     */
    public static String describe(Throwable ex) {
        if (ex == null) {
            return "Unknown error";
        }
        String message = ex.getMessage();
        return message != null && !message.isBlank() ? message : ex.getClass().getSimpleName();
    }

    private static FailureKind classifyOrNull(Throwable ex) {
        if (ex == null) {
            return null;
        }

        if (ex instanceof PermanentOperationException) {
            return FailureKind.PERMANENT;
        }
        if (ex instanceof TransientOperationException) {
            return FailureKind.TRANSIENT;
        }

        // Check subclasses before parent classes to ensure all branches are reachable
        if (ex instanceof SocketTimeoutException
                || ex instanceof ConnectException
                || ex instanceof UnknownHostException
                || ex instanceof SocketException
                || ex instanceof InterruptedIOException
                || ex instanceof TimeoutException) {
            return FailureKind.TRANSIENT;
        }
        if (ex instanceof IllegalArgumentException || ex instanceof UnsupportedOperationException) {
            return FailureKind.PERMANENT;
        }

        FailureKind byMessage = classifyMessage(ex.getMessage());
        if (byMessage != null) {
            return byMessage;
        }

        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            FailureKind byCause = classifyOrNull(cause);
            if (byCause != null) {
                return byCause;
            }
        }

        if (ex instanceof IOException || ex instanceof UncheckedIOException) {
            return FailureKind.TRANSIENT;
        }
        return null;
    }

    private static FailureKind classifyMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String lowerMessage = message.toLowerCase();
        for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
            if (lowerMessage.contains(pattern)) {
                return FailureKind.TRANSIENT;
            }
        }
        for (String pattern : PERMANENT_MESSAGE_PATTERNS) {
            if (lowerMessage.contains(pattern)) {
                return FailureKind.PERMANENT;
            }
        }
        return null;
    }
}
