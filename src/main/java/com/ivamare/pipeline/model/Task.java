package com.ivamare.pipeline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work moving through one pipeline stage.
 *
 * @param itemId Unique item id, the task key
 * @param payload Opaque item data (null values allowed)
 * @param priority Current priority
 * @param enqueuedAt When the task (re)entered the pending view
 * @param sequence Insertion sequence, breaks ties between equal timestamps
 * @param retryCount Failed attempts counted so far
 * @param maxRetries Retry budget of this task
 * @param notBefore Earliest claim time after a backoff, or null
 * @param lastError Error of the last failed attempt, or null
 */
public record Task(
    String itemId,
    Map<String, Object> payload,
    Priority priority,
    Instant enqueuedAt,
    long sequence,
    int retryCount,
    int maxRetries,
    Instant notBefore,
    String lastError
) {
    /**
     * Claim order: priority, then enqueue time, then insertion sequence.
     */
    public static final Comparator<Task> CLAIM_ORDER = Comparator
        .comparingInt((Task t) -> t.priority().getValue())
        .thenComparing(Task::enqueuedAt)
        .thenComparingLong(Task::sequence);

    public Task {
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
    }

    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    public boolean isEligible(Instant now) {
        return notBefore == null || !notBefore.isAfter(now);
    }

    /**
     * Copy for re-queueing after a failed attempt: one more retry, LOW priority, fresh position.
     */
    public Task withRetry(Instant now, long newSequence, Instant retryNotBefore, String error) {
        return new Task(itemId, payload, Priority.LOW, now, newSequence,
            retryCount + 1, maxRetries, retryNotBefore, error);
    }

    /**
     * Copy for the failed view.
     */
    public Task withFailure(int finalRetryCount, String error) {
        return new Task(itemId, payload, priority, enqueuedAt, sequence,
            finalRetryCount, maxRetries, null, error);
    }
}
