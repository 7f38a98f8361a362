package com.ivamare.pipeline.policy;

import java.time.Duration;
import java.util.List;

/**
 * Policy for re-queueing failed download/upload attempts.
 *
 * @param maxRetries Retry budget per task; the task fails for good once its retry count reaches it
 * @param backoffSchedule Delay in seconds before each retry becomes claimable
 */
public record RetryPolicy(
    int maxRetries,
    List<Integer> backoffSchedule
) {
    public static final int DEFAULT_MAX_RETRIES = 3;

    /**
     * Creates a RetryPolicy with immutable backoff schedule.
     */
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        backoffSchedule = backoffSchedule == null ? List.of() : List.copyOf(backoffSchedule);
    }

    /**
     * Default retry policy: 3 retries, claimable again immediately.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, List.of());
    }

    /**
     * Create a policy where the first failure is final.
     *
     * @return No retry policy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, List.of());
    }

    /**
     * Get the delay before a retried task may be claimed again.
     *
     * @param retryCount The retry count after the failure (1-based)
     * @return Delay, zero when no schedule is configured
     */
    public Duration getBackoff(int retryCount) {
        if (backoffSchedule.isEmpty() || retryCount <= 0) {
            return Duration.ZERO;
        }

        int index = retryCount - 1;
        if (index < backoffSchedule.size()) {
            return Duration.ofSeconds(backoffSchedule.get(index));
        }

        // Use last value for retries beyond schedule
        return Duration.ofSeconds(backoffSchedule.get(backoffSchedule.size() - 1));
    }

    /**
     * Check if a task with the given retry count may be retried.
     *
     * @param retryCount The retry count after the failure
     * @return true if the task goes back to pending
     */
    public boolean shouldRetry(int retryCount) {
        return retryCount < maxRetries;
    }
}
