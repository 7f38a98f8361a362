package com.ivamare.pipeline.ratelimit;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * In-process limit on upload starts (e.g. the daily API quota of the publishing service).
 *
 * <p>Backed by a local Bucket4j bucket with greedy refill. An exhausted quota only delays
 * dispatch; tasks stay pending until permits refill.
 */
public class UploadQuota {

    private static final Logger log = LoggerFactory.getLogger(UploadQuota.class);

    private final Bucket bucket;
    private final long permits;
    private final Duration period;

    private UploadQuota(long permits, Duration period) {
        this.permits = permits;
        this.period = period;
        this.bucket = permits > 0
            ? Bucket.builder()
                .addLimit(Bandwidth.builder()
                    .capacity(permits)
                    .refillGreedy(permits, period)
                    .build())
                .build()
            : null;
    }

    /**
     * Quota without limit.
     *
     * @return unlimited quota
     */
    public static UploadQuota unlimited() {
        return new UploadQuota(0, Duration.ZERO);
    }

    /**
     * Create a quota of {@code permits} uploads per {@code period}.
     *
     * @param permits Uploads per period, 0 for unlimited
     * @param period Refill period
     * @return the quota
     */
    public static UploadQuota of(long permits, Duration period) {
        if (permits < 0) {
            throw new IllegalArgumentException("permits must not be negative");
        }
        if (permits > 0 && (period == null || period.isZero() || period.isNegative())) {
            throw new IllegalArgumentException("period must be positive");
        }
        return permits == 0 ? unlimited() : new UploadQuota(permits, period);
    }

    public boolean isUnlimited() {
        return bucket == null;
    }

    /**
     * Take one permit without waiting.
     *
     * @return true if an upload may start
     */
    public boolean tryAcquire() {
        if (bucket == null) {
            return true;
        }
        boolean acquired = bucket.tryConsume(1);
        if (!acquired) {
            log.debug("Upload quota of {} per {} exhausted", permits, period);
        }
        return acquired;
    }

    /**
     * Return a permit that was acquired but not used.
     */
    public void release() {
        if (bucket != null) {
            bucket.addTokens(1);
        }
    }

    /**
     * Get remaining permits.
     *
     * @return remaining permits, {@link Long#MAX_VALUE} when unlimited
     */
    public long availablePermits() {
        return bucket == null ? Long.MAX_VALUE : bucket.getAvailableTokens();
    }
}
