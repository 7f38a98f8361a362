package com.ivamare.pipeline.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    @Test
    @DisplayName("should create default policy with 3 retries and no delay")
    void shouldCreateDefaultPolicy() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(3, policy.maxRetries());
        assertTrue(policy.backoffSchedule().isEmpty());
        assertEquals(Duration.ZERO, policy.getBackoff(1));
    }

    @Test
    @DisplayName("should create no retry policy")
    void shouldCreateNoRetryPolicy() {
        RetryPolicy policy = RetryPolicy.noRetry();

        assertEquals(0, policy.maxRetries());
        assertFalse(policy.shouldRetry(0));
    }

    @Test
    @DisplayName("should copy the backoff schedule")
    void shouldCopyBackoffSchedule() {
        List<Integer> schedule = new ArrayList<>(List.of(10, 60));
        RetryPolicy policy = new RetryPolicy(3, schedule);
        schedule.add(999);

        assertEquals(List.of(10, 60), policy.backoffSchedule());
        assertThrows(UnsupportedOperationException.class, () -> policy.backoffSchedule().add(500));
    }

    @Test
    @DisplayName("should return backoff per retry and repeat the last value")
    void shouldReturnBackoffPerRetry() {
        RetryPolicy policy = new RetryPolicy(5, List.of(10, 60));

        assertEquals(Duration.ofSeconds(10), policy.getBackoff(1));
        assertEquals(Duration.ofSeconds(60), policy.getBackoff(2));
        assertEquals(Duration.ofSeconds(60), policy.getBackoff(4));
        assertEquals(Duration.ZERO, policy.getBackoff(0));
    }

    @Test
    @DisplayName("should allow retry while below max retries")
    void shouldAllowRetryBelowMax() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertTrue(policy.shouldRetry(1));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
    }

    @Test
    @DisplayName("should reject negative max retries")
    void shouldRejectNegativeMaxRetries() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, List.of()));
    }
}
