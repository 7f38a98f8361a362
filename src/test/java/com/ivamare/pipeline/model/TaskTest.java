package com.ivamare.pipeline.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Task")
class TaskTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Task task(String id, Priority priority, Instant enqueuedAt, long sequence) {
        return new Task(id, Map.of("item_id", id), priority, enqueuedAt, sequence, 0, 3, null, null);
    }

    @Test
    @DisplayName("should order by priority, then time, then sequence")
    void shouldOrderForClaiming() {
        List<Task> tasks = new ArrayList<>(List.of(
            task("low", Priority.LOW, T0, 0),
            task("normal-late", Priority.NORMAL, T0.plusSeconds(5), 1),
            task("normal-b", Priority.NORMAL, T0, 3),
            task("normal-a", Priority.NORMAL, T0, 2),
            task("high", Priority.HIGH, T0.plusSeconds(60), 4)
        ));

        tasks.sort(Task.CLAIM_ORDER);

        assertEquals(List.of("high", "normal-a", "normal-b", "normal-late", "low"),
            tasks.stream().map(Task::itemId).toList());
    }

    @Test
    @DisplayName("should build retry copy with LOW priority and fresh position")
    void shouldBuildRetryCopy() {
        Task original = task("v1", Priority.HIGH, T0, 0);

        Task retry = original.withRetry(T0.plusSeconds(10), 7, T0.plusSeconds(40), "timeout");

        assertEquals(Priority.LOW, retry.priority());
        assertEquals(1, retry.retryCount());
        assertEquals(7, retry.sequence());
        assertEquals("timeout", retry.lastError());
        assertFalse(retry.isEligible(T0.plusSeconds(39)));
        assertTrue(retry.isEligible(T0.plusSeconds(40)));
    }

    @Test
    @DisplayName("should parse priority values")
    void shouldParsePriorityValues() {
        assertEquals(Priority.HIGH, Priority.fromValue(1));
        assertEquals(Priority.LOW, Priority.fromValue(3));
        assertThrows(IllegalArgumentException.class, () -> Priority.fromValue(9));
    }
}
