package com.ivamare.pipeline.queue.impl;

import com.ivamare.pipeline.exception.InvalidTaskException;
import com.ivamare.pipeline.model.Priority;
import com.ivamare.pipeline.model.QueueStatistics;
import com.ivamare.pipeline.model.Task;
import com.ivamare.pipeline.model.TaskState;
import com.ivamare.pipeline.policy.RetryPolicy;
import com.ivamare.pipeline.queue.FailureOutcome;
import com.ivamare.pipeline.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PriorityTaskQueue")
class PriorityTaskQueueTest {

    private MutableClock clock;
    private PriorityTaskQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        queue = new PriorityTaskQueue("download", 1, RetryPolicy.defaultPolicy(), clock);
    }

    private static Map<String, Object> item(String id) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("item_id", id);
        payload.put("title", "Video " + id);
        return payload;
    }

    @Nested
    @DisplayName("Add Tests")
    class AddTests {

        @Test
        @DisplayName("should add task as pending")
        void shouldAddTaskAsPending() {
            String itemId = queue.addTask(item("v1"), Priority.NORMAL);

            assertEquals("v1", itemId);
            assertEquals(Optional.of(TaskState.PENDING), queue.getState("v1"));
            Task task = queue.getTask("v1").orElseThrow();
            assertEquals(0, task.retryCount());
            assertEquals(3, task.maxRetries());
            assertEquals("Video v1", task.payload().get("title"));
        }

        @Test
        @DisplayName("should ignore duplicate while pending")
        void shouldIgnoreDuplicateWhilePending() {
            assertTrue(queue.tryAddTask(item("v1"), Priority.NORMAL));
            assertFalse(queue.tryAddTask(item("v1"), Priority.HIGH));

            assertEquals(new QueueStatistics(1, 0, 0, 0), queue.getStatistics());
            assertEquals(Priority.NORMAL, queue.getTask("v1").orElseThrow().priority());
        }

        @Test
        @DisplayName("should ignore duplicate in every view")
        void shouldIgnoreDuplicateInEveryView() {
            queue.addTask(item("v1"), Priority.NORMAL);
            queue.getNextTask(Duration.ZERO);
            assertFalse(queue.tryAddTask(item("v1"), Priority.NORMAL));

            queue.markCompleted("v1");
            assertFalse(queue.tryAddTask(item("v1"), Priority.NORMAL));

            assertEquals(new QueueStatistics(0, 0, 1, 0), queue.getStatistics());
        }

        @Test
        @DisplayName("should accept item again after clearing completed")
        void shouldAcceptItemAfterClearCompleted() {
            queue.addTask(item("v1"), Priority.NORMAL);
            queue.getNextTask(Duration.ZERO);
            queue.markCompleted("v1");

            assertEquals(1, queue.clearCompleted());

            assertTrue(queue.tryAddTask(item("v1"), Priority.NORMAL));
        }

        @Test
        @DisplayName("should reject payload without item id")
        void shouldRejectPayloadWithoutItemId() {
            assertThrows(InvalidTaskException.class, () -> queue.addTask(Map.of("title", "x"), Priority.HIGH));
            assertThrows(InvalidTaskException.class, () -> queue.addTask(Map.of("item_id", " "), Priority.HIGH));
            assertThrows(InvalidTaskException.class, () -> queue.addTask(null, Priority.HIGH));
        }
    }

    @Nested
    @DisplayName("Claim Tests")
    class ClaimTests {

        @Test
        @DisplayName("should serve HIGH before earlier NORMAL and respect limit")
        void shouldServeHighBeforeNormal() {
            queue.addTask(item("A"), Priority.NORMAL);
            clock.advance(Duration.ofSeconds(1));
            queue.addTask(item("B"), Priority.HIGH);

            Optional<Task> first = queue.getNextTask(Duration.ZERO);
            Optional<Task> second = queue.getNextTask(Duration.ZERO);

            assertEquals("B", first.orElseThrow().itemId());
            assertTrue(second.isEmpty());
            assertEquals(List.of("B"), queue.getProcessingTasks());
        }

        @Test
        @DisplayName("should pass over busy items and leave them pending")
        void shouldPassOverBusyItems() {
            PriorityTaskQueue wide = new PriorityTaskQueue("download", 2, RetryPolicy.defaultPolicy(), clock);
            wide.addTask(item("held"), Priority.HIGH);
            wide.addTask(item("free"), Priority.LOW);

            Optional<Task> claimed = wide.getNextTask(Duration.ZERO, "held"::equals);

            assertEquals("free", claimed.orElseThrow().itemId());
            assertEquals(Optional.of(TaskState.PENDING), wide.getState("held"));
            assertTrue(wide.getNextTask(Duration.ZERO, "held"::equals).isEmpty());
            assertEquals("held", wide.getNextTask(Duration.ZERO).orElseThrow().itemId());
        }

        @Test
        @DisplayName("should serve equal priority in FIFO order")
        void shouldServeFifoWithinPriority() {
            PriorityTaskQueue wide = new PriorityTaskQueue("download", 10, RetryPolicy.defaultPolicy(), clock);
            wide.addTask(item("first"), Priority.LOW);
            wide.addTask(item("second"), Priority.LOW);
            wide.addTask(item("third"), Priority.LOW);

            assertEquals("first", wide.getNextTask(Duration.ZERO).orElseThrow().itemId());
            assertEquals("second", wide.getNextTask(Duration.ZERO).orElseThrow().itemId());
            assertEquals("third", wide.getNextTask(Duration.ZERO).orElseThrow().itemId());
        }

        @Test
        @DisplayName("should return empty after timeout when nothing pending")
        void shouldReturnEmptyAfterTimeout() {
            long started = System.nanoTime();

            Optional<Task> task = queue.getNextTask(Duration.ofMillis(50));

            assertTrue(task.isEmpty());
            assertTrue(System.nanoTime() - started >= TimeUnit.MILLISECONDS.toNanos(40));
        }

        @Test
        @DisplayName("should wake a waiting claim when a task is added")
        void shouldWakeWaitingClaim() throws Exception {
            AtomicReference<Optional<Task>> claimed = new AtomicReference<>();
            CountDownLatch done = new CountDownLatch(1);
            Thread waiter = new Thread(() -> {
                claimed.set(queue.getNextTask(Duration.ofSeconds(5)));
                done.countDown();
            });
            waiter.start();

            Thread.sleep(50);
            queue.addTask(item("v1"), Priority.NORMAL);

            assertTrue(done.await(2, TimeUnit.SECONDS));
            assertEquals("v1", claimed.get().orElseThrow().itemId());
        }

        @Test
        @DisplayName("should wake a waiting claim when a slot frees up")
        void shouldWakeWaitingClaimWhenSlotFrees() throws Exception {
            queue.addTask(item("v1"), Priority.NORMAL);
            queue.addTask(item("v2"), Priority.NORMAL);
            queue.getNextTask(Duration.ZERO);

            AtomicReference<Optional<Task>> claimed = new AtomicReference<>();
            CountDownLatch done = new CountDownLatch(1);
            Thread waiter = new Thread(() -> {
                claimed.set(queue.getNextTask(Duration.ofSeconds(5)));
                done.countDown();
            });
            waiter.start();

            Thread.sleep(50);
            queue.markCompleted("v1");

            assertTrue(done.await(2, TimeUnit.SECONDS));
            assertEquals("v2", claimed.get().orElseThrow().itemId());
        }

        @Test
        @DisplayName("should return empty and keep interrupt flag when interrupted")
        void shouldHandleInterrupt() {
            Thread.currentThread().interrupt();
            try {
                assertTrue(queue.getNextTask(Duration.ofSeconds(1)).isEmpty());
                assertTrue(Thread.currentThread().isInterrupted());
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Nested
    @DisplayName("Failure Tests")
    class FailureTests {

        @Test
        @DisplayName("should re-queue with LOW priority until retries are exhausted")
        void shouldRequeueUntilExhausted() {
            queue.addTask(item("C"), Priority.HIGH);

            queue.getNextTask(Duration.ZERO);
            assertEquals(FailureOutcome.RETRY_SCHEDULED, queue.markFailed("C", "e1"));
            Task afterFirst = queue.getTask("C").orElseThrow();
            assertEquals(TaskState.PENDING, queue.getState("C").orElseThrow());
            assertEquals(Priority.LOW, afterFirst.priority());
            assertEquals(1, afterFirst.retryCount());
            assertEquals("e1", afterFirst.lastError());

            queue.getNextTask(Duration.ZERO);
            assertEquals(FailureOutcome.RETRY_SCHEDULED, queue.markFailed("C", "e2"));
            assertEquals(Priority.LOW, queue.getTask("C").orElseThrow().priority());

            queue.getNextTask(Duration.ZERO);
            assertEquals(FailureOutcome.EXHAUSTED, queue.markFailed("C", "e3"));

            assertEquals(TaskState.FAILED, queue.getState("C").orElseThrow());
            Task failed = queue.getFailedTasks().get(0);
            assertEquals(3, failed.retryCount());
            assertEquals("e3", failed.lastError());
            assertEquals(new QueueStatistics(0, 0, 0, 1), queue.getStatistics());
        }

        @Test
        @DisplayName("should fail at once when no retries are allowed")
        void shouldFailAtOnceWithoutRetries() {
            PriorityTaskQueue strict = new PriorityTaskQueue("upload", 1, RetryPolicy.noRetry(), clock);
            strict.addTask(item("v1"), Priority.NORMAL);
            strict.getNextTask(Duration.ZERO);

            assertEquals(FailureOutcome.EXHAUSTED, strict.markFailed("v1", "nope"));
            assertEquals(0, strict.getFailedTasks().get(0).retryCount());
        }

        @Test
        @DisplayName("should stop retrying when the policy budget is used up")
        void shouldFollowPolicyBudget() {
            PriorityTaskQueue single = new PriorityTaskQueue("upload", 1,
                new RetryPolicy(2, List.of()), clock);
            single.addTask(item("v1"), Priority.NORMAL);

            single.getNextTask(Duration.ZERO);
            assertEquals(FailureOutcome.RETRY_SCHEDULED, single.markFailed("v1", "HTTP 503"));
            single.getNextTask(Duration.ZERO);
            assertEquals(FailureOutcome.EXHAUSTED, single.markFailed("v1", "HTTP 503"));
            assertEquals(2, single.getFailedTasks().get(0).retryCount());
        }

        @Test
        @DisplayName("should place a retried task behind fresh work of higher priority")
        void shouldPlaceRetryBehindHigherPriority() {
            PriorityTaskQueue wide = new PriorityTaskQueue("download", 2, RetryPolicy.defaultPolicy(), clock);
            wide.addTask(item("retry-me"), Priority.HIGH);
            wide.getNextTask(Duration.ZERO);
            wide.markFailed("retry-me", "flaky");
            clock.advance(Duration.ofSeconds(1));
            wide.addTask(item("fresh"), Priority.NORMAL);

            assertEquals("fresh", wide.getNextTask(Duration.ZERO).orElseThrow().itemId());
            assertEquals("retry-me", wide.getNextTask(Duration.ZERO).orElseThrow().itemId());
        }

        @Test
        @DisplayName("should hold retried task until backoff expires")
        void shouldHoldRetryUntilBackoffExpires() {
            PriorityTaskQueue backoff = new PriorityTaskQueue("download", 1,
                new RetryPolicy(3, List.of(30, 120)), clock);
            backoff.addTask(item("v1"), Priority.NORMAL);
            backoff.getNextTask(Duration.ZERO);
            backoff.markFailed("v1", "timeout");

            assertTrue(backoff.getNextTask(Duration.ZERO).isEmpty());
            assertEquals(clock.instant().plusSeconds(30), backoff.getTask("v1").orElseThrow().notBefore());

            clock.advance(Duration.ofSeconds(30));

            assertEquals("v1", backoff.getNextTask(Duration.ZERO).orElseThrow().itemId());
        }

        @Test
        @DisplayName("should ignore completing or failing a task that is not processing")
        void shouldIgnoreInvalidTransitions() {
            queue.addTask(item("v1"), Priority.NORMAL);

            assertFalse(queue.markCompleted("v1"));
            assertEquals(FailureOutcome.IGNORED, queue.markFailed("v1", "x"));
            assertFalse(queue.markCompleted("unknown"));
            assertEquals(FailureOutcome.IGNORED, queue.markFailed("unknown", "x"));

            assertEquals(TaskState.PENDING, queue.getState("v1").orElseThrow());
        }

        @Test
        @DisplayName("should clear failed tasks")
        void shouldClearFailed() {
            PriorityTaskQueue strict = new PriorityTaskQueue("upload", 1, RetryPolicy.noRetry(), clock);
            strict.addTask(item("v1"), Priority.NORMAL);
            strict.getNextTask(Duration.ZERO);
            strict.markFailed("v1", "nope");

            assertEquals(1, strict.clearFailed());
            assertTrue(strict.getState("v1").isEmpty());
        }
    }

    @Nested
    @DisplayName("Cancel Tests")
    class CancelTests {

        @Test
        @DisplayName("should cancel from any view")
        void shouldCancelFromAnyView() {
            PriorityTaskQueue wide = new PriorityTaskQueue("download", 5, RetryPolicy.defaultPolicy(), clock);
            wide.addTask(item("pending"), Priority.NORMAL);
            wide.addTask(item("processing"), Priority.HIGH);
            wide.getNextTask(Duration.ZERO);

            assertTrue(wide.cancelTask("pending"));
            assertTrue(wide.cancelTask("processing"));
            assertFalse(wide.cancelTask("processing"));
            assertFalse(wide.cancelTask("never-added"));

            assertEquals(new QueueStatistics(0, 0, 0, 0), wide.getStatistics());
        }

        @Test
        @DisplayName("should free the processing slot on cancel")
        void shouldFreeSlotOnCancel() {
            queue.addTask(item("v1"), Priority.NORMAL);
            queue.addTask(item("v2"), Priority.NORMAL);
            queue.getNextTask(Duration.ZERO);

            queue.cancelTask("v1");

            assertEquals("v2", queue.getNextTask(Duration.ZERO).orElseThrow().itemId());
        }

        @Test
        @DisplayName("should clear all views")
        void shouldClearAll() {
            queue.addTask(item("v1"), Priority.NORMAL);
            queue.addTask(item("v2"), Priority.NORMAL);
            queue.getNextTask(Duration.ZERO);

            queue.clearAll();

            assertEquals(0, queue.getStatistics().total());
        }
    }

    @Nested
    @DisplayName("Concurrency Tests")
    class ConcurrencyTests {

        @Test
        @DisplayName("should never exceed the limit nor hand a task to two claimers")
        void shouldKeepLimitAndExclusiveClaims() throws Exception {
            int limit = 3;
            int items = 200;
            int threads = 8;
            PriorityTaskQueue shared = new PriorityTaskQueue("download", limit, RetryPolicy.defaultPolicy(),
                java.time.Clock.systemUTC());
            for (int i = 0; i < items; i++) {
                shared.addTask(item("v" + i), i % 3 == 0 ? Priority.HIGH : Priority.NORMAL);
            }

            Set<String> seen = ConcurrentHashMap.newKeySet();
            AtomicInteger duplicates = new AtomicInteger();
            AtomicInteger overLimit = new AtomicInteger();
            AtomicInteger completed = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch done = new CountDownLatch(threads);

            for (int t = 0; t < threads; t++) {
                executor.execute(() -> {
                    try {
                        while (completed.get() < items) {
                            Optional<Task> task = shared.getNextTask(Duration.ofMillis(20));
                            if (task.isEmpty()) {
                                continue;
                            }
                            if (shared.getStatistics().processing() > limit) {
                                overLimit.incrementAndGet();
                            }
                            if (!seen.add(task.get().itemId())) {
                                duplicates.incrementAndGet();
                            }
                            if (shared.markCompleted(task.get().itemId())) {
                                completed.incrementAndGet();
                            }
                        }
                    } finally {
                        done.countDown();
                    }
                });
            }

            assertTrue(done.await(20, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(0, duplicates.get());
            assertEquals(0, overLimit.get());
            assertEquals(items, completed.get());
            QueueStatistics stats = shared.getStatistics();
            assertEquals(new QueueStatistics(0, 0, items, 0), stats);
        }
    }
}
