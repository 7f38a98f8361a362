package com.ivamare.pipeline.queue.impl;

import com.ivamare.pipeline.event.EventData;
import com.ivamare.pipeline.exception.InvalidTaskException;
import com.ivamare.pipeline.model.Priority;
import com.ivamare.pipeline.model.QueueStatistics;
import com.ivamare.pipeline.model.Task;
import com.ivamare.pipeline.model.TaskState;
import com.ivamare.pipeline.policy.RetryPolicy;
import com.ivamare.pipeline.queue.FailureOutcome;
import com.ivamare.pipeline.queue.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * In-memory priority queue with in-flight tracking and retry bookkeeping.
 *
 * <p>One lock guards all four views. {@link #getNextTask(Duration)} is the only blocking
 * call; it waits on a condition that every state change signals.
 */
public class PriorityTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(PriorityTaskQueue.class);

    private final String name;
    private final int concurrencyLimit;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final TreeSet<Task> pending = new TreeSet<>(Task.CLAIM_ORDER);
    private final Map<String, Task> pendingById = new HashMap<>();
    private final Map<String, Task> processing = new LinkedHashMap<>();
    private final Map<String, Task> completed = new LinkedHashMap<>();
    private final Map<String, Task> failed = new LinkedHashMap<>();
    private long sequence;

    public PriorityTaskQueue(String name, int concurrencyLimit) {
        this(name, concurrencyLimit, RetryPolicy.defaultPolicy(), Clock.systemUTC());
    }

    /**
     * Creates a queue.
     *
     * @param name Queue name used in logs
     * @param concurrencyLimit Maximum number of processing tasks
     * @param retryPolicy Retry budget and backoff for failed attempts
     * @param clock Clock for enqueue timestamps and backoff
     */
    public PriorityTaskQueue(String name, int concurrencyLimit, RetryPolicy retryPolicy, Clock clock) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1");
        }
        this.name = name;
        this.concurrencyLimit = concurrencyLimit;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public boolean tryAddTask(Map<String, Object> payload, Priority priority) {
        String itemId = requireItemId(payload);
        Priority effectivePriority = priority != null ? priority : Priority.NORMAL;

        lock.lock();
        try {
            TaskState existing = stateOf(itemId);
            if (existing != null) {
                log.debug("Queue {} ignoring duplicate item {} (currently {})", name, itemId, existing);
                return false;
            }

            Task task = new Task(itemId, payload, effectivePriority, clock.instant(), sequence++,
                0, retryPolicy.maxRetries(), null, null);
            pending.add(task);
            pendingById.put(itemId, task);
            changed.signalAll();

            log.debug("Queue {} added item {} with priority {}", name, itemId, effectivePriority);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String addTask(Map<String, Object> payload, Priority priority) {
        tryAddTask(payload, priority);
        return requireItemId(payload);
    }

    @Override
    public Optional<Task> getNextTask(Duration timeout) {
        return getNextTask(timeout, itemId -> false);
    }

    @Override
    public Optional<Task> getNextTask(Duration timeout, Predicate<String> busy) {
        long remainingNanos = timeout != null ? Math.max(0, timeout.toNanos()) : 0;

        lock.lock();
        try {
            while (true) {
                Instant now = clock.instant();
                if (processing.size() < concurrencyLimit) {
                    Task next = firstEligible(now, busy);
                    if (next != null) {
                        pending.remove(next);
                        pendingById.remove(next.itemId());
                        processing.put(next.itemId(), next);
                        log.debug("Queue {} claimed item {} (priority={}, retry={})",
                            name, next.itemId(), next.priority(), next.retryCount());
                        return Optional.of(next);
                    }
                }

                if (remainingNanos <= 0) {
                    return Optional.empty();
                }

                long waitNanos = remainingNanos;
                Instant wakeUp = processing.size() < concurrencyLimit ? earliestBackoffExpiry(now) : null;
                if (wakeUp != null) {
                    waitNanos = Math.min(waitNanos, Math.max(1, Duration.between(now, wakeUp).toNanos()));
                }
                long left = changed.awaitNanos(waitNanos);
                remainingNanos -= (waitNanos - Math.max(0, left));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean markCompleted(String itemId) {
        lock.lock();
        try {
            Task task = processing.remove(itemId);
            if (task == null) {
                log.warn("Queue {} cannot complete item {}: not processing (state={})",
                    name, itemId, stateOf(itemId));
                return false;
            }
            completed.put(itemId, task);
            changed.signalAll();
            log.debug("Queue {} completed item {}", name, itemId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public FailureOutcome markFailed(String itemId, String error) {
        lock.lock();
        try {
            Task task = processing.remove(itemId);
            if (task == null) {
                log.warn("Queue {} cannot fail item {}: not processing (state={})",
                    name, itemId, stateOf(itemId));
                return FailureOutcome.IGNORED;
            }

            FailureOutcome outcome;
            int retryCount = task.canRetry() ? task.retryCount() + 1 : task.retryCount();
            if (retryPolicy.shouldRetry(retryCount)) {
                Instant now = clock.instant();
                Duration backoff = retryPolicy.getBackoff(retryCount);
                Instant notBefore = backoff.isZero() ? null : now.plus(backoff);
                Task retry = task.withRetry(now, sequence++, notBefore, error);
                pending.add(retry);
                pendingById.put(itemId, retry);
                outcome = FailureOutcome.RETRY_SCHEDULED;
                log.info("Queue {} re-queued item {} (retry {}/{}, backoff={}s): {}",
                    name, itemId, retryCount, task.maxRetries(), backoff.toSeconds(), error);
            } else {
                failed.put(itemId, task.withFailure(retryCount, error));
                outcome = FailureOutcome.EXHAUSTED;
                log.warn("Queue {} failed item {} after {} retries: {}", name, itemId, retryCount, error);
            }

            changed.signalAll();
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean cancelTask(String itemId) {
        lock.lock();
        try {
            Task task = pendingById.remove(itemId);
            if (task != null) {
                pending.remove(task);
            } else {
                task = processing.remove(itemId);
            }
            if (task == null) {
                task = completed.remove(itemId);
            }
            if (task == null) {
                task = failed.remove(itemId);
            }

            if (task == null) {
                log.debug("Queue {} has no item {} to cancel", name, itemId);
                return false;
            }
            changed.signalAll();
            log.info("Queue {} cancelled item {}", name, itemId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Task> getTask(String itemId) {
        lock.lock();
        try {
            Task task = pendingById.get(itemId);
            if (task == null) {
                task = processing.get(itemId);
            }
            if (task == null) {
                task = completed.get(itemId);
            }
            if (task == null) {
                task = failed.get(itemId);
            }
            return Optional.ofNullable(task);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<TaskState> getState(String itemId) {
        lock.lock();
        try {
            return Optional.ofNullable(stateOf(itemId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueStatistics getStatistics() {
        lock.lock();
        try {
            return new QueueStatistics(pending.size(), processing.size(), completed.size(), failed.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> getProcessingTasks() {
        lock.lock();
        try {
            return List.copyOf(processing.keySet());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Task> getFailedTasks() {
        lock.lock();
        try {
            return List.copyOf(failed.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int clearCompleted() {
        lock.lock();
        try {
            int count = completed.size();
            completed.clear();
            log.debug("Queue {} cleared {} completed items", name, count);
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int clearFailed() {
        lock.lock();
        try {
            int count = failed.size();
            failed.clear();
            log.debug("Queue {} cleared {} failed items", name, count);
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clearAll() {
        lock.lock();
        try {
            pending.clear();
            pendingById.clear();
            processing.clear();
            completed.clear();
            failed.clear();
            changed.signalAll();
            log.info("Queue {} cleared", name);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int concurrencyLimit() {
        return concurrencyLimit;
    }

    @Override
    public String name() {
        return name;
    }

    // --- Helpers (caller holds the lock) ---

    private TaskState stateOf(String itemId) {
        if (pendingById.containsKey(itemId)) {
            return TaskState.PENDING;
        }
        if (processing.containsKey(itemId)) {
            return TaskState.PROCESSING;
        }
        if (completed.containsKey(itemId)) {
            return TaskState.COMPLETED;
        }
        if (failed.containsKey(itemId)) {
            return TaskState.FAILED;
        }
        return null;
    }

    private Task firstEligible(Instant now, Predicate<String> busy) {
        for (Task task : pending) {
            if (task.isEligible(now) && !busy.test(task.itemId())) {
                return task;
            }
        }
        return null;
    }

    private Instant earliestBackoffExpiry(Instant now) {
        Instant earliest = null;
        for (Task task : pending) {
            Instant notBefore = task.notBefore();
            if (notBefore != null && notBefore.isAfter(now)
                    && (earliest == null || notBefore.isBefore(earliest))) {
                earliest = notBefore;
            }
        }
        return earliest;
    }

    private static String requireItemId(Map<String, Object> payload) {
        if (payload == null) {
            throw new InvalidTaskException("Task payload is required");
        }
        Object itemId = payload.get(EventData.ITEM_ID);
        if (itemId == null || itemId.toString().isBlank()) {
            throw new InvalidTaskException("Task payload has no " + EventData.ITEM_ID);
        }
        return itemId.toString();
    }
}
