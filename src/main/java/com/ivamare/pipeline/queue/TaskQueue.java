package com.ivamare.pipeline.queue;

import com.ivamare.pipeline.model.Priority;
import com.ivamare.pipeline.model.QueueStatistics;
import com.ivamare.pipeline.model.Task;
import com.ivamare.pipeline.model.TaskState;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Thread-safe store of the tasks of one pipeline stage.
 *
 * <p>Every item id is in at most one of the pending, processing, completed and failed
 * views. Moves between views are atomic. State errors (completing or failing a task that
 * is not processing) are logged and reported through return values, never thrown.
 */
public interface TaskQueue {

    /**
     * Add a task unless its item id is already known to this queue.
     *
     * @param payload Item payload, must contain a non-blank {@code item_id}
     * @param priority Task priority
     * @return true if added, false for a duplicate
     * @throws com.ivamare.pipeline.exception.InvalidTaskException if item_id is missing
     */
    boolean tryAddTask(Map<String, Object> payload, Priority priority);

    /**
     * Add a task unless its item id is already known to this queue.
     *
     * @param payload Item payload, must contain a non-blank {@code item_id}
     * @param priority Task priority
     * @return the item id
     * @throws com.ivamare.pipeline.exception.InvalidTaskException if item_id is missing
     */
    String addTask(Map<String, Object> payload, Priority priority);

    /**
     * Claim the highest priority eligible task if a processing slot is free.
     *
     * @param timeout How long to wait for a task and a free slot (zero = don't wait)
     * @return the claimed task, now in processing
     */
    Optional<Task> getNextTask(Duration timeout);

    /**
     * Claim the highest priority eligible task, leaving pending the items the caller
     * cannot take yet.
     *
     * @param timeout How long to wait for a task and a free slot (zero = don't wait)
     * @param busy Item ids to pass over, e.g. items a worker still holds after a timeout
     * @return the claimed task, now in processing
     */
    Optional<Task> getNextTask(Duration timeout, Predicate<String> busy);

    /**
     * Move a processing task to completed.
     *
     * @param itemId Item id
     * @return false if the task was not processing
     */
    boolean markCompleted(String itemId);

    /**
     * Record a failed attempt of a processing task.
     *
     * @param itemId Item id
     * @param error Error of the attempt
     * @return what happened to the task
     */
    FailureOutcome markFailed(String itemId, String error);

    /**
     * Remove a task from whichever view holds it.
     *
     * @param itemId Item id
     * @return true if the task was present
     */
    boolean cancelTask(String itemId);

    Optional<Task> getTask(String itemId);

    Optional<TaskState> getState(String itemId);

    QueueStatistics getStatistics();

    /**
     * Get the item ids currently processing.
     *
     * @return immutable snapshot
     */
    List<String> getProcessingTasks();

    List<Task> getFailedTasks();

    /**
     * Drop completed tasks so their ids can be queued again.
     *
     * @return number of removed tasks
     */
    int clearCompleted();

    /**
     * Drop failed tasks so their ids can be queued again.
     *
     * @return number of removed tasks
     */
    int clearFailed();

    void clearAll();

    int concurrencyLimit();

    String name();
}
