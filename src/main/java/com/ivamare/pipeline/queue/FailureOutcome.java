package com.ivamare.pipeline.queue;

/**
 * What {@link TaskQueue#markFailed(String, String)} did with the task.
 */
public enum FailureOutcome {
    /** Task went back to pending with LOW priority. */
    RETRY_SCHEDULED,
    /** Retry budget used up, task is in the failed view. */
    EXHAUSTED,
    /** Task was not processing; nothing changed. */
    IGNORED;

    public boolean isTerminal() {
        return this == EXHAUSTED;
    }
}
