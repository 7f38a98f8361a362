package com.ivamare.pipeline.operation;

import com.ivamare.pipeline.exception.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal handed to a running operation.
 *
 * <p>Operations either poll {@link #isCancellationRequested()} between chunks of work or
 * register a callback with {@link #onCancel(Runnable)} to abort a blocking call.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final String itemId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public CancellationToken(String itemId) {
        this.itemId = itemId;
    }

    public String itemId() {
        return itemId;
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Throw if cancellation was requested.
     *
     * @throws OperationCancelledException if cancelled
     */
    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new OperationCancelledException(itemId);
        }
    }

    /**
     * Register a callback run once on cancellation, immediately if already cancelled.
     *
     * @param callback Callback to run on the cancelling thread
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runCallback(callback);
        }
    }

    /**
     * Signal cancellation. Only the first call runs the callbacks.
     *
     * @return true if this call flipped the token
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runCallback(callback);
            }
        }
        return true;
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed for item {}: {}", itemId, e.getMessage(), e);
        }
    }
}
