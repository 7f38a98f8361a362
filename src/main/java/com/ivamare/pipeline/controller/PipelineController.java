package com.ivamare.pipeline.controller;

import com.ivamare.pipeline.event.Event;
import com.ivamare.pipeline.event.EventBus;
import com.ivamare.pipeline.event.EventData;
import com.ivamare.pipeline.event.EventListener;
import com.ivamare.pipeline.event.EventType;
import com.ivamare.pipeline.event.Subscription;
import com.ivamare.pipeline.exception.InvalidOperationException;
import com.ivamare.pipeline.exception.InvalidTaskException;
import com.ivamare.pipeline.exception.PipelineException;
import com.ivamare.pipeline.model.ItemStatus;
import com.ivamare.pipeline.model.PipelineStatistics;
import com.ivamare.pipeline.model.Priority;
import com.ivamare.pipeline.model.Task;
import com.ivamare.pipeline.queue.TaskQueue;
import com.ivamare.pipeline.ratelimit.UploadQuota;
import com.ivamare.pipeline.sink.ItemStatusSink;
import com.ivamare.pipeline.sink.RecoveredItem;
import com.ivamare.pipeline.worker.Stage;
import com.ivamare.pipeline.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires detection, the download stage and the upload stage together.
 *
 * <p>Detected items enter the download queue with HIGH priority. A periodic tick claims
 * tasks while the stage pools have free workers. A completed download is queued for
 * upload; terminal failures are reported once as {@link EventType#ERROR_OCCURRED}.
 * Every status transition is forwarded to the {@link ItemStatusSink} and published as
 * {@link EventType#STATUS_CHANGED}.
 */
public class PipelineController implements ItemDetectionListener {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    static final String SOURCE = "pipeline_controller";

    private final EventBus eventBus;
    private final TaskQueue downloadQueue;
    private final WorkerPool downloadPool;
    private final TaskQueue uploadQueue;
    private final WorkerPool uploadPool;
    private final ItemStatusSink statusSink;
    private final UploadQuota uploadQuota;
    private final Duration tickInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean accepting = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile PipelineStatistics lastStatistics;
    private volatile ScheduledExecutorService ticker;

    /**
     * Creates a controller.
     *
     * @param eventBus Event bus shared by all components
     * @param downloadQueue Download stage queue
     * @param downloadPool Download stage workers, settling on downloadQueue
     * @param uploadQueue Upload stage queue
     * @param uploadPool Upload stage workers, settling on uploadQueue
     * @param statusSink Persistence sink
     * @param uploadQuota Upload rate limit, null for unlimited
     * @param tickInterval Interval between dispatch ticks
     */
    public PipelineController(
            EventBus eventBus,
            TaskQueue downloadQueue,
            WorkerPool downloadPool,
            TaskQueue uploadQueue,
            WorkerPool uploadPool,
            ItemStatusSink statusSink,
            UploadQuota uploadQuota,
            Duration tickInterval) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.downloadQueue = Objects.requireNonNull(downloadQueue, "downloadQueue");
        this.downloadPool = Objects.requireNonNull(downloadPool, "downloadPool");
        this.uploadQueue = Objects.requireNonNull(uploadQueue, "uploadQueue");
        this.uploadPool = Objects.requireNonNull(uploadPool, "uploadPool");
        this.statusSink = Objects.requireNonNull(statusSink, "statusSink");
        this.uploadQuota = uploadQuota != null ? uploadQuota : UploadQuota.unlimited();
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
    }

    /**
     * Subscribe to pipeline events, restore unfinished items and start ticking.
     */
    public void start() {
        if (stopped.get()) {
            throw new InvalidOperationException("Pipeline controller was stopped and cannot be restarted");
        }
        if (running.getAndSet(true)) {
            log.warn("Pipeline controller already running");
            return;
        }

        subscribe(EventType.VIDEO_DETECTED, this::onVideoDetected);
        subscribe(EventType.DOWNLOAD_STARTED, e -> transition(e.itemId(), ItemStatus.DOWNLOADING, Map.of()));
        subscribe(EventType.DOWNLOAD_COMPLETED, this::onDownloadCompleted);
        subscribe(EventType.DOWNLOAD_FAILED, e -> onStageFailed(Stage.DOWNLOAD, e));
        subscribe(EventType.DOWNLOAD_CANCELLED, e -> transition(e.itemId(), ItemStatus.CANCELLED, Map.of()));
        subscribe(EventType.UPLOAD_STARTED, e -> transition(e.itemId(), ItemStatus.UPLOADING, Map.of()));
        subscribe(EventType.UPLOAD_COMPLETED, this::onUploadCompleted);
        subscribe(EventType.UPLOAD_FAILED, e -> onStageFailed(Stage.UPLOAD, e));
        subscribe(EventType.UPLOAD_CANCELLED, e -> transition(e.itemId(), ItemStatus.CANCELLED, Map.of()));

        accepting.set(true);
        restoreUnfinishedItems();

        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pipeline-tick");
            t.setDaemon(true);
            return t;
        });
        ticker.scheduleWithFixedDelay(this::tick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);

        log.info("Pipeline controller started, tick={}ms, downloads={}, uploads={}",
            tickInterval.toMillis(), downloadPool.concurrency(), uploadPool.concurrency());
        eventBus.publish(EventType.APP_STARTED, Map.of(), SOURCE);
    }

    @Override
    public void onItemDetected(Map<String, Object> payload) {
        if (!accepting.get()) {
            log.debug("Pipeline not accepting detections, dropping {}", payload);
            return;
        }
        eventBus.publish(EventType.VIDEO_DETECTED, payload, "detector");
    }

    /**
     * One dispatch round: start tasks on every free worker of both stages.
     */
    void tick() {
        try {
            if (!accepting.get()) {
                return;
            }
            dispatchAvailable(downloadQueue, downloadPool, false);
            dispatchAvailable(uploadQueue, uploadPool, true);
            publishStatisticsIfChanged();
        } catch (Exception e) {
            // An exception would cancel the fixed-delay schedule
            log.error("Pipeline tick failed", e);
        }
    }

    /**
     * Cancel an item in whichever stage holds it.
     *
     * @param itemId Item id
     * @return true if anything was cancelled
     */
    public boolean cancelItem(String itemId) {
        if (downloadPool.cancel(itemId) || uploadPool.cancel(itemId)) {
            return true;
        }
        boolean removed = downloadQueue.cancelTask(itemId) | uploadQueue.cancelTask(itemId);
        if (!removed) {
            return false;
        }
        // A dispatch that raced the removal is cancelled through its pool, which reports it
        if (!downloadPool.cancel(itemId) && !uploadPool.cancel(itemId)) {
            transition(itemId, ItemStatus.CANCELLED, Map.of());
        }
        return true;
    }

    public PipelineStatistics getStatistics() {
        return new PipelineStatistics(
            downloadQueue.getStatistics(),
            uploadQueue.getStatistics(),
            downloadPool.inFlightCount(),
            uploadPool.inFlightCount()
        );
    }

    public boolean isRunning() {
        return running.get() && accepting.get();
    }

    /**
     * Stop accepting work, cancel in-flight workers and wait for them.
     *
     * @param timeout Maximum wait for in-flight workers
     * @return future that completes when both pools stopped
     */
    public CompletableFuture<Void> stop(Duration timeout) {
        if (stopped.getAndSet(true)) {
            return CompletableFuture.completedFuture(null);
        }
        accepting.set(false);

        log.info("Stopping pipeline controller, {} downloads and {} uploads in flight",
            downloadPool.inFlightCount(), uploadPool.inFlightCount());

        if (ticker != null) {
            ticker.shutdownNow();
        }
        eventBus.publish(EventType.APP_SHUTDOWN, Map.of(), SOURCE);

        return CompletableFuture.allOf(downloadPool.shutdown(timeout), uploadPool.shutdown(timeout))
            .whenComplete((ignored, error) -> {
                subscriptions.forEach(eventBus::unsubscribe);
                subscriptions.clear();
                running.set(false);
                if (error != null) {
                    log.warn("Pipeline controller stopped with error: {}", error.getMessage());
                } else {
                    log.info("Pipeline controller stopped");
                }
            });
    }

    // --- Event Handling ---

    private void onVideoDetected(Event event) {
        if (!accepting.get()) {
            return;
        }

        String itemId = event.itemId();
        if (itemId != null && downloadQueue.getState(itemId).isPresent()) {
            log.debug("Item {} already detected", itemId);
            return;
        }

        // Recorded before the task becomes claimable so it never follows a later status
        if (itemId != null && !itemId.isBlank()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put(EventData.PAYLOAD, event.data());
            transition(itemId, ItemStatus.DETECTED, details);
        }

        boolean added;
        try {
            added = downloadQueue.tryAddTask(event.data(), Priority.HIGH);
        } catch (InvalidTaskException e) {
            log.warn("Rejected detected item: {}", e.getMessage());
            eventBus.publish(EventType.WARNING_OCCURRED, EventData.error(SOURCE, e.getMessage()), SOURCE);
            return;
        }

        if (!added) {
            return;
        }

        Map<String, Object> queued = EventData.itemOnly(itemId);
        queued.put(EventData.STAGE, Stage.DOWNLOAD.getValue());
        queued.put(EventData.PRIORITY, Priority.HIGH.name());
        eventBus.publish(EventType.VIDEO_QUEUED, queued, SOURCE);
    }

    private void onDownloadCompleted(Event event) {
        String itemId = event.itemId();
        String artifactRef = event.getString(EventData.ARTIFACT_REF);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put(EventData.ARTIFACT_REF, artifactRef);
        transition(itemId, ItemStatus.DOWNLOADED, details);

        Map<String, Object> uploadPayload = new LinkedHashMap<>();
        downloadQueue.getTask(itemId).map(Task::payload).ifPresent(uploadPayload::putAll);
        if (event.data().get(EventData.ATTRIBUTES) instanceof Map<?, ?> attributes) {
            attributes.forEach((key, value) -> uploadPayload.put(String.valueOf(key), value));
        }
        uploadPayload.put(EventData.ITEM_ID, itemId);
        uploadPayload.put(EventData.ARTIFACT_REF, artifactRef);

        if (uploadQueue.tryAddTask(uploadPayload, Priority.HIGH)) {
            Map<String, Object> queued = EventData.itemOnly(itemId);
            queued.put(EventData.STAGE, Stage.UPLOAD.getValue());
            queued.put(EventData.PRIORITY, Priority.HIGH.name());
            eventBus.publish(EventType.VIDEO_QUEUED, queued, SOURCE);
        } else {
            log.warn("Item {} already known to the upload queue, not re-queued", itemId);
        }
    }

    private void onUploadCompleted(Event event) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(EventData.PUBLISHED_REF, event.getString(EventData.PUBLISHED_REF));
        transition(event.itemId(), ItemStatus.COMPLETED, details);
    }

    private void onStageFailed(Stage stage, Event event) {
        String itemId = event.itemId();
        if (!event.getBoolean(EventData.TERMINAL)) {
            log.debug("{} of item {} will be retried", stage.getValue(), itemId);
            return;
        }

        reportTerminalFailure(stage, itemId, event.getString(EventData.ERROR),
            event.getInt(EventData.RETRY_COUNT, 0));
    }

    private void reportTerminalFailure(Stage stage, String itemId, String error, int retryCount) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(EventData.ERROR, error);
        details.put(EventData.STAGE, stage.getValue());
        transition(itemId, ItemStatus.FAILED, details);

        Map<String, Object> data = EventData.error(SOURCE, error);
        data.put(EventData.ITEM_ID, itemId);
        data.put(EventData.STAGE, stage.getValue());
        data.put(EventData.RETRY_COUNT, retryCount);
        eventBus.publish(EventType.ERROR_OCCURRED, data, SOURCE);
    }

    // --- Dispatch ---

    private void dispatchAvailable(TaskQueue queue, WorkerPool pool, boolean quotaLimited) {
        while (accepting.get() && pool.availableSlots() > 0) {
            if (quotaLimited && !uploadQuota.tryAcquire()) {
                return;
            }

            Optional<Task> claimed = queue.getNextTask(Duration.ZERO, pool::isInFlight);
            if (claimed.isEmpty()) {
                if (quotaLimited) {
                    uploadQuota.release();
                }
                return;
            }

            Task task = claimed.get();
            try {
                pool.dispatch(task);
            } catch (PipelineException e) {
                log.error("Could not dispatch {} of item {}: {}", pool.stage().getValue(), task.itemId(), e.getMessage());
                if (queue.markFailed(task.itemId(), e.getMessage()).isTerminal()) {
                    int retryCount = queue.getTask(task.itemId()).map(Task::retryCount).orElse(task.retryCount());
                    reportTerminalFailure(pool.stage(), task.itemId(), e.getMessage(), retryCount);
                }
                return;
            }
        }
    }

    private void publishStatisticsIfChanged() {
        PipelineStatistics statistics = getStatistics();
        if (statistics.equals(lastStatistics)) {
            return;
        }
        lastStatistics = statistics;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("downloads", statistics.downloads());
        data.put("uploads", statistics.uploads());
        data.put("active_downloads", statistics.activeDownloads());
        data.put("active_uploads", statistics.activeUploads());
        eventBus.publish(EventType.STATISTICS_UPDATED, data, SOURCE);
    }

    // --- Persistence ---

    private void restoreUnfinishedItems() {
        List<RecoveredItem> items;
        try {
            items = statusSink.loadUnfinishedItems();
        } catch (Exception e) {
            log.error("Could not load unfinished items: {}", e.getMessage(), e);
            eventBus.publish(EventType.WARNING_OCCURRED,
                EventData.error(SOURCE, "Could not restore unfinished items: " + e.getMessage()), SOURCE);
            return;
        }

        int restored = 0;
        for (RecoveredItem item : items) {
            Map<String, Object> payload = new LinkedHashMap<>(item.payload());
            payload.put(EventData.ITEM_ID, item.itemId());
            try {
                boolean added;
                if (item.hasArtifact()) {
                    payload.put(EventData.ARTIFACT_REF, item.artifactRef());
                    added = uploadQueue.tryAddTask(payload, Priority.NORMAL);
                } else {
                    added = downloadQueue.tryAddTask(payload, Priority.NORMAL);
                }
                if (added) {
                    restored++;
                }
            } catch (InvalidTaskException e) {
                log.warn("Skipping unrestorable item: {}", e.getMessage());
            }
        }

        if (restored > 0) {
            log.info("Restored {} unfinished items", restored);
        }
    }

    private void transition(String itemId, ItemStatus status, Map<String, Object> details) {
        try {
            statusSink.record(itemId, status, details);
        } catch (Exception e) {
            log.warn("Status sink failed recording item {} as {}: {}", itemId, status, e.getMessage(), e);
            Map<String, Object> warning = EventData.error(SOURCE, "Status sink failed: " + e.getMessage());
            warning.put(EventData.ITEM_ID, itemId);
            eventBus.publish(EventType.WARNING_OCCURRED, warning, SOURCE);
        }
        eventBus.publish(EventType.STATUS_CHANGED, EventData.statusChanged(itemId, status), SOURCE);
    }

    private void subscribe(EventType type, EventListener listener) {
        subscriptions.add(eventBus.subscribe(type, listener));
    }
}
