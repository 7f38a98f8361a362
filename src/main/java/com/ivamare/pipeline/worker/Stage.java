package com.ivamare.pipeline.worker;

import com.ivamare.pipeline.event.EventData;
import com.ivamare.pipeline.event.EventType;

/**
 * Pipeline stage and the events its workers publish.
 */
public enum Stage {
    DOWNLOAD("download", EventData.ARTIFACT_REF,
        EventType.DOWNLOAD_STARTED, EventType.DOWNLOAD_PROGRESS, EventType.DOWNLOAD_COMPLETED,
        EventType.DOWNLOAD_FAILED, EventType.DOWNLOAD_CANCELLED),
    UPLOAD("upload", EventData.PUBLISHED_REF,
        EventType.UPLOAD_STARTED, EventType.UPLOAD_PROGRESS, EventType.UPLOAD_COMPLETED,
        EventType.UPLOAD_FAILED, EventType.UPLOAD_CANCELLED);

    private final String value;
    private final String refKey;
    private final EventType started;
    private final EventType progress;
    private final EventType completed;
    private final EventType failed;
    private final EventType cancelled;

    Stage(String value, String refKey, EventType started, EventType progress, EventType completed,
          EventType failed, EventType cancelled) {
        this.value = value;
        this.refKey = refKey;
        this.started = started;
        this.progress = progress;
        this.completed = completed;
        this.failed = failed;
        this.cancelled = cancelled;
    }

    public String getValue() {
        return value;
    }

    /**
     * Payload key under which the completed event carries the operation's reference.
     */
    public String refKey() {
        return refKey;
    }

    /**
     * Event source name of this stage's workers.
     */
    public String source() {
        return value + "_worker";
    }

    public EventType started() {
        return started;
    }

    public EventType progress() {
        return progress;
    }

    public EventType completed() {
        return completed;
    }

    public EventType failed() {
        return failed;
    }

    public EventType cancelled() {
        return cancelled;
    }
}
