package com.ivamare.pipeline.event;

import com.ivamare.pipeline.model.FailureKind;
import com.ivamare.pipeline.model.ItemStatus;
import com.ivamare.pipeline.model.ProgressInfo;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload keys and factories for the event families published by the pipeline.
 */
public final class EventData {

    public static final String ITEM_ID = "item_id";
    public static final String ERROR = "error";
    public static final String FAILURE_KIND = "failure_kind";
    public static final String RETRY_COUNT = "retry_count";
    public static final String MAX_RETRIES = "max_retries";
    public static final String TERMINAL = "terminal";
    public static final String ARTIFACT_REF = "artifact_ref";
    public static final String PUBLISHED_REF = "published_ref";
    public static final String ATTRIBUTES = "attributes";
    public static final String PAYLOAD = "payload";
    public static final String PROGRESS = "progress";
    public static final String PRIORITY = "priority";
    public static final String STAGE = "stage";
    public static final String STATUS = "status";
    public static final String COMPONENT = "component";
    public static final String FAILED_EVENT_TYPE = "failed_event_type";

    private EventData() {
        // Constants class - no instantiation
    }

    public static Map<String, Object> itemOnly(String itemId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(ITEM_ID, itemId);
        return data;
    }

    public static Map<String, Object> progress(String itemId, ProgressInfo progress) {
        Map<String, Object> data = itemOnly(itemId);
        data.put(PROGRESS, progress);
        return data;
    }

    /**
     * Payload of a *_COMPLETED event.
     *
     * @param itemId Item id
     * @param refKey {@link #ARTIFACT_REF} for downloads, {@link #PUBLISHED_REF} for uploads
     * @param ref Reference returned by the operation
     * @param attributes Extra attributes returned by the operation
     * @return mutable payload map
     */
    public static Map<String, Object> completed(String itemId, String refKey, String ref,
                                                Map<String, Object> attributes) {
        Map<String, Object> data = itemOnly(itemId);
        data.put(refKey, ref);
        data.put(ATTRIBUTES, attributes != null ? attributes : Map.of());
        return data;
    }

    public static Map<String, Object> failed(String itemId, String error, FailureKind kind,
                                             int retryCount, int maxRetries, boolean terminal) {
        Map<String, Object> data = itemOnly(itemId);
        data.put(ERROR, error);
        data.put(FAILURE_KIND, kind.name());
        data.put(RETRY_COUNT, retryCount);
        data.put(MAX_RETRIES, maxRetries);
        data.put(TERMINAL, terminal);
        return data;
    }

    public static Map<String, Object> error(String component, String error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(COMPONENT, component);
        data.put(ERROR, error);
        return data;
    }

    public static Map<String, Object> statusChanged(String itemId, ItemStatus status) {
        Map<String, Object> data = itemOnly(itemId);
        data.put(STATUS, status.getValue());
        return data;
    }
}
