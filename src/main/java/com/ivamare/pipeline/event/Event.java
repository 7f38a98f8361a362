package com.ivamare.pipeline.event;

import com.ivamare.pipeline.model.ProgressInfo;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable notification published on the {@link EventBus}.
 *
 * <p>The payload map is copied on construction. Unlike {@link Map#copyOf(Map)} the copy
 * tolerates null values, since detector payloads commonly carry optional fields.
 *
 * @param type Event type
 * @param timestamp When the event was created
 * @param data Event payload, keys listed in {@link EventData}
 * @param source Name of the publishing component
 */
public record Event(
    EventType type,
    Instant timestamp,
    Map<String, Object> data,
    String source
) {
    public Event {
        Objects.requireNonNull(type, "type");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        if (source == null || source.isBlank()) {
            source = "unknown";
        }
    }

    /**
     * Get the item this event refers to.
     *
     * @return item id or null if the event is not item related
     */
    public String itemId() {
        return getString(EventData.ITEM_ID);
    }

    public String getString(String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    public int getInt(String key, int defaultValue) {
        Object value = data.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public boolean getBoolean(String key) {
        Object value = data.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    /**
     * Get the progress report of a *_PROGRESS event.
     *
     * @return progress if present
     */
    public Optional<ProgressInfo> progress() {
        Object value = data.get(EventData.PROGRESS);
        if (value instanceof ProgressInfo info) {
            return Optional.of(info);
        }
        return Optional.empty();
    }
}
