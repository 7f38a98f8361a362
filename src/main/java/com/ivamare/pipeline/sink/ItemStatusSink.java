package com.ivamare.pipeline.sink;

import com.ivamare.pipeline.model.ItemStatus;

import java.util.List;
import java.util.Map;

/**
 * Receives item status transitions for persistence.
 */
public interface ItemStatusSink {

    /**
     * Record a status transition.
     *
     * @param itemId Item id
     * @param status New status
     * @param details Transition details (payload, artifact_ref, published_ref, error)
     */
    void record(String itemId, ItemStatus status, Map<String, Object> details);

    /**
     * Load items whose pipeline work did not finish, oldest first.
     *
     * @return unfinished items, empty by default
     */
    default List<RecoveredItem> loadUnfinishedItems() {
        return List.of();
    }
}
