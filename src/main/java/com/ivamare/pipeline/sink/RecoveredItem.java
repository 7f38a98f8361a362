package com.ivamare.pipeline.sink;

import com.ivamare.pipeline.model.ItemStatus;

import java.util.Map;

/**
 * An item with unfinished pipeline work found at startup.
 *
 * @param itemId Item id
 * @param status Last recorded status
 * @param payload Item payload as detected
 * @param artifactRef Download artifact, null if the download never completed
 */
public record RecoveredItem(
    String itemId,
    ItemStatus status,
    Map<String, Object> payload,
    String artifactRef
) {
    /**
     * Whether the item can resume at the upload stage.
     */
    public boolean hasArtifact() {
        return artifactRef != null && !artifactRef.isBlank()
            && (status == ItemStatus.DOWNLOADED || status == ItemStatus.UPLOADING);
    }
}
