package com.ivamare.pipeline.model;

/**
 * Persisted lifecycle status of an item, as reported to the status sink.
 */
public enum ItemStatus {
    DETECTED("detected"),
    DOWNLOADING("downloading"),
    DOWNLOADED("downloaded"),
    UPLOADING("uploading"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    ItemStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Whether an item in this status still has pipeline work left.
     */
    public boolean isUnfinished() {
        return this == DETECTED || this == DOWNLOADING || this == DOWNLOADED || this == UPLOADING;
    }

    public static ItemStatus fromValue(String value) {
        for (ItemStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown item status: " + value);
    }
}
