package com.ivamare.pipeline.event;

/**
 * Types of events published on the {@link EventBus}.
 */
public enum EventType {
    // Monitoring
    MONITORING_STARTED("monitoring_started"),
    MONITORING_STOPPED("monitoring_stopped"),
    MONITORING_PAUSED("monitoring_paused"),
    MONITORING_RESUMED("monitoring_resumed"),

    // Detection
    VIDEO_DETECTED("video_detected"),
    VIDEO_QUEUED("video_queued"),

    // Download stage
    DOWNLOAD_STARTED("download_started"),
    DOWNLOAD_PROGRESS("download_progress"),
    DOWNLOAD_COMPLETED("download_completed"),
    DOWNLOAD_FAILED("download_failed"),
    DOWNLOAD_CANCELLED("download_cancelled"),

    // Upload stage
    UPLOAD_STARTED("upload_started"),
    UPLOAD_PROGRESS("upload_progress"),
    UPLOAD_COMPLETED("upload_completed"),
    UPLOAD_FAILED("upload_failed"),
    UPLOAD_CANCELLED("upload_cancelled"),

    // Status
    STATUS_CHANGED("status_changed"),
    STATISTICS_UPDATED("statistics_updated"),
    ERROR_OCCURRED("error_occurred"),
    WARNING_OCCURRED("warning_occurred"),

    // Configuration
    CONFIG_CHANGED("config_changed"),
    SETTINGS_SAVED("settings_saved"),

    // Application
    APP_STARTED("app_started"),
    APP_SHUTDOWN("app_shutdown");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parse from the wire value.
     *
     * @param value the lowercase event name
     * @return the matching EventType
     * @throws IllegalArgumentException if value is unknown
     */
    public static EventType fromValue(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
