package com.ivamare.pipeline.model;

/**
 * Task priority. Lower value is served first.
 */
public enum Priority {
    HIGH(1),
    NORMAL(2),
    LOW(3);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static Priority fromValue(int value) {
        for (Priority priority : values()) {
            if (priority.value == value) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + value);
    }
}
