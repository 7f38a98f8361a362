package com.ivamare.pipeline.model;

/**
 * Classification of a failed attempt, reported on *_FAILED events.
 */
public enum FailureKind {
    /** Likely to succeed if tried again (network, timeout). */
    TRANSIENT,
    /** Will fail again (invalid input, missing content, quota). */
    PERMANENT
}
