package com.rekindle.rex.core.model;

/**
 * Lifecycle events that drive mission state transitions.
 */
public enum MissionEvent {
    DISPATCHED,
    STARTED,
    COMPLETED,
    FAILED,
    RETRY_SCHEDULED,
    BACKOFF_ELAPSED,
    PROGRESS_TIMEOUT,
    CANCELLED
}
