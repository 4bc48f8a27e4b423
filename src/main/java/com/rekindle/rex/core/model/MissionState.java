package com.rekindle.rex.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a Rex mission.
 * <p>
 * {@code QUEUED -> ASSIGNED -> RUNNING -> {COMPLETED | FAILED | RETRY_PENDING | CANCELLED}},
 * {@code RETRY_PENDING -> QUEUED} after backoff. Any non-terminal state may be cancelled or
 * force-failed. Terminal states admit no further transition.
 */
public enum MissionState {
    QUEUED,
    ASSIGNED,
    RUNNING,
    RETRY_PENDING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Structural guard applied to every state write, whatever layer decided it.
     */
    public boolean canTransitionTo(MissionState target) {
        return successors().contains(target);
    }

    private Set<MissionState> successors() {
        return switch (this) {
            case QUEUED -> EnumSet.of(ASSIGNED, FAILED, CANCELLED);
            case ASSIGNED -> EnumSet.of(RUNNING, FAILED, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, RETRY_PENDING, CANCELLED);
            case RETRY_PENDING -> EnumSet.of(QUEUED, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(MissionState.class);
        };
    }
}
