package com.rekindle.rex.core.crew;

/**
 * Outbound seam to the worker crews.
 * <p>
 * Crews report back through the scheduler's progress, completion and failure callbacks.
 */
public interface CrewDispatcher {

    /**
     * Hands a mission to its crew. Must not block; a thrown exception leaves the mission queued.
     */
    void dispatch(MissionAssignment assignment);
}
