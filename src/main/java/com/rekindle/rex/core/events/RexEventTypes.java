package com.rekindle.rex.core.events;

/**
 * Event type names published on the {@link EventBus}.
 */
public final class RexEventTypes {

    public static final String MISSION_CREATED = "mission.created";
    public static final String MISSION_STATE_CHANGED = "mission.stateChanged";
    public static final String MISSION_ASSIGNED = "mission.assigned";
    public static final String MISSION_COMPLETED = "mission.completed";
    public static final String MISSION_FAILED = "mission.failed";
    public static final String MISSION_ESCALATED = "mission.escalated";
    public static final String MISSION_CANCELLED = "mission.cancelled";
    public static final String MISSION_PRIORITY_BOOSTED = "mission.priorityBoosted";

    public static final String LEASE_GRANTED = "resource.leaseGranted";
    public static final String LEASE_RELEASED = "resource.leaseReleased";
    public static final String POOL_EXHAUSTED = "resource.poolExhausted";

    public static final String DECISION_RESOLVED = "decision.resolved";

    private RexEventTypes() {}
}
