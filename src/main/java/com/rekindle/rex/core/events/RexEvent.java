package com.rekindle.rex.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event broadcast by the orchestration core for dashboards and analytics.
 *
 * @param eventType event type (see {@link RexEventTypes})
 * @param missionId the mission this event belongs to (nullable for pool-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record RexEvent(
    String eventType,
    String missionId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
