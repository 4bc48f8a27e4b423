package com.rekindle.rex.core.decision;

import com.rekindle.rex.core.model.MissionType;

import java.util.Objects;

/**
 * Context for {@link RequestType#PRIORITY_CHECK}: should a long-waiting QUEUED mission move up
 * the queue.
 *
 * @param maxPriority       ceiling no boost may exceed
 * @param waitedMinutes     time since the mission last entered the queue or was last boosted
 * @param boostAfterMinutes wait after which a mission becomes due for a boost
 */
public record PriorityCheckContext(
    String missionId,
    MissionType missionType,
    int priority,
    int maxPriority,
    long waitedMinutes,
    long boostAfterMinutes
) implements DecisionContext {

    public static final String AT_CAP = "AT_CAP";
    public static final String BELOW_CAP = "BELOW_CAP";
    public static final String OVERDUE = "OVERDUE";
    public static final String WAITING = "WAITING";

    public PriorityCheckContext {
        Objects.requireNonNull(missionType, "missionType");
        if (waitedMinutes < 0 || boostAfterMinutes <= 0) {
            throw new IllegalArgumentException("wait must be non-negative and the boost interval positive");
        }
    }

    @Override
    public RequestType requestType() {
        return RequestType.PRIORITY_CHECK;
    }

    @Override
    public String stateKey() {
        return priority >= maxPriority ? AT_CAP : BELOW_CAP;
    }

    @Override
    public String eventKey() {
        return waitedMinutes >= boostAfterMinutes ? OVERDUE : WAITING;
    }
}
