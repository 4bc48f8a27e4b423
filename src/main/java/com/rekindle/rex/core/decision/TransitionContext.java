package com.rekindle.rex.core.decision;

import com.rekindle.rex.core.model.MissionEvent;
import com.rekindle.rex.core.model.MissionState;

import java.util.Objects;

/**
 * Context for {@link RequestType#MISSION_TRANSITION}: which state follows {@code current} on {@code event}.
 */
public record TransitionContext(
    String missionId,
    MissionState current,
    MissionEvent event,
    int retryCount,
    int maxRetries
) implements DecisionContext {

    public TransitionContext {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(event, "event");
        if (retryCount < 0 || maxRetries < 0) {
            throw new IllegalArgumentException("retry counters must be non-negative");
        }
    }

    @Override
    public RequestType requestType() {
        return RequestType.MISSION_TRANSITION;
    }

    @Override
    public String stateKey() {
        return current.name();
    }

    @Override
    public String eventKey() {
        return event.name();
    }
}
