package com.rekindle.rex.core.scheduler;

import com.rekindle.rex.core.decision.Decision;
import com.rekindle.rex.core.decision.DecisionEngine;
import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.TransitionContext;
import com.rekindle.rex.core.events.EventBus;
import com.rekindle.rex.core.events.RexEvent;
import com.rekindle.rex.core.events.RexEventTypes;
import com.rekindle.rex.core.metrics.RexMetrics;
import com.rekindle.rex.core.model.Mission;
import com.rekindle.rex.core.model.MissionError;
import com.rekindle.rex.core.model.MissionEvent;
import com.rekindle.rex.core.model.MissionState;
import com.rekindle.rex.core.resource.ResourceAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single place mission state is written. Shared by all three loops and the inbound callbacks.
 * <p>
 * Every method requires the caller to hold the mission's lock. The target state is resolved by
 * the decision engine. Leases are released when a mission reaches RETRY_PENDING or a terminal state.
 */
class MissionTransitions {

    private static final Logger log = LoggerFactory.getLogger(MissionTransitions.class);

    private final DecisionEngine decisionEngine;
    private final ResourceAllocator allocator;
    private final MissionStore store;
    private final EventBus eventBus;
    private final RexMetrics metrics;
    private final Clock clock;

    MissionTransitions(DecisionEngine decisionEngine, ResourceAllocator allocator, MissionStore store,
                       EventBus eventBus, RexMetrics metrics, Clock clock) {
        this.decisionEngine = decisionEngine;
        this.allocator = allocator;
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Applies a lifecycle event.
     *
     * @return the new state, or {@code null} if the transition was rejected
     */
    MissionState apply(Mission mission, MissionEvent event) {
        requireLocked(mission);
        MissionState from = mission.state();
        Decision decision = decisionEngine.resolve(new TransitionContext(
                mission.id(), from, event, mission.retryCount(), mission.maxRetries()));
        if (decision.is(DecisionValues.REJECT)) {
            log.warn("Transition rejected for mission {}: {} on {}", mission.id(), from, event);
            return null;
        }

        MissionState target = MissionState.valueOf(decision.value());
        try {
            mission.moveTo(target, clock.instant());
        } catch (IllegalStateException e) {
            throw new InvariantViolationException("ILLEGAL_TRANSITION", e.getMessage());
        }

        if (from == MissionState.QUEUED) {
            store.dequeue(mission);
        }
        if (target == MissionState.QUEUED) {
            store.enqueue(mission);
        }
        if (target == MissionState.RETRY_PENDING || target.isTerminal()) {
            releaseLeases(mission);
        }

        var payload = new LinkedHashMap<String, Object>();
        payload.put("from", from.name());
        payload.put("to", target.name());
        payload.put("event", event.name());
        payload.put("layer", decision.layer().label());
        publish(RexEventTypes.MISSION_STATE_CHANGED, mission, payload);
        log.info("Mission {} {} → {} ({})", mission.id(), from, target, event);

        if (target.isTerminal()) {
            publishTerminal(mission, target);
        }
        return target;
    }

    /**
     * Records the error and moves the mission to FAILED. No-op for terminal missions.
     */
    void fail(Mission mission, MissionError error) {
        requireLocked(mission);
        if (mission.state().isTerminal()) {
            return;
        }
        mission.fail(error);
        if (apply(mission, MissionEvent.FAILED) == null) {
            throw new InvariantViolationException("FAIL_REJECTED",
                    "FAILED rejected for mission " + mission.id() + " in " + mission.state());
        }
    }

    /**
     * Last-resort handling of a broken invariant: logged at ERROR, leases released and the mission
     * failed directly without consulting the decision engine.
     */
    void forceFail(Mission mission, InvariantViolationException violation) {
        requireLocked(mission);
        log.error("Invariant violation [{}] on mission {}: {}", violation.getKind(), mission.id(),
                violation.getMessage());
        metrics.recordInvariantViolation(violation.getKind());
        if (mission.state().isTerminal()) {
            releaseLeases(mission);
            return;
        }
        MissionState from = mission.state();
        mission.fail(MissionError.terminal("INVARIANT_VIOLATION", violation.getMessage()));
        mission.moveTo(MissionState.FAILED, clock.instant());
        if (from == MissionState.QUEUED) {
            store.dequeue(mission);
        }
        releaseLeases(mission);

        var payload = new LinkedHashMap<String, Object>();
        payload.put("from", from.name());
        payload.put("to", MissionState.FAILED.name());
        payload.put("event", "INVARIANT_VIOLATION");
        publish(RexEventTypes.MISSION_STATE_CHANGED, mission, payload);
        publishTerminal(mission, MissionState.FAILED);
    }

    void releaseLeases(Mission mission) {
        for (String leaseId : mission.drainLeases().values()) {
            allocator.release(leaseId);
        }
    }

    void publish(String eventType, Mission mission, Map<String, Object> payload) {
        eventBus.publish(new RexEvent(eventType, mission.id(), payload, clock.instant()));
    }

    private void publishTerminal(Mission mission, MissionState state) {
        metrics.recordMissionResult(state.name());
        var payload = new LinkedHashMap<String, Object>();
        payload.put("type", mission.type().name());
        payload.put("retryCount", mission.retryCount());
        switch (state) {
            case COMPLETED -> publish(RexEventTypes.MISSION_COMPLETED, mission, payload);
            case FAILED -> {
                if (mission.error() != null) {
                    payload.put("code", mission.error().code());
                    payload.put("message", mission.error().message());
                }
                publish(RexEventTypes.MISSION_FAILED, mission, payload);
            }
            case CANCELLED -> publish(RexEventTypes.MISSION_CANCELLED, mission, payload);
            default -> { }
        }
    }

    private static void requireLocked(Mission mission) {
        if (!mission.lock().isHeldByCurrentThread()) {
            throw new IllegalStateException("Mission lock not held for " + mission.id());
        }
    }
}
