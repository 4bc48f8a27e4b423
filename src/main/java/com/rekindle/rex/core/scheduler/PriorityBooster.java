package com.rekindle.rex.core.scheduler;

import com.rekindle.rex.core.decision.Decision;
import com.rekindle.rex.core.decision.DecisionEngine;
import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.PriorityCheckContext;
import com.rekindle.rex.core.events.RexEventTypes;
import com.rekindle.rex.core.logging.MdcContext;
import com.rekindle.rex.core.metrics.RexMetrics;
import com.rekindle.rex.core.model.Mission;
import com.rekindle.rex.core.model.MissionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;

/**
 * Moves QUEUED missions that have waited past the boost interval up the queue, so sustained
 * high-priority load cannot starve them. Only queue order changes; RUNNING missions are never
 * preempted.
 */
class PriorityBooster {

    private static final Logger log = LoggerFactory.getLogger(PriorityBooster.class);

    private final MissionStore store;
    private final MissionTransitions transitions;
    private final DecisionEngine decisionEngine;
    private final RexMetrics metrics;
    private final Clock clock;
    private final Duration boostAfter;
    private final int step;
    private final int maxPriority;

    PriorityBooster(MissionStore store, MissionTransitions transitions, DecisionEngine decisionEngine,
                    RexMetrics metrics, Clock clock, SchedulerProperties properties) {
        this.store = store;
        this.transitions = transitions;
        this.decisionEngine = decisionEngine;
        this.metrics = metrics;
        this.clock = clock;
        this.boostAfter = properties.getPriorityBoostAfter();
        this.step = properties.getPriorityBoostStep();
        this.maxPriority = properties.getMaxPriority();
    }

    /**
     * @return number of missions boosted in this pass
     */
    int tick() {
        int boosted = 0;
        Instant now = clock.instant();
        for (Mission mission : store.inState(MissionState.QUEUED)) {
            // only missions that have waited a full interval raise the question
            if (Duration.between(mission.waitingSince(), now).compareTo(boostAfter) >= 0 && boost(mission, now)) {
                boosted++;
            }
        }
        return boosted;
    }

    private boolean boost(Mission mission, Instant now) {
        mission.lock().lock();
        try {
            MdcContext.setMission(mission.id());
            if (mission.state() != MissionState.QUEUED) {
                return false;
            }
            int from = mission.priority();
            Decision decision = decisionEngine.resolve(new PriorityCheckContext(mission.id(), mission.type(), from,
                    maxPriority, Duration.between(mission.waitingSince(), now).toMinutes(), boostAfter.toMinutes()));
            if (!decision.is(DecisionValues.BOOST)) {
                return false;
            }
            int to = Math.min(from + step, maxPriority);
            if (to <= from) {
                return false;
            }
            store.reprioritize(mission, to, now);
            metrics.recordPriorityBoost(mission.type().name());
            log.info("Boosted mission {} priority {} -> {} after waiting {}", mission.id(), from, to, boostAfter);

            var payload = new LinkedHashMap<String, Object>();
            payload.put("from", from);
            payload.put("to", to);
            transitions.publish(RexEventTypes.MISSION_PRIORITY_BOOSTED, mission, payload);
            return true;
        } finally {
            mission.lock().unlock();
            MdcContext.clear();
        }
    }
}
