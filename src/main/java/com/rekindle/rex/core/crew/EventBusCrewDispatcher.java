package com.rekindle.rex.core.crew;

import com.rekindle.rex.core.events.EventBus;
import com.rekindle.rex.core.events.RexEvent;
import com.rekindle.rex.core.events.RexEventTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;

/**
 * Hands missions to crews by publishing {@code mission.assigned}; crew workers subscribe by type.
 */
@Component
public class EventBusCrewDispatcher implements CrewDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventBusCrewDispatcher.class);

    private final EventBus eventBus;
    private final Clock clock;

    public EventBusCrewDispatcher(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public void dispatch(MissionAssignment assignment) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("crew", assignment.crew());
        payload.put("type", assignment.type().name());
        payload.put("attempt", assignment.attempt());
        if (assignment.domain() != null) {
            payload.put("domain", assignment.domain());
        }
        payload.put("payload", assignment.payload());
        eventBus.publish(new RexEvent(RexEventTypes.MISSION_ASSIGNED, assignment.missionId(), payload, clock.instant()));
        log.info("Mission {} handed to {} (attempt {})", assignment.missionId(), assignment.crew(), assignment.attempt());
    }
}
