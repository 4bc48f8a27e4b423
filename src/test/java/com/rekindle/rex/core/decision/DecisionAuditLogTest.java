package com.rekindle.rex.core.decision;

import com.rekindle.rex.core.events.EventBus;
import com.rekindle.rex.core.events.RexEvent;
import com.rekindle.rex.core.events.RexEventTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecisionAuditLogTest {

    private EventBus eventBus;
    private List<RexEvent> published;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        published = new ArrayList<>();
        eventBus.subscribeType(RexEventTypes.DECISION_RESOLVED, published::add);
    }

    private static DecisionRecord record(String missionId, String output) {
        return new DecisionRecord(Instant.parse("2026-03-02T09:00:00Z"), RequestType.LEASE_CHECK, missionId,
                "state-machine", "{}", output, 1.0, 0, false);
    }

    @Test
    @DisplayName("publishes each record on the bus")
    void publishes() {
        var log = new DecisionAuditLog(10, eventBus);

        log.append(record("M-1", "ATTEMPT"));

        assertEquals(1, published.size());
        var event = published.get(0);
        assertEquals("M-1", event.missionId());
        assertEquals("LEASE_CHECK", event.payload().get("requestType"));
        assertEquals("ATTEMPT", event.payload().get("output"));
        assertEquals("state-machine", event.payload().get("layer"));
    }

    @Test
    @DisplayName("retains the newest records up to capacity")
    void boundedNewestFirst() {
        var log = new DecisionAuditLog(2, eventBus);

        log.append(record("M-1", "ATTEMPT"));
        log.append(record("M-2", "DENY"));
        log.append(record("M-3", "ATTEMPT"));

        var recent = log.recent(10);
        assertEquals(List.of("M-3", "M-2"), recent.stream().map(DecisionRecord::missionId).toList());
        assertEquals(1, log.recent(1).size());
        assertEquals(3, log.totalAppended());
    }

    @Test
    @DisplayName("rejects a non-positive capacity")
    void rejectsCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new DecisionAuditLog(0, eventBus));
    }
}
