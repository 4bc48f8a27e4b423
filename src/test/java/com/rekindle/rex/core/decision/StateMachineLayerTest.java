package com.rekindle.rex.core.decision;

import com.rekindle.rex.core.model.MissionEvent;
import com.rekindle.rex.core.model.MissionState;
import com.rekindle.rex.core.model.MissionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StateMachineLayerTest {

    private static final long DAY = 24 * 60;

    private final StateMachineLayer layer = new StateMachineLayer();

    @ParameterizedTest(name = "{0} + {1} -> {2}")
    @CsvSource({
            "QUEUED, DISPATCHED, ASSIGNED",
            "ASSIGNED, STARTED, RUNNING",
            "RUNNING, COMPLETED, COMPLETED",
            "RUNNING, RETRY_SCHEDULED, RETRY_PENDING",
            "RETRY_PENDING, BACKOFF_ELAPSED, QUEUED",
            "QUEUED, CANCELLED, CANCELLED",
            "RETRY_PENDING, FAILED, FAILED"
    })
    @DisplayName("lifecycle transitions are table hits")
    void lifecycleTransitions(MissionState from, MissionEvent event, MissionState to) {
        var ctx = new TransitionContext("M-1", from, event, 0, 3);
        assertEquals(Optional.of(to.name()), layer.lookup(ctx));
    }

    @Test
    @DisplayName("declines terminal states and progress timeouts")
    void declinesNonTableTransitions() {
        assertTrue(layer.lookup(new TransitionContext("M-1", MissionState.COMPLETED, MissionEvent.CANCELLED, 0, 3))
                .isEmpty());
        assertTrue(layer.lookup(new TransitionContext("M-1", MissionState.RUNNING, MissionEvent.PROGRESS_TIMEOUT, 0, 3))
                .isEmpty());
    }

    @Test
    @DisplayName("classified failures decide retries without the rules")
    void retryClassification() {
        var recoverable = new RetryContext("M-1", MissionType.CAMPAIGN_EXECUTION, 50, 0, 3,
                "PROVIDER_5XX", "bad gateway", true);
        var terminal = new RetryContext("M-1", MissionType.CAMPAIGN_EXECUTION, 50, 0, 3,
                "VALIDATION_ERROR", "bad lead", false);
        var exhaustedRecoverable = new RetryContext("M-1", MissionType.CAMPAIGN_EXECUTION, 50, 3, 3,
                "PROVIDER_5XX", "bad gateway", true);

        assertEquals(Optional.of(DecisionValues.RETRY), layer.lookup(recoverable));
        assertEquals(Optional.of(DecisionValues.FAIL_TERMINAL), layer.lookup(terminal));
        assertTrue(layer.lookup(exhaustedRecoverable).isEmpty());
    }

    @Test
    @DisplayName("domain, eligibility and lease answers")
    void otherRequestTypes() {
        assertEquals(Optional.of(DecisionValues.NOT_REQUIRED), layer.lookup(
                new DomainSelectionContext("M-1", MissionType.ICP_EXTRACTION, false, null, null, null, null)));
        assertEquals(Optional.of(DecisionValues.POOL), layer.lookup(
                new DomainSelectionContext("M-1", MissionType.LEAD_REACTIVATION, true, "C-1", null, null, null)));
        assertEquals(Optional.of(DecisionValues.ELIGIBLE), layer.lookup(
                new EligibilityContext("M-1", MissionType.DOMAIN_ROTATION, 10, null, null, Map.of())));
        assertTrue(layer.lookup(
                new EligibilityContext("M-1", MissionType.LEAD_REACTIVATION, 10, null, null, Map.of())).isEmpty());
        assertEquals(Optional.of(DecisionValues.DENY), layer.lookup(
                new LeaseCheckContext("M-1", "AGENT_SLOT", Set.of("AGENT_SLOT"))));
        assertEquals(Optional.of(DecisionValues.ATTEMPT), layer.lookup(
                new LeaseCheckContext("M-1", "DOMAIN", Set.of("AGENT_SLOT"))));
    }

    @Test
    @DisplayName("priority stays put at the ceiling or before the wait is over; overdue missions go to the rules")
    void priorityChecks() {
        assertEquals(Optional.of(DecisionValues.MAINTAIN), layer.lookup(
                new PriorityCheckContext("M-1", MissionType.ICP_EXTRACTION, 100, 100, 1800, DAY)));
        assertEquals(Optional.of(DecisionValues.MAINTAIN), layer.lookup(
                new PriorityCheckContext("M-1", MissionType.ICP_EXTRACTION, 10, 100, 180, DAY)));
        assertTrue(layer.lookup(
                new PriorityCheckContext("M-1", MissionType.ICP_EXTRACTION, 10, 100, 1500, DAY))
                .isEmpty());
    }

    @Test
    @DisplayName("every table answer is an allowed value for its request type")
    void tableAnswersAreAllowed() {
        assertTrue(layer.size() > 0);
        for (MissionState state : MissionState.values()) {
            for (MissionEvent event : MissionEvent.values()) {
                layer.lookup(new TransitionContext("M-1", state, event, 0, 1))
                        .ifPresent(v -> assertTrue(RequestType.MISSION_TRANSITION.allows(v), v));
            }
        }
    }
}
