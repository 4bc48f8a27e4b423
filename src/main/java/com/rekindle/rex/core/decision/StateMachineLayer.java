package com.rekindle.rex.core.decision;

import com.rekindle.rex.core.model.MissionEvent;
import com.rekindle.rex.core.model.MissionState;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.rekindle.rex.core.decision.DecisionValues.*;

/**
 * Layer 1: a pure lookup table keyed by (request type, state key, event key).
 * <p>
 * Holds only the unambiguous answers. A missing entry means the layer declines and the
 * question moves on to the rule engine.
 */
public class StateMachineLayer {

    private final Map<Key, String> table;

    public StateMachineLayer() {
        this.table = Collections.unmodifiableMap(buildTable());
    }

    public Optional<String> lookup(DecisionContext context) {
        return Optional.ofNullable(table.get(new Key(context.requestType(), context.stateKey(), context.eventKey())));
    }

    int size() {
        return table.size();
    }

    private static Map<Key, String> buildTable() {
        var t = new HashMap<Key, String>();

        // Mission lifecycle
        transition(t, MissionState.QUEUED, MissionEvent.DISPATCHED, MissionState.ASSIGNED);
        transition(t, MissionState.ASSIGNED, MissionEvent.STARTED, MissionState.RUNNING);
        transition(t, MissionState.RUNNING, MissionEvent.COMPLETED, MissionState.COMPLETED);
        transition(t, MissionState.RUNNING, MissionEvent.RETRY_SCHEDULED, MissionState.RETRY_PENDING);
        transition(t, MissionState.RETRY_PENDING, MissionEvent.BACKOFF_ELAPSED, MissionState.QUEUED);
        for (MissionState state : MissionState.values()) {
            if (!state.isTerminal()) {
                transition(t, state, MissionEvent.CANCELLED, MissionState.CANCELLED);
                transition(t, state, MissionEvent.FAILED, MissionState.FAILED);
            }
        }

        // Retry decisions with an explicit worker classification
        t.put(new Key(RequestType.RETRY_DECISION, RetryContext.BUDGET_REMAINING, RetryContext.RECOVERABLE), RETRY);
        t.put(new Key(RequestType.RETRY_DECISION, RetryContext.BUDGET_REMAINING, RetryContext.TERMINAL), FAIL_TERMINAL);
        t.put(new Key(RequestType.RETRY_DECISION, RetryContext.BUDGET_EXHAUSTED, RetryContext.TERMINAL), FAIL_TERMINAL);

        // Domain selection
        t.put(new Key(RequestType.DOMAIN_SELECTION, DomainSelectionContext.NOT_REQUIRED, DomainSelectionContext.SELECT),
                NOT_REQUIRED);
        t.put(new Key(RequestType.DOMAIN_SELECTION, DomainSelectionContext.NO_DEDICATED, DomainSelectionContext.SELECT),
                POOL);

        // Internal maintenance missions are always admitted
        t.put(new Key(RequestType.ELIGIBILITY_CHECK, EligibilityContext.MAINTENANCE, EligibilityContext.ADMIT), ELIGIBLE);

        // One live lease per kind per mission
        t.put(new Key(RequestType.LEASE_CHECK, LeaseCheckContext.HELD, LeaseCheckContext.ACQUIRE), DENY);
        t.put(new Key(RequestType.LEASE_CHECK, LeaseCheckContext.FREE, LeaseCheckContext.ACQUIRE), ATTEMPT);

        // Missions at the ceiling or not yet overdue keep their priority
        t.put(new Key(RequestType.PRIORITY_CHECK, PriorityCheckContext.AT_CAP, PriorityCheckContext.OVERDUE), MAINTAIN);
        t.put(new Key(RequestType.PRIORITY_CHECK, PriorityCheckContext.AT_CAP, PriorityCheckContext.WAITING), MAINTAIN);
        t.put(new Key(RequestType.PRIORITY_CHECK, PriorityCheckContext.BELOW_CAP, PriorityCheckContext.WAITING), MAINTAIN);

        return t;
    }

    private static void transition(Map<Key, String> t, MissionState from, MissionEvent event, MissionState to) {
        t.put(new Key(RequestType.MISSION_TRANSITION, from.name(), event.name()), to.name());
    }

    private record Key(RequestType requestType, String stateKey, String eventKey) {}
}
