package com.rekindle.rex.core.decision;

import com.rekindle.rex.core.model.MissionState;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import static com.rekindle.rex.core.decision.DecisionValues.*;

/**
 * Orchestration questions the decision engine answers, each with its closed set of answers.
 */
public enum RequestType {
    MISSION_TRANSITION(transitionValues()),
    RETRY_DECISION(Set.of(RETRY, FAIL_TERMINAL, ESCALATE)),
    DOMAIN_SELECTION(Set.of(DEDICATED, POOL, NOT_REQUIRED)),
    ELIGIBILITY_CHECK(Set.of(ELIGIBLE, DEFER, INELIGIBLE)),
    LEASE_CHECK(Set.of(ATTEMPT, DENY)),
    PRIORITY_CHECK(Set.of(BOOST, MAINTAIN));

    private final Set<String> allowedValues;

    RequestType(Set<String> allowedValues) {
        this.allowedValues = allowedValues;
    }

    public Set<String> allowedValues() {
        return allowedValues;
    }

    public boolean allows(String value) {
        return value != null && allowedValues.contains(value);
    }

    private static Set<String> transitionValues() {
        var values = new LinkedHashSet<String>();
        Arrays.stream(MissionState.values()).map(Enum::name).forEach(values::add);
        values.add(REJECT);
        return Set.copyOf(values);
    }
}
