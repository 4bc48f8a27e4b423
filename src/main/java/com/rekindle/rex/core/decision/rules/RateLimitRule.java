package com.rekindle.rex.core.decision.rules;

import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.EligibilityContext;
import com.rekindle.rex.core.decision.RuleOutcome;
import com.rekindle.rex.core.decision.TypedRule;

/**
 * Keeps the last slice of each provider budget for high-priority missions: a lower-priority
 * mission is deferred while any provider it needs is above the utilisation threshold.
 */
public class RateLimitRule extends TypedRule<EligibilityContext> {

    private final double utilizationThreshold;
    private final int priorityThreshold;

    public RateLimitRule(double utilizationThreshold, int priorityThreshold) {
        super(EligibilityContext.class, 90);
        this.utilizationThreshold = utilizationThreshold;
        this.priorityThreshold = priorityThreshold;
    }

    @Override
    protected boolean test(EligibilityContext context) {
        return context.priority() < priorityThreshold
                && context.providerUtilization().values().stream().anyMatch(u -> u >= utilizationThreshold);
    }

    @Override
    protected RuleOutcome decide(EligibilityContext context) {
        return RuleOutcome.decide(DecisionValues.DEFER, name());
    }
}
