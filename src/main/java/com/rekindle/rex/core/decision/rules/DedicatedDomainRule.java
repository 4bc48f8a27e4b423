package com.rekindle.rex.core.decision.rules;

import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.DomainSelectionContext;
import com.rekindle.rex.core.decision.RuleOutcome;
import com.rekindle.rex.core.decision.TypedRule;

/**
 * A campaign's dedicated domain is used while its reputation holds its tier floor; below the
 * floor the mission draws from the shared pools instead.
 */
public class DedicatedDomainRule extends TypedRule<DomainSelectionContext> {

    public DedicatedDomainRule() {
        super(DomainSelectionContext.class, 70);
    }

    @Override
    protected boolean test(DomainSelectionContext context) {
        return context.domainRequired()
                && context.dedicatedDomain() != null
                && context.dedicatedReputation() != null
                && context.dedicatedFloor() != null;
    }

    @Override
    protected RuleOutcome decide(DomainSelectionContext context) {
        boolean healthy = context.dedicatedReputation() >= context.dedicatedFloor();
        return RuleOutcome.decide(healthy ? DecisionValues.DEDICATED : DecisionValues.POOL, name());
    }
}
