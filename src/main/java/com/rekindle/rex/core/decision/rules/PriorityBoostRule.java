package com.rekindle.rex.core.decision.rules;

import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.PriorityCheckContext;
import com.rekindle.rex.core.decision.RuleOutcome;
import com.rekindle.rex.core.decision.TypedRule;

/**
 * Anti-starvation: a mission that has waited past the boost interval moves up, unless it is
 * already at the priority ceiling.
 */
public class PriorityBoostRule extends TypedRule<PriorityCheckContext> {

    public PriorityBoostRule() {
        super(PriorityCheckContext.class, 110);
    }

    @Override
    protected boolean test(PriorityCheckContext context) {
        return true;
    }

    @Override
    protected RuleOutcome decide(PriorityCheckContext context) {
        boolean due = context.priority() < context.maxPriority()
                && context.waitedMinutes() >= context.boostAfterMinutes();
        return RuleOutcome.decide(due ? DecisionValues.BOOST : DecisionValues.MAINTAIN, name());
    }
}
