package com.rekindle.rex.core.decision.rules;

import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.RuleOutcome;
import com.rekindle.rex.core.decision.TransitionContext;
import com.rekindle.rex.core.decision.TypedRule;

/**
 * Any (state, event) pair the lifecycle table and the timeout rule do not cover is rejected.
 * Terminal states end up here.
 */
public class InvalidTransitionRule extends TypedRule<TransitionContext> {

    public InvalidTransitionRule() {
        super(TransitionContext.class, 20);
    }

    @Override
    protected boolean test(TransitionContext context) {
        return true;
    }

    @Override
    protected RuleOutcome decide(TransitionContext context) {
        return RuleOutcome.decide(DecisionValues.REJECT, name());
    }
}
