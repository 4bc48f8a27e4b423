package com.rekindle.rex.core.decision.rules;

import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.RetryContext;
import com.rekindle.rex.core.decision.RuleOutcome;
import com.rekindle.rex.core.decision.TypedRule;

/**
 * High-priority missions that used up their retries are escalated rather than dropped.
 */
public class RetryBudgetEscalationRule extends TypedRule<RetryContext> {

    private final int priorityThreshold;

    public RetryBudgetEscalationRule(int priorityThreshold) {
        super(RetryContext.class, 30);
        this.priorityThreshold = priorityThreshold;
    }

    @Override
    protected boolean test(RetryContext context) {
        return context.budgetExhausted() && context.priority() >= priorityThreshold;
    }

    @Override
    protected RuleOutcome decide(RetryContext context) {
        return RuleOutcome.decide(DecisionValues.ESCALATE, name());
    }
}
