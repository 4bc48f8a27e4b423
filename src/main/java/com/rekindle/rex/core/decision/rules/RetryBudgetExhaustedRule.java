package com.rekindle.rex.core.decision.rules;

import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.RetryContext;
import com.rekindle.rex.core.decision.RuleOutcome;
import com.rekindle.rex.core.decision.TypedRule;

/**
 * {@code retry_count >= max_retries} ends the mission.
 */
public class RetryBudgetExhaustedRule extends TypedRule<RetryContext> {

    public RetryBudgetExhaustedRule() {
        super(RetryContext.class, 40);
    }

    @Override
    protected boolean test(RetryContext context) {
        return context.budgetExhausted();
    }

    @Override
    protected RuleOutcome decide(RetryContext context) {
        return RuleOutcome.decide(DecisionValues.FAIL_TERMINAL, name());
    }
}
