package com.rekindle.rex.core.decision.rules;

import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.EligibilityContext;
import com.rekindle.rex.core.decision.RuleOutcome;
import com.rekindle.rex.core.decision.TypedRule;

/**
 * A mission whose estimated cost exceeds the remaining budget is not dispatched.
 */
public class BudgetConstraintRule extends TypedRule<EligibilityContext> {

    public BudgetConstraintRule() {
        super(EligibilityContext.class, 80);
    }

    @Override
    protected boolean test(EligibilityContext context) {
        return context.estimatedCost() != null
                && context.budgetRemaining() != null
                && context.estimatedCost() > context.budgetRemaining();
    }

    @Override
    protected RuleOutcome decide(EligibilityContext context) {
        return RuleOutcome.decide(DecisionValues.INELIGIBLE, name());
    }
}
