package com.rekindle.rex.core.decision.rules;

import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.EligibilityContext;
import com.rekindle.rex.core.decision.RuleOutcome;
import com.rekindle.rex.core.decision.TypedRule;

/**
 * No admission constraint was violated.
 */
public class AdmissionDefaultRule extends TypedRule<EligibilityContext> {

    public AdmissionDefaultRule() {
        super(EligibilityContext.class, 100);
    }

    @Override
    protected boolean test(EligibilityContext context) {
        return true;
    }

    @Override
    protected RuleOutcome decide(EligibilityContext context) {
        return RuleOutcome.decide(DecisionValues.ELIGIBLE, name());
    }
}
