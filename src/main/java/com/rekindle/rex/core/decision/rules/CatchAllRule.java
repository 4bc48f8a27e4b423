package com.rekindle.rex.core.decision.rules;

import com.rekindle.rex.core.decision.DecisionContext;
import com.rekindle.rex.core.decision.Rule;
import com.rekindle.rex.core.decision.RuleOutcome;

import java.util.function.Function;

/**
 * Closes the rule layer. Matches everything and hands the question to the reasoner together
 * with the conservative default to use if reasoning fails.
 */
public class CatchAllRule implements Rule {

    private final Function<DecisionContext, String> conservativeDefault;

    public CatchAllRule(Function<DecisionContext, String> conservativeDefault) {
        this.conservativeDefault = conservativeDefault;
    }

    @Override
    public int order() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean matches(DecisionContext context) {
        return true;
    }

    @Override
    public RuleOutcome apply(DecisionContext context) {
        return RuleOutcome.defer(conservativeDefault.apply(context), name());
    }
}
