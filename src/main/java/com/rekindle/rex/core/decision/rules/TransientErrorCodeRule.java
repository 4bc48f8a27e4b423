package com.rekindle.rex.core.decision.rules;

import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.RetryContext;
import com.rekindle.rex.core.decision.RuleOutcome;
import com.rekindle.rex.core.decision.TypedRule;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Unclassified failures carrying a known transient code (timeouts, 5xx, rate limits) are
 * retried while budget remains.
 */
public class TransientErrorCodeRule extends TypedRule<RetryContext> {

    private final Set<String> transientCodes;

    public TransientErrorCodeRule(Collection<String> transientCodes) {
        super(RetryContext.class, 60);
        this.transientCodes = transientCodes.stream()
                .map(c -> c.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    protected boolean test(RetryContext context) {
        return context.recoverable() == null
                && !context.budgetExhausted()
                && context.errorCode() != null
                && transientCodes.contains(context.errorCode().toUpperCase(Locale.ROOT));
    }

    @Override
    protected RuleOutcome decide(RetryContext context) {
        return RuleOutcome.decide(DecisionValues.RETRY, name());
    }
}
