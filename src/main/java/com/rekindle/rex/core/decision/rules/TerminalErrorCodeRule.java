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
 * Unclassified failures carrying a known non-retryable code (validation, auth, compliance)
 * are terminal.
 */
public class TerminalErrorCodeRule extends TypedRule<RetryContext> {

    private final Set<String> terminalCodes;

    public TerminalErrorCodeRule(Collection<String> terminalCodes) {
        super(RetryContext.class, 50);
        this.terminalCodes = terminalCodes.stream()
                .map(c -> c.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    protected boolean test(RetryContext context) {
        return context.recoverable() == null
                && context.errorCode() != null
                && terminalCodes.contains(context.errorCode().toUpperCase(Locale.ROOT));
    }

    @Override
    protected RuleOutcome decide(RetryContext context) {
        return RuleOutcome.decide(DecisionValues.FAIL_TERMINAL, name());
    }
}
