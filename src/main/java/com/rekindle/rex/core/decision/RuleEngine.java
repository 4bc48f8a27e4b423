package com.rekindle.rex.core.decision;

import com.rekindle.rex.core.decision.rules.AdmissionDefaultRule;
import com.rekindle.rex.core.decision.rules.BudgetConstraintRule;
import com.rekindle.rex.core.decision.rules.CatchAllRule;
import com.rekindle.rex.core.decision.rules.DedicatedDomainRule;
import com.rekindle.rex.core.decision.rules.InvalidTransitionRule;
import com.rekindle.rex.core.decision.rules.PriorityBoostRule;
import com.rekindle.rex.core.decision.rules.ProgressTimeoutRule;
import com.rekindle.rex.core.decision.rules.RateLimitRule;
import com.rekindle.rex.core.decision.rules.RetryBudgetEscalationRule;
import com.rekindle.rex.core.decision.rules.RetryBudgetExhaustedRule;
import com.rekindle.rex.core.decision.rules.TerminalErrorCodeRule;
import com.rekindle.rex.core.decision.rules.TransientErrorCodeRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Layer 2: ordered business rules, first match wins.
 * <p>
 * The list always ends with a {@link CatchAllRule}, so {@link #evaluate} is total. Rules that
 * cannot answer with certainty defer to the reasoner, carrying the conservative default this
 * layer owns for the request type.
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final List<Rule> rules;
    private final Duration budget;

    public RuleEngine(List<Rule> rules, Duration budget) {
        var ordered = new ArrayList<>(rules);
        ordered.removeIf(r -> r instanceof CatchAllRule);
        ordered.sort(Comparator.comparingInt(Rule::order));
        ordered.add(new CatchAllRule(ctx -> conservativeDefault(ctx.requestType())));
        this.rules = List.copyOf(ordered);
        this.budget = budget;
    }

    /**
     * Builds the standard rule set.
     */
    public static RuleEngine withDefaultRules(DecisionProperties props) {
        return new RuleEngine(List.of(
                new ProgressTimeoutRule(),
                new InvalidTransitionRule(),
                new RetryBudgetEscalationRule(props.getEscalationPriorityThreshold()),
                new RetryBudgetExhaustedRule(),
                new TerminalErrorCodeRule(props.getTerminalErrorCodes()),
                new TransientErrorCodeRule(props.getTransientErrorCodes()),
                new DedicatedDomainRule(),
                new BudgetConstraintRule(),
                new RateLimitRule(props.getRateLimitUtilization(), props.getEscalationPriorityThreshold()),
                new AdmissionDefaultRule(),
                new PriorityBoostRule()
        ), props.getRuleBudget());
    }

    public RuleOutcome evaluate(DecisionContext context) {
        long start = System.nanoTime();
        try {
            for (Rule rule : rules) {
                if (rule.matches(context)) {
                    log.debug("Rule matched: {} for {}", rule.name(), context.requestType());
                    return rule.apply(context);
                }
            }
            // Unreachable: the catch-all rule matches everything
            throw new IllegalStateException("No rule matched " + context.requestType());
        } finally {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            if (elapsedMs > budget.toMillis()) {
                log.warn("Rule evaluation for {} took {}ms, over the {}ms budget",
                        context.requestType(), elapsedMs, budget.toMillis());
            }
        }
    }

    /**
     * The answer used when the reasoner cannot be consulted or fails.
     */
    public String conservativeDefault(RequestType requestType) {
        return switch (requestType) {
            case MISSION_TRANSITION -> DecisionValues.REJECT;
            case RETRY_DECISION -> DecisionValues.ESCALATE;
            case DOMAIN_SELECTION -> DecisionValues.POOL;
            case ELIGIBILITY_CHECK -> DecisionValues.DEFER;
            case LEASE_CHECK -> DecisionValues.DENY;
            case PRIORITY_CHECK -> DecisionValues.MAINTAIN;
        };
    }

    public List<Rule> rules() {
        return rules;
    }
}
