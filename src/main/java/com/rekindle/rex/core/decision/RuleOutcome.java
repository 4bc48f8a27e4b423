package com.rekindle.rex.core.decision;

/**
 * Answer of the rule layer.
 *
 * @param value     the decided value, or the conservative default when {@code deferred}
 * @param rule      name of the rule that matched
 * @param deferred  true when no specific rule applied and the question goes to the reasoner
 */
public record RuleOutcome(String value, String rule, boolean deferred) {

    public static RuleOutcome decide(String value, String rule) {
        return new RuleOutcome(value, rule, false);
    }

    public static RuleOutcome defer(String conservativeDefault, String rule) {
        return new RuleOutcome(conservativeDefault, rule, true);
    }
}
