package com.rekindle.rex.core.decision;

/**
 * A small, side-effect-free predicate→action rule. Rules perform no I/O.
 */
public interface Rule {

    /** Evaluation order; lower runs first. */
    int order();

    boolean matches(DecisionContext context);

    RuleOutcome apply(DecisionContext context);

    default String name() {
        return getClass().getSimpleName();
    }
}
