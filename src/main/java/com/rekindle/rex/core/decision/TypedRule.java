package com.rekindle.rex.core.decision;

/**
 * Base class for rules that only apply to one context variant.
 *
 * @param <C> the context variant this rule reads
 */
public abstract class TypedRule<C extends DecisionContext> implements Rule {

    private final Class<C> contextType;
    private final int order;

    protected TypedRule(Class<C> contextType, int order) {
        this.contextType = contextType;
        this.order = order;
    }

    @Override
    public int order() {
        return order;
    }

    @Override
    public final boolean matches(DecisionContext context) {
        return contextType.isInstance(context) && test(contextType.cast(context));
    }

    @Override
    public final RuleOutcome apply(DecisionContext context) {
        return decide(contextType.cast(context));
    }

    protected abstract boolean test(C context);

    protected abstract RuleOutcome decide(C context);
}
