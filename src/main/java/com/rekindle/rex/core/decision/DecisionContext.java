package com.rekindle.rex.core.decision;

/**
 * Typed facts for one orchestration question. Each request type has exactly one context
 * variant; the state machine keys its table on {@link #stateKey()} and {@link #eventKey()}.
 */
public sealed interface DecisionContext
        permits TransitionContext, RetryContext, DomainSelectionContext, EligibilityContext, LeaseCheckContext,
                PriorityCheckContext {

    RequestType requestType();

    /** Mission the question concerns, or {@code null}. Excluded from reasoner cache keys. */
    String missionId();

    String stateKey();

    String eventKey();
}
