package com.rekindle.rex.core.decision.rules;

import com.rekindle.rex.core.decision.RuleOutcome;
import com.rekindle.rex.core.decision.TransitionContext;
import com.rekindle.rex.core.decision.TypedRule;
import com.rekindle.rex.core.model.MissionEvent;
import com.rekindle.rex.core.model.MissionState;

/**
 * A stalled RUNNING mission goes back for retry while it has budget and fails otherwise.
 */
public class ProgressTimeoutRule extends TypedRule<TransitionContext> {

    public ProgressTimeoutRule() {
        super(TransitionContext.class, 10);
    }

    @Override
    protected boolean test(TransitionContext context) {
        return context.current() == MissionState.RUNNING && context.event() == MissionEvent.PROGRESS_TIMEOUT;
    }

    @Override
    protected RuleOutcome decide(TransitionContext context) {
        MissionState target = context.retryCount() < context.maxRetries()
                ? MissionState.RETRY_PENDING
                : MissionState.FAILED;
        return RuleOutcome.decide(target.name(), name());
    }
}
