package com.rekindle.rex.core.llm;

/**
 * Used when no reasoning provider is configured. Every call fails, so the decision engine
 * falls back to its conservative defaults.
 */
public class DisabledReasoner implements Reasoner {

    @Override
    public ReasonerResult resolve(ReasonerRequest request) throws ReasonerException {
        throw new ReasonerException("LLM reasoning is disabled (rex.llm.enabled=false)");
    }
}
