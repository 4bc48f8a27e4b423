package com.rekindle.rex.core.llm;

/**
 * Reasoning capability consulted for orchestration questions no deterministic layer answers.
 * <p>
 * Implementations may block on network I/O; callers bound every call with a timeout.
 */
@FunctionalInterface
public interface Reasoner {

    /**
     * @param request the question and its redacted context
     * @return the provider's raw answer; fields may be missing if the provider misbehaved
     * @throws ReasonerException if the provider could not be reached or its answer not parsed
     */
    ReasonerResult resolve(ReasonerRequest request) throws ReasonerException;
}
