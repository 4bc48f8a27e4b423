package com.rekindle.rex.core.decision;

import java.io.Serializable;
import java.util.Map;

/**
 * Counters describing how the decision engine has been answering.
 *
 * @param byLayer          resolved requests per layer label
 * @param highConfidence   decisions with confidence &ge; 0.9
 * @param mediumConfidence decisions with confidence in [0.7, 0.9)
 * @param lowConfidence    decisions below 0.7, fallbacks included
 */
public record DecisionStats(
    long totalDecisions,
    Map<String, Long> byLayer,
    long cacheHits,
    long cacheMisses,
    long fallbacks,
    long highConfidence,
    long mediumConfidence,
    long lowConfidence
) implements Serializable {

    /** Share of decisions that needed the reasoner, cache hits and fallbacks included. */
    public double reasonerRate() {
        if (totalDecisions == 0) {
            return 0.0;
        }
        long reasoned = byLayer.getOrDefault(DecisionLayer.LLM.label(), 0L) + fallbacks;
        return (double) reasoned / totalDecisions;
    }
}
