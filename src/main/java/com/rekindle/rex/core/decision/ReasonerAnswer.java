package com.rekindle.rex.core.decision;

/**
 * Outcome of consulting the reasoner layer, including its fallback path.
 */
record ReasonerAnswer(
    String value,
    double confidence,
    DecisionLayer layer,
    boolean cacheHit,
    String rationale
) {

    static ReasonerAnswer fallback(String value, String cause) {
        return new ReasonerAnswer(value, 0.0, DecisionLayer.LLM_FALLBACK, false, cause);
    }
}
