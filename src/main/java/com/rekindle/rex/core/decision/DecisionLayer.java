package com.rekindle.rex.core.decision;

/**
 * The layer that produced a decision.
 */
public enum DecisionLayer {
    STATE_MACHINE("state-machine"),
    RULE_ENGINE("rule-engine"),
    LLM("llm"),
    LLM_FALLBACK("llm-fallback");

    private final String label;

    DecisionLayer(String label) {
        this.label = label;
    }

    /** Label written to decision records and metrics tags. */
    public String label() {
        return label;
    }
}
