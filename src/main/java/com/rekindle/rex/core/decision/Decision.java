package com.rekindle.rex.core.decision;

import java.io.Serializable;

/**
 * Result of resolving an orchestration question.
 *
 * @param requestType the question that was asked
 * @param value       the answer, one of {@link RequestType#allowedValues()}
 * @param layer       the layer that answered
 * @param confidence  1.0 for deterministic layers, the reasoner's clamped confidence otherwise
 * @param rationale   short explanation (rule name, table hit, fallback cause)
 */
public record Decision(
    RequestType requestType,
    String value,
    DecisionLayer layer,
    double confidence,
    String rationale
) implements Serializable {

    public boolean is(String expected) {
        return value.equals(expected);
    }
}
