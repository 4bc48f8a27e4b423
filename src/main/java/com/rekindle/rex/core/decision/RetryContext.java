package com.rekindle.rex.core.decision;

import com.rekindle.rex.core.model.MissionType;

import java.util.Objects;

/**
 * Context for {@link RequestType#RETRY_DECISION}: what to do with a failed mission.
 *
 * @param recoverable the worker's classification; {@code null} when unclassified
 */
public record RetryContext(
    String missionId,
    MissionType missionType,
    int priority,
    int retryCount,
    int maxRetries,
    String errorCode,
    String errorMessage,
    Boolean recoverable
) implements DecisionContext {

    public static final String BUDGET_REMAINING = "BUDGET_REMAINING";
    public static final String BUDGET_EXHAUSTED = "BUDGET_EXHAUSTED";
    public static final String RECOVERABLE = "RECOVERABLE";
    public static final String TERMINAL = "TERMINAL";
    public static final String UNCLASSIFIED = "UNCLASSIFIED";

    public RetryContext {
        Objects.requireNonNull(missionType, "missionType");
        if (retryCount < 0 || maxRetries < 0) {
            throw new IllegalArgumentException("retry counters must be non-negative");
        }
    }

    public boolean budgetExhausted() {
        return retryCount >= maxRetries;
    }

    @Override
    public RequestType requestType() {
        return RequestType.RETRY_DECISION;
    }

    @Override
    public String stateKey() {
        return budgetExhausted() ? BUDGET_EXHAUSTED : BUDGET_REMAINING;
    }

    @Override
    public String eventKey() {
        if (recoverable == null) {
            return UNCLASSIFIED;
        }
        return recoverable ? RECOVERABLE : TERMINAL;
    }
}
