package com.rekindle.rex.core.decision;

import java.io.Serializable;
import java.time.Instant;

/**
 * Audit entry for one resolved request. Written once, never read back into decision logic.
 *
 * @param inputs redacted context as JSON
 */
public record DecisionRecord(
    Instant at,
    RequestType requestType,
    String missionId,
    String layer,
    String inputs,
    String output,
    double confidence,
    long latencyMs,
    boolean cacheHit
) implements Serializable {}
