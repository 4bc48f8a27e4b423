package com.rekindle.rex.core.resource;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of every pool.
 */
public record ResourceSnapshot(
    Instant takenAt,
    Map<String, CrewSlots> agentSlots,
    List<DomainRecord> domains,
    Map<String, QuotaState> apiQuotas,
    int liveLeases
) implements Serializable {

    public record CrewSlots(int max, int inUse, int available) implements Serializable {}

    public record QuotaState(String service, long capacity, long available, double utilization)
            implements Serializable {}
}
