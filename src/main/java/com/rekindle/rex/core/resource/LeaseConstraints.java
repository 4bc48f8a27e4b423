package com.rekindle.rex.core.resource;

import java.util.Objects;

/**
 * What a lease request asks for. Build through the factory for the matching {@link LeaseKind}.
 */
public record LeaseConstraints(
    String crew,
    String campaignId,
    boolean preferDedicated,
    ApiProvider provider,
    long amount
) {

    public static LeaseConstraints agentSlot(String crew) {
        return new LeaseConstraints(Objects.requireNonNull(crew, "crew"), null, false, null, 1);
    }

    public static LeaseConstraints domain(String campaignId, boolean preferDedicated) {
        return new LeaseConstraints(null, campaignId, preferDedicated, null, 1);
    }

    public static LeaseConstraints apiQuota(ApiProvider provider, long tokens) {
        if (tokens < 0) {
            throw new IllegalArgumentException("tokens must be non-negative: " + tokens);
        }
        return new LeaseConstraints(null, null, false, Objects.requireNonNull(provider, "provider"), tokens);
    }
}
