package com.rekindle.rex.core.decision;

import java.util.Objects;
import java.util.Set;

/**
 * Context for {@link RequestType#LEASE_CHECK}: may the mission request a lease of this kind.
 *
 * @param leaseKey  lease kind key, e.g. "AGENT_SLOT" or "API_QUOTA:EMAIL"
 * @param heldKeys  lease kind keys the mission already holds
 */
public record LeaseCheckContext(
    String missionId,
    String leaseKey,
    Set<String> heldKeys
) implements DecisionContext {

    public static final String HELD = "HELD";
    public static final String FREE = "FREE";
    public static final String ACQUIRE = "ACQUIRE";

    public LeaseCheckContext {
        Objects.requireNonNull(leaseKey, "leaseKey");
        heldKeys = heldKeys != null ? Set.copyOf(heldKeys) : Set.of();
    }

    @Override
    public RequestType requestType() {
        return RequestType.LEASE_CHECK;
    }

    @Override
    public String stateKey() {
        return heldKeys.contains(leaseKey) ? HELD : FREE;
    }

    @Override
    public String eventKey() {
        return ACQUIRE;
    }
}
