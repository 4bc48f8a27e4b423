package com.rekindle.rex.core.decision;

import com.rekindle.rex.core.model.MissionType;

import java.util.Objects;

/**
 * Context for {@link RequestType#DOMAIN_SELECTION}: whether a mission needs a sending domain
 * and whether its campaign's dedicated domain should be tried first.
 *
 * @param dedicatedReputation current reputation of the dedicated domain; {@code null} when unknown
 */
public record DomainSelectionContext(
    String missionId,
    MissionType missionType,
    boolean domainRequired,
    String campaignId,
    String dedicatedDomain,
    Double dedicatedReputation,
    Double dedicatedFloor
) implements DecisionContext {

    public static final String NOT_REQUIRED = "NOT_REQUIRED";
    public static final String NO_DEDICATED = "NO_DEDICATED";
    public static final String HAS_DEDICATED = "HAS_DEDICATED";
    public static final String SELECT = "SELECT";

    public DomainSelectionContext {
        Objects.requireNonNull(missionType, "missionType");
        if (dedicatedReputation != null && (dedicatedReputation < 0.0 || dedicatedReputation > 1.0)) {
            throw new IllegalArgumentException("reputation out of range: " + dedicatedReputation);
        }
    }

    @Override
    public RequestType requestType() {
        return RequestType.DOMAIN_SELECTION;
    }

    @Override
    public String stateKey() {
        if (!domainRequired) {
            return NOT_REQUIRED;
        }
        return dedicatedDomain == null ? NO_DEDICATED : HAS_DEDICATED;
    }

    @Override
    public String eventKey() {
        return SELECT;
    }
}
