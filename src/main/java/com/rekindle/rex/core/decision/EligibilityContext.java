package com.rekindle.rex.core.decision;

import com.rekindle.rex.core.model.MissionType;

import java.util.Map;
import java.util.Objects;

/**
 * Context for {@link RequestType#ELIGIBILITY_CHECK}: may a queued mission be dispatched now.
 *
 * @param providerUtilization fraction (0..1) of each required provider's budget already spent
 */
public record EligibilityContext(
    String missionId,
    MissionType missionType,
    int priority,
    Double estimatedCost,
    Double budgetRemaining,
    Map<String, Double> providerUtilization
) implements DecisionContext {

    public static final String MAINTENANCE = "MAINTENANCE";
    public static final String OUTREACH = "OUTREACH";
    public static final String ADMIT = "ADMIT";

    public EligibilityContext {
        Objects.requireNonNull(missionType, "missionType");
        providerUtilization = providerUtilization != null ? Map.copyOf(providerUtilization) : Map.of();
    }

    @Override
    public RequestType requestType() {
        return RequestType.ELIGIBILITY_CHECK;
    }

    @Override
    public String stateKey() {
        return switch (missionType) {
            case DOMAIN_ROTATION, ERROR_RECOVERY -> MAINTENANCE;
            default -> OUTREACH;
        };
    }

    @Override
    public String eventKey() {
        return ADMIT;
    }
}
