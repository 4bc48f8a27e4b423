package com.rekindle.rex.core.crew;

import com.rekindle.rex.core.model.MissionType;
import com.rekindle.rex.core.resource.ApiProvider;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static routing of mission types to worker crews, with each type's resource needs.
 */
@Component
public class CrewRouter {

    public static final String DEAD_LEAD_CREW = "dead_lead_crew";
    public static final String CAMPAIGN_CREW = "campaign_crew";
    public static final String AUTO_ICP_CREW = "auto_icp_crew";
    public static final String DOMAIN_HEALTH_MONITOR = "domain_health_monitor";
    public static final String SPECIAL_FORCES_COORDINATOR = "special_forces_coordinator";

    private final Map<MissionType, Map<ApiProvider, Long>> estimates = new EnumMap<>(MissionType.class);

    public CrewRouter() {
        estimates.put(MissionType.LEAD_REACTIVATION, usage(100, 50, 10));
        estimates.put(MissionType.CAMPAIGN_EXECUTION, usage(200, 100, 20));
        estimates.put(MissionType.ICP_EXTRACTION, usage(50, 0, 0));
        estimates.put(MissionType.DOMAIN_ROTATION, usage(0, 0, 0));
        estimates.put(MissionType.PERFORMANCE_OPTIMIZATION, usage(30, 0, 0));
        estimates.put(MissionType.ERROR_RECOVERY, usage(10, 0, 0));
    }

    public String crewFor(MissionType type) {
        return switch (type) {
            case LEAD_REACTIVATION -> DEAD_LEAD_CREW;
            case CAMPAIGN_EXECUTION -> CAMPAIGN_CREW;
            case ICP_EXTRACTION -> AUTO_ICP_CREW;
            case DOMAIN_ROTATION -> DOMAIN_HEALTH_MONITOR;
            case PERFORMANCE_OPTIMIZATION, ERROR_RECOVERY -> SPECIAL_FORCES_COORDINATOR;
        };
    }

    /** Whether missions of this type send outreach and therefore need a sending domain. */
    public boolean requiresDomain(MissionType type) {
        return type == MissionType.LEAD_REACTIVATION || type == MissionType.CAMPAIGN_EXECUTION;
    }

    /**
     * Expected provider usage per mission, zero entries omitted.
     */
    public Map<ApiProvider, Long> apiEstimates(MissionType type) {
        return estimates.get(type);
    }

    private static Map<ApiProvider, Long> usage(long llm, long email, long sms) {
        var map = new EnumMap<ApiProvider, Long>(ApiProvider.class);
        if (llm > 0) map.put(ApiProvider.LLM, llm);
        if (email > 0) map.put(ApiProvider.EMAIL, email);
        if (sms > 0) map.put(ApiProvider.SMS, sms);
        return Collections.unmodifiableMap(map);
    }
}
