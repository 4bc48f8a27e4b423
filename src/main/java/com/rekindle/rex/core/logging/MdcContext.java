package com.rekindle.rex.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Rex-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setMission(String missionId) {
        MDC.put("missionId", missionId);
    }

    public static void setMission(String missionId, String crew) {
        MDC.put("missionId", missionId);
        if (crew != null) {
            MDC.put("crew", crew);
        }
    }

    public static void setDecision(String requestType) {
        MDC.put("requestType", requestType);
    }

    public static void clearDecision() {
        MDC.remove("requestType");
    }

    public static void clear() {
        MDC.remove("missionId");
        MDC.remove("crew");
        MDC.remove("requestType");
    }
}
