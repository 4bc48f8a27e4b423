package com.rekindle.rex.core.model;

/**
 * Kind of orchestrated outreach work. The crew that executes each type and the
 * resources it needs are resolved by the scheduler's crew router.
 */
public enum MissionType {
    LEAD_REACTIVATION,
    CAMPAIGN_EXECUTION,
    ICP_EXTRACTION,
    DOMAIN_ROTATION,
    PERFORMANCE_OPTIMIZATION,
    ERROR_RECOVERY
}
