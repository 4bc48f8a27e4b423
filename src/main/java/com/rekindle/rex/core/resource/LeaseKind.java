package com.rekindle.rex.core.resource;

/**
 * Kinds of scarce resource a mission can lease.
 */
public enum LeaseKind {
    AGENT_SLOT,
    DOMAIN,
    API_QUOTA
}
