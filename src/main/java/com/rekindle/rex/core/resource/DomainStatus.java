package com.rekindle.rex.core.resource;

/**
 * Lifecycle of a sending domain. Only {@link #ACTIVE} domains are ever selected.
 */
public enum DomainStatus {
    WARMING,
    ACTIVE,
    COOLING_DOWN,
    RETIRED
}
