package com.rekindle.rex.core.resource;

public enum DomainTier {
    CUSTOM,
    PRE_WARMED
}
