package com.rekindle.rex.core.resource;

import java.io.Serializable;

/**
 * Snapshot of a sending domain.
 *
 * @param warmupDay               days of warmup completed
 * @param dedicatedCampaignId     campaign this domain is reserved for, or {@code null} for the shared pools
 * @param consecutiveSubFloor     consecutive reputation readings below the tier floor
 * @param activeLeases            leases currently issued on this domain
 */
public record DomainRecord(
    String name,
    DomainTier tier,
    double reputation,
    int warmupDay,
    DomainStatus status,
    String dedicatedCampaignId,
    int consecutiveSubFloor,
    int activeLeases
) implements Serializable {

    public DomainRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("domain name is required");
        }
        if (reputation < 0.0 || reputation > 1.0) {
            throw new IllegalArgumentException("reputation out of range: " + reputation);
        }
    }

    /** A provisioned domain ready for sending. */
    public static DomainRecord active(String name, DomainTier tier, double reputation) {
        return new DomainRecord(name, tier, reputation, 0, DomainStatus.ACTIVE, null, 0, 0);
    }

    /** A freshly provisioned domain still building reputation. */
    public static DomainRecord warming(String name, DomainTier tier, double reputation) {
        return new DomainRecord(name, tier, reputation, 0, DomainStatus.WARMING, null, 0, 0);
    }

    public DomainRecord dedicatedTo(String campaignId) {
        return new DomainRecord(name, tier, reputation, warmupDay, status, campaignId, consecutiveSubFloor, activeLeases);
    }
}
