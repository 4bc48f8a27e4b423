package com.rekindle.rex.core.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sending domains ranked by reputation tier.
 * <p>
 * Selection order is the campaign's dedicated domain, then the shared custom tier, then the
 * shared pre-warmed tier, round-robin within a tier. Eligibility (status, floor, lease count)
 * is evaluated at selection time only; leases already issued are never revoked.
 */
final class DomainPool {

    private static final Logger log = LoggerFactory.getLogger(DomainPool.class);

    private static final List<DomainTier> SHARED_ORDER = List.of(DomainTier.CUSTOM, DomainTier.PRE_WARMED);

    private final ResourceProperties properties;
    private final Map<String, Entry> domains = new LinkedHashMap<>();
    private final Map<DomainTier, Integer> cursors = new EnumMap<>(DomainTier.class);

    DomainPool(ResourceProperties properties) {
        this.properties = properties;
    }

    synchronized DomainRecord register(DomainRecord record) {
        if (domains.containsKey(record.name())) {
            throw new IllegalArgumentException("Domain already registered: " + record.name());
        }
        var entry = new Entry(record);
        domains.put(record.name(), entry);
        log.info("Registered domain {} ({}, {}, reputation {})", record.name(), record.tier(), record.status(),
                String.format("%.2f", record.reputation()));
        return entry.toRecord();
    }

    /**
     * Picks a domain and takes a lease on it.
     */
    synchronized Optional<DomainRecord> acquire(String campaignId, boolean preferDedicated) {
        if (campaignId != null && preferDedicated) {
            for (Entry entry : domains.values()) {
                if (campaignId.equals(entry.dedicatedCampaignId) && eligible(entry)) {
                    return Optional.of(take(entry));
                }
            }
        }
        for (DomainTier tier : SHARED_ORDER) {
            List<Entry> candidates = new ArrayList<>();
            for (Entry entry : domains.values()) {
                if (entry.tier == tier && entry.dedicatedCampaignId == null && eligible(entry)) {
                    candidates.add(entry);
                }
            }
            if (!candidates.isEmpty()) {
                candidates.sort(Comparator.comparing(e -> e.name));
                int cursor = cursors.getOrDefault(tier, 0);
                Entry chosen = candidates.get(Math.floorMod(cursor, candidates.size()));
                cursors.put(tier, cursor + 1);
                return Optional.of(take(chosen));
            }
        }
        return Optional.empty();
    }

    synchronized void release(String name) {
        Entry entry = domains.get(name);
        if (entry != null && entry.activeLeases > 0) {
            entry.activeLeases--;
        }
    }

    /**
     * Folds one delivery outcome into the domain's reputation.
     *
     * @return the updated record, or empty if the domain is unknown
     */
    synchronized Optional<DomainRecord> recordOutcome(String name, DeliveryOutcome outcome) {
        Entry entry = domains.get(name);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.status == DomainStatus.RETIRED) {
            log.debug("Ignoring {} for retired domain {}", outcome, name);
            return Optional.of(entry.toRecord());
        }
        double alpha = Math.min(1.0, properties.getReputationSmoothing() * outcome.weight());
        double updated = entry.reputation + alpha * (outcome.signal() - entry.reputation);
        entry.reputation = Math.max(0.0, Math.min(1.0, updated));

        double floor = properties.floorFor(entry.tier);
        if (entry.reputation < floor) {
            entry.consecutiveSubFloor++;
            if (entry.status == DomainStatus.ACTIVE) {
                entry.status = DomainStatus.COOLING_DOWN;
                log.warn("Domain {} fell below its {} floor ({} < {}), cooling down", name, entry.tier,
                        String.format("%.3f", entry.reputation), floor);
            }
            if (entry.status != DomainStatus.WARMING
                    && entry.consecutiveSubFloor >= properties.getRetireAfterSubFloorReadings()) {
                entry.status = DomainStatus.RETIRED;
                log.warn("Domain {} retired after {} consecutive sub-floor readings", name, entry.consecutiveSubFloor);
            }
        } else {
            entry.consecutiveSubFloor = 0;
            if (entry.status == DomainStatus.COOLING_DOWN) {
                entry.status = DomainStatus.ACTIVE;
                log.info("Domain {} recovered to {}, active again", name, String.format("%.3f", entry.reputation));
            }
        }
        return Optional.of(entry.toRecord());
    }

    synchronized Optional<DomainRecord> advanceWarmup(String name) {
        Entry entry = domains.get(name);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.status == DomainStatus.WARMING) {
            entry.warmupDay++;
            if (entry.warmupDay >= properties.getWarmupDays()) {
                entry.status = DomainStatus.ACTIVE;
                log.info("Domain {} finished warmup after {} days", name, entry.warmupDay);
            }
        }
        return Optional.of(entry.toRecord());
    }

    synchronized Optional<DomainRecord> find(String name) {
        Entry entry = domains.get(name);
        return entry == null ? Optional.empty() : Optional.of(entry.toRecord());
    }

    synchronized Optional<DomainRecord> dedicatedTo(String campaignId) {
        if (campaignId == null) {
            return Optional.empty();
        }
        return domains.values().stream()
                .filter(e -> campaignId.equals(e.dedicatedCampaignId) && e.status != DomainStatus.RETIRED)
                .findFirst()
                .map(Entry::toRecord);
    }

    /** Whether any shared domain could be selected right now. */
    synchronized boolean hasEligibleSharedDomain() {
        return domains.values().stream().anyMatch(e -> e.dedicatedCampaignId == null && eligible(e));
    }

    synchronized List<DomainRecord> records() {
        return domains.values().stream().map(Entry::toRecord).toList();
    }

    private boolean eligible(Entry entry) {
        return entry.status == DomainStatus.ACTIVE
                && entry.reputation >= properties.floorFor(entry.tier)
                && entry.activeLeases < properties.getMaxLeasesPerDomain();
    }

    private DomainRecord take(Entry entry) {
        entry.activeLeases++;
        return entry.toRecord();
    }

    private static final class Entry {
        final String name;
        final DomainTier tier;
        final String dedicatedCampaignId;
        double reputation;
        int warmupDay;
        DomainStatus status;
        int consecutiveSubFloor;
        int activeLeases;

        Entry(DomainRecord record) {
            this.name = record.name();
            this.tier = record.tier();
            this.dedicatedCampaignId = record.dedicatedCampaignId();
            this.reputation = record.reputation();
            this.warmupDay = record.warmupDay();
            this.status = record.status();
            this.consecutiveSubFloor = record.consecutiveSubFloor();
        }

        DomainRecord toRecord() {
            return new DomainRecord(name, tier, reputation, warmupDay, status, dedicatedCampaignId,
                    consecutiveSubFloor, activeLeases);
        }
    }
}
