package com.rekindle.rex.core.resource;

import com.rekindle.rex.core.events.EventBus;
import com.rekindle.rex.core.events.RexEvent;
import com.rekindle.rex.core.events.RexEventTypes;
import com.rekindle.rex.core.metrics.RexMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Sole owner of pool state: agent slots per crew, sending domains and provider API budgets.
 * <p>
 * Requests never block. A denial is a normal result and the caller decides when to retry.
 * {@link #acquire} is repeatable: a holder asking again for a kind it already holds gets the
 * same lease back, so repeated attempts never reserve twice. {@link #release} tolerates unknown
 * and already-released ids.
 */
@Service
public class ResourceAllocator {

    private static final Logger log = LoggerFactory.getLogger(ResourceAllocator.class);

    static final String DOMAIN_POOL = "domain";

    private final ResourceProperties properties;
    private final EventBus eventBus;
    private final RexMetrics metrics;
    private final Clock clock;

    private final AgentSlotPool agentSlots;
    private final DomainPool domains;
    private final ApiQuotaPool apiQuotas;

    private final Map<String, Lease> leases = new ConcurrentHashMap<>();
    /** holderId + "|" + kindKey → leaseId */
    private final Map<String, String> byHolder = new ConcurrentHashMap<>();
    private final Set<String> exhaustedPools = new HashSet<>();
    private final List<String> newlyExhausted = new ArrayList<>();
    private final List<Consumer<Lease>> releaseListeners = new CopyOnWriteArrayList<>();

    public ResourceAllocator(ResourceProperties properties, EventBus eventBus, RexMetrics metrics, Clock clock) {
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.agentSlots = new AgentSlotPool(properties, properties.getCrews());
        this.domains = new DomainPool(properties);
        this.apiQuotas = new ApiQuotaPool(properties.getProviders(), clock);
    }

    /**
     * Requests a lease.
     *
     * @param kind        what to lease
     * @param holderId    the requesting mission
     * @param constraints crew, campaign or provider details for {@code kind}
     * @return {@link AcquireResult.Granted} with the lease, or {@link AcquireResult.Denied} with a reason
     */
    public AcquireResult acquire(LeaseKind kind, String holderId, LeaseConstraints constraints) {
        String kindKey = Lease.kindKey(kind, constraints.provider());
        Lease stale;
        AcquireResult result;
        List<String> exhausted;
        synchronized (this) {
            Lease existing = leaseOf(holderId, kindKey);
            if (existing != null && !existing.isExpired(clock.instant())) {
                log.debug("Mission {} already holds {} lease {}", holderId, kindKey, existing.leaseId());
                return new AcquireResult.Granted(existing);
            }
            stale = existing != null ? releaseLocked(existing.leaseId()) : null;
            result = switch (kind) {
                case AGENT_SLOT -> acquireAgentSlot(holderId, constraints.crew());
                case DOMAIN -> acquireDomain(holderId, constraints);
                case API_QUOTA -> acquireApiQuota(holderId, constraints.provider(), constraints.amount());
            };
            exhausted = List.copyOf(newlyExhausted);
            newlyExhausted.clear();
        }
        if (stale != null) {
            log.warn("Replaced expired {} lease {} held by mission {}", stale.kind(), stale.leaseId(), holderId);
            afterRelease(stale);
        }
        metrics.recordLeaseRequest(kind.name(), result.granted());
        if (result instanceof AcquireResult.Granted granted) {
            Lease lease = granted.lease();
            log.info("Lease granted: {} {} → mission {}", lease.kind(), lease.resourceId(), holderId);
            eventBus.publish(new RexEvent(RexEventTypes.LEASE_GRANTED, holderId, leasePayload(lease), lease.acquiredAt()));
        } else if (result instanceof AcquireResult.Denied denied) {
            log.debug("Lease denied: {} for mission {}: {}", kindKey, holderId, denied.reason());
        }
        exhausted.forEach(this::publishExhausted);
        return result;
    }

    /**
     * Releases a lease. Unknown or already-released ids are ignored.
     *
     * @return true if a live lease was released by this call
     */
    public boolean release(String leaseId) {
        Lease lease;
        synchronized (this) {
            lease = releaseLocked(leaseId);
        }
        if (lease == null) {
            log.debug("Release of unknown or already released lease {} ignored", leaseId);
            return false;
        }
        afterRelease(lease);
        return true;
    }

    /**
     * Pushes the expiry of every live lease held by {@code holderId} one TTL past now. Holders
     * renew while they make progress, so only leases of silent or vanished holders are reaped.
     *
     * @return the number of leases renewed
     */
    public synchronized int renew(String holderId) {
        Instant now = clock.instant();
        int renewed = 0;
        for (Lease lease : leases.values()) {
            if (lease.holderId().equals(holderId) && !lease.isExpired(now)) {
                leases.put(lease.leaseId(), lease.renewedUntil(now.plus(properties.ttlFor(lease.kind()))));
                renewed++;
            }
        }
        if (renewed > 0) {
            log.debug("Renewed {} lease(s) held by mission {}", renewed, holderId);
        }
        return renewed;
    }

    /**
     * Releases every lease whose expiry has passed.
     *
     * @return the number of leases reaped
     */
    public int reapExpired() {
        Instant now = clock.instant();
        List<Lease> expired = leases.values().stream().filter(l -> l.isExpired(now)).toList();
        int reaped = 0;
        for (Lease candidate : expired) {
            Lease lease;
            synchronized (this) {
                Lease current = leases.get(candidate.leaseId());
                // renewed since the scan
                lease = current != null && current.isExpired(now) ? releaseLocked(current.leaseId()) : null;
            }
            if (lease != null) {
                log.warn("Reaped expired {} lease {} held by mission {}", lease.kind(), lease.leaseId(), lease.holderId());
                afterRelease(lease);
                reaped++;
            }
        }
        return reaped;
    }

    public boolean isLive(String leaseId) {
        return leases.containsKey(leaseId);
    }

    public List<Lease> leasesHeldBy(String holderId) {
        return leases.values().stream().filter(l -> l.holderId().equals(holderId)).toList();
    }

    public DomainRecord registerDomain(DomainRecord record) {
        DomainRecord registered = domains.register(record);
        rearmDomainPool();
        return registered;
    }

    /**
     * Folds delivery feedback into a domain's reputation. Issued leases are not affected.
     */
    public Optional<DomainRecord> recordDeliveryOutcome(String domain, DeliveryOutcome outcome) {
        Optional<DomainRecord> updated = domains.recordOutcome(domain, outcome);
        if (updated.isEmpty()) {
            log.warn("Delivery outcome {} for unknown domain {} ignored", outcome, domain);
            return updated;
        }
        rearmDomainPool();
        return updated;
    }

    public Optional<DomainRecord> advanceWarmup(String domain) {
        Optional<DomainRecord> updated = domains.advanceWarmup(domain);
        rearmDomainPool();
        return updated;
    }

    public Optional<DomainRecord> domain(String name) {
        return domains.find(name);
    }

    public Optional<DomainRecord> dedicatedDomain(String campaignId) {
        return domains.dedicatedTo(campaignId);
    }

    public double floorFor(DomainTier tier) {
        return properties.floorFor(tier);
    }

    /**
     * Fraction of each provider's budget currently spent, keyed by provider name.
     */
    public Map<String, Double> providerUtilization() {
        return apiQuotas.utilization();
    }

    public ResourceSnapshot snapshot() {
        return new ResourceSnapshot(clock.instant(), agentSlots.states(), domains.records(), apiQuotas.states(),
                leases.size());
    }

    /**
     * Registers a callback run after every release, outside the allocator's lock.
     */
    public void onRelease(Consumer<Lease> listener) {
        releaseListeners.add(listener);
    }

    private synchronized void rearmDomainPool() {
        if (domains.hasEligibleSharedDomain()) {
            exhaustedPools.remove(DOMAIN_POOL);
        }
    }

    // Called with the allocator lock held

    private AcquireResult acquireAgentSlot(String holderId, String crew) {
        String pool = agentPool(crew);
        if (!agentSlots.tryAcquire(crew)) {
            markExhausted(pool);
            return new AcquireResult.Denied("no agent slots available for " + crew);
        }
        Lease lease = issue(LeaseKind.AGENT_SLOT, crew, holderId, 1);
        if (agentSlots.available(crew) == 0) {
            markExhausted(pool);
        }
        return new AcquireResult.Granted(lease);
    }

    private AcquireResult acquireDomain(String holderId, LeaseConstraints constraints) {
        Optional<DomainRecord> chosen = domains.acquire(constraints.campaignId(), constraints.preferDedicated());
        if (chosen.isEmpty()) {
            markExhausted(DOMAIN_POOL);
            return new AcquireResult.Denied("no eligible sending domain");
        }
        Lease lease = issue(LeaseKind.DOMAIN, chosen.get().name(), holderId, 1);
        if (!domains.hasEligibleSharedDomain()) {
            markExhausted(DOMAIN_POOL);
        }
        return new AcquireResult.Granted(lease);
    }

    private AcquireResult acquireApiQuota(String holderId, ApiProvider provider, long amount) {
        String pool = apiPool(provider);
        if (!apiQuotas.tryConsume(provider, amount)) {
            markExhausted(pool);
            return new AcquireResult.Denied("API quota exhausted for " + provider.serviceName()
                    + " (requested " + amount + ", available " + apiQuotas.available(provider) + ")");
        }
        if (apiQuotas.available(provider) == 0) {
            markExhausted(pool);
        } else {
            exhaustedPools.remove(pool);
        }
        return new AcquireResult.Granted(issue(LeaseKind.API_QUOTA, provider.name(), holderId, amount));
    }

    private Lease issue(LeaseKind kind, String resourceId, String holderId, long amount) {
        Instant now = clock.instant();
        var lease = new Lease(UUID.randomUUID().toString(), kind, resourceId, holderId, now,
                now.plus(properties.ttlFor(kind)), amount);
        leases.put(lease.leaseId(), lease);
        byHolder.put(holderKey(holderId, lease.kindKey()), lease.leaseId());
        return lease;
    }

    /** Edge-triggered: re-armed when the pool regains capacity. */
    private void markExhausted(String pool) {
        if (exhaustedPools.add(pool)) {
            newlyExhausted.add(pool);
        }
    }

    private Lease leaseOf(String holderId, String kindKey) {
        String leaseId = byHolder.get(holderKey(holderId, kindKey));
        return leaseId == null ? null : leases.get(leaseId);
    }

    private Lease releaseLocked(String leaseId) {
        Lease lease = leases.remove(leaseId);
        if (lease == null) {
            return null;
        }
        byHolder.remove(holderKey(lease.holderId(), lease.kindKey()), leaseId);
        switch (lease.kind()) {
            case AGENT_SLOT -> {
                agentSlots.release(lease.resourceId());
                exhaustedPools.remove(agentPool(lease.resourceId()));
            }
            case DOMAIN -> {
                domains.release(lease.resourceId());
                if (domains.hasEligibleSharedDomain()) {
                    exhaustedPools.remove(DOMAIN_POOL);
                }
            }
            case API_QUOTA -> { }
        }
        return lease;
    }

    // Called without the allocator lock

    private void publishExhausted(String pool) {
        log.warn("Resource pool exhausted: {}", pool);
        metrics.recordPoolExhausted(pool);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("pool", pool);
        eventBus.publish(new RexEvent(RexEventTypes.POOL_EXHAUSTED, null, payload, clock.instant()));
    }

    private void afterRelease(Lease lease) {
        log.info("Lease released: {} {} from mission {}", lease.kind(), lease.resourceId(), lease.holderId());
        eventBus.publish(new RexEvent(RexEventTypes.LEASE_RELEASED, lease.holderId(), leasePayload(lease),
                clock.instant()));
        for (Consumer<Lease> listener : releaseListeners) {
            try {
                listener.accept(lease);
            } catch (RuntimeException e) {
                log.warn("Release listener failed for lease {}: {}", lease.leaseId(), e.getMessage(), e);
            }
        }
    }

    private static Map<String, Object> leasePayload(Lease lease) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("leaseId", lease.leaseId());
        payload.put("kind", lease.kind().name());
        payload.put("resourceId", lease.resourceId());
        payload.put("amount", lease.amount());
        payload.put("expiresAt", lease.expiresAt().toString());
        return payload;
    }

    private static String holderKey(String holderId, String kindKey) {
        return holderId + "|" + kindKey;
    }

    private static String agentPool(String crew) {
        return "agent:" + crew;
    }

    private static String apiPool(ApiProvider provider) {
        return "api:" + provider.name();
    }
}
