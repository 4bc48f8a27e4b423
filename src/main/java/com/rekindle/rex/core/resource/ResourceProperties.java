package com.rekindle.rex.core.resource;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pool sizes, reputation floors and lease lifetimes for the {@link ResourceAllocator}.
 */
@Component
@ConfigurationProperties(prefix = "rex.resources")
public class ResourceProperties {

    /** Concurrent missions per crew unless overridden in {@link #crewSlots}. */
    private int defaultCrewSlots = 3;
    private Map<String, Integer> crewSlots = new HashMap<>();
    /** Crews whose pools are created up front and always appear in snapshots. */
    private List<String> crews = new ArrayList<>(List.of(
            "dead_lead_crew", "campaign_crew", "auto_icp_crew", "domain_health_monitor",
            "special_forces_coordinator"));

    private double customFloor = 0.7;
    private double prewarmedFloor = 0.8;
    private int maxLeasesPerDomain = 1;
    /** Weight of the newest delivery outcome in the reputation average. */
    private double reputationSmoothing = 0.1;
    private int retireAfterSubFloorReadings = 5;
    private int warmupDays = 14;

    private Duration agentSlotTtl = Duration.ofHours(3);
    private Duration domainTtl = Duration.ofHours(3);
    private Duration apiQuotaTtl = Duration.ofHours(3);

    private Map<ApiProvider, ProviderQuota> providers = defaultProviders();

    public int getDefaultCrewSlots() { return defaultCrewSlots; }
    public void setDefaultCrewSlots(int defaultCrewSlots) { this.defaultCrewSlots = defaultCrewSlots; }
    public Map<String, Integer> getCrewSlots() { return crewSlots; }
    public void setCrewSlots(Map<String, Integer> crewSlots) { this.crewSlots = crewSlots; }
    public List<String> getCrews() { return crews; }
    public void setCrews(List<String> crews) { this.crews = crews; }
    public double getCustomFloor() { return customFloor; }
    public void setCustomFloor(double customFloor) { this.customFloor = customFloor; }
    public double getPrewarmedFloor() { return prewarmedFloor; }
    public void setPrewarmedFloor(double prewarmedFloor) { this.prewarmedFloor = prewarmedFloor; }
    public int getMaxLeasesPerDomain() { return maxLeasesPerDomain; }
    public void setMaxLeasesPerDomain(int maxLeasesPerDomain) { this.maxLeasesPerDomain = maxLeasesPerDomain; }
    public double getReputationSmoothing() { return reputationSmoothing; }
    public void setReputationSmoothing(double reputationSmoothing) { this.reputationSmoothing = reputationSmoothing; }
    public int getRetireAfterSubFloorReadings() { return retireAfterSubFloorReadings; }
    public void setRetireAfterSubFloorReadings(int retireAfterSubFloorReadings) {
        this.retireAfterSubFloorReadings = retireAfterSubFloorReadings;
    }
    public int getWarmupDays() { return warmupDays; }
    public void setWarmupDays(int warmupDays) { this.warmupDays = warmupDays; }
    public Duration getAgentSlotTtl() { return agentSlotTtl; }
    public void setAgentSlotTtl(Duration agentSlotTtl) { this.agentSlotTtl = agentSlotTtl; }
    public Duration getDomainTtl() { return domainTtl; }
    public void setDomainTtl(Duration domainTtl) { this.domainTtl = domainTtl; }
    public Duration getApiQuotaTtl() { return apiQuotaTtl; }
    public void setApiQuotaTtl(Duration apiQuotaTtl) { this.apiQuotaTtl = apiQuotaTtl; }
    public Map<ApiProvider, ProviderQuota> getProviders() { return providers; }
    public void setProviders(Map<ApiProvider, ProviderQuota> providers) { this.providers = providers; }

    public int slotsFor(String crew) {
        return crewSlots.getOrDefault(crew, defaultCrewSlots);
    }

    public double floorFor(DomainTier tier) {
        return tier == DomainTier.CUSTOM ? customFloor : prewarmedFloor;
    }

    public Duration ttlFor(LeaseKind kind) {
        return switch (kind) {
            case AGENT_SLOT -> agentSlotTtl;
            case DOMAIN -> domainTtl;
            case API_QUOTA -> apiQuotaTtl;
        };
    }

    private static Map<ApiProvider, ProviderQuota> defaultProviders() {
        var map = new EnumMap<ApiProvider, ProviderQuota>(ApiProvider.class);
        map.put(ApiProvider.LLM, new ProviderQuota(10_000, 10_000, Duration.ofMinutes(1)));
        map.put(ApiProvider.EMAIL, new ProviderQuota(1_000, 1_000, Duration.ofHours(1)));
        map.put(ApiProvider.SMS, new ProviderQuota(500, 500, Duration.ofHours(1)));
        return map;
    }

    /**
     * Token-bucket shape for one provider: {@code refillAmount} tokens every {@code refillPeriod},
     * never above {@code capacity}.
     */
    public static class ProviderQuota {
        private long capacity;
        private long refillAmount;
        private Duration refillPeriod;

        public ProviderQuota() {
        }

        public ProviderQuota(long capacity, long refillAmount, Duration refillPeriod) {
            this.capacity = capacity;
            this.refillAmount = refillAmount;
            this.refillPeriod = refillPeriod;
        }

        public long getCapacity() { return capacity; }
        public void setCapacity(long capacity) { this.capacity = capacity; }
        public long getRefillAmount() { return refillAmount; }
        public void setRefillAmount(long refillAmount) { this.refillAmount = refillAmount; }
        public Duration getRefillPeriod() { return refillPeriod; }
        public void setRefillPeriod(Duration refillPeriod) { this.refillPeriod = refillPeriod; }
    }
}
