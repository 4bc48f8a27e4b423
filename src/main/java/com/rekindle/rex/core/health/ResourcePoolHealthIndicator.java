package com.rekindle.rex.core.health;

import com.rekindle.rex.core.resource.DomainStatus;
import com.rekindle.rex.core.resource.ResourceAllocator;
import com.rekindle.rex.core.resource.ResourceSnapshot;
import com.rekindle.rex.core.scheduler.MissionScheduler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator over pool utilisation and the scheduler loops.
 * Reports DEGRADED when any crew or provider pool is exhausted or no domain can send.
 */
@Component
public class ResourcePoolHealthIndicator implements HealthIndicator {

    private final ResourceAllocator allocator;
    private final MissionScheduler scheduler;

    public ResourcePoolHealthIndicator(ResourceAllocator allocator, MissionScheduler scheduler) {
        this.allocator = allocator;
        this.scheduler = scheduler;
    }

    @Override
    public Health health() {
        if (!scheduler.isRunning()) {
            return Health.down().withDetail("scheduler", "stopped").build();
        }

        ResourceSnapshot snapshot = allocator.snapshot();
        var builder = Health.up()
                .withDetail("queued", scheduler.queuedCount())
                .withDetail("pendingRetries", scheduler.pendingRetries())
                .withDetail("liveLeases", snapshot.liveLeases());
        boolean degraded = false;

        for (var entry : snapshot.agentSlots().entrySet()) {
            var slots = entry.getValue();
            builder.withDetail("crew." + entry.getKey(), slots.inUse() + "/" + slots.max());
            if (slots.available() == 0) {
                degraded = true;
            }
        }
        for (var entry : snapshot.apiQuotas().entrySet()) {
            var quota = entry.getValue();
            builder.withDetail("api." + entry.getKey(), quota.available() + "/" + quota.capacity());
            if (quota.available() == 0) {
                degraded = true;
            }
        }
        long activeDomains = snapshot.domains().stream().filter(d -> d.status() == DomainStatus.ACTIVE).count();
        builder.withDetail("activeDomains", activeDomains);
        if (!snapshot.domains().isEmpty() && activeDomains == 0) {
            degraded = true;
        }

        return degraded ? builder.status("DEGRADED").build() : builder.build();
    }
}
