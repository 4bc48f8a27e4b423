package com.rekindle.rex.core.health;

import com.rekindle.rex.core.resource.DomainRecord;
import com.rekindle.rex.core.resource.DomainStatus;
import com.rekindle.rex.core.resource.DomainTier;
import com.rekindle.rex.core.resource.ResourceAllocator;
import com.rekindle.rex.core.resource.ResourceSnapshot;
import com.rekindle.rex.core.resource.ResourceSnapshot.CrewSlots;
import com.rekindle.rex.core.resource.ResourceSnapshot.QuotaState;
import com.rekindle.rex.core.scheduler.MissionScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ResourcePoolHealthIndicatorTest {

    private ResourceAllocator allocator;
    private MissionScheduler scheduler;
    private ResourcePoolHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        allocator = mock(ResourceAllocator.class);
        scheduler = mock(MissionScheduler.class);
        indicator = new ResourcePoolHealthIndicator(allocator, scheduler);
        when(scheduler.isRunning()).thenReturn(true);
    }

    private static ResourceSnapshot snapshot(int crewAvailable, long emailAvailable, List<DomainRecord> domains) {
        return new ResourceSnapshot(Instant.parse("2026-03-02T09:00:00Z"),
                Map.of("dead_lead_crew", new CrewSlots(3, 3 - crewAvailable, crewAvailable)),
                domains,
                Map.of("EMAIL", new QuotaState("sendgrid", 1000, emailAvailable, 1.0 - emailAvailable / 1000.0)),
                3 - crewAvailable);
    }

    @Test
    @DisplayName("UP when pools have capacity")
    void up() {
        when(allocator.snapshot()).thenReturn(snapshot(2, 800,
                List.of(DomainRecord.active("mail-a.example", DomainTier.CUSTOM, 0.9))));

        var health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("1/3", health.getDetails().get("crew.dead_lead_crew"));
        assertEquals("800/1000", health.getDetails().get("api.EMAIL"));
        assertEquals(1L, health.getDetails().get("activeDomains"));
    }

    @Test
    @DisplayName("DEGRADED when a crew has no free slot")
    void crewExhausted() {
        when(allocator.snapshot()).thenReturn(snapshot(0, 800, List.of()));
        assertEquals("DEGRADED", indicator.health().getStatus().getCode());
    }

    @Test
    @DisplayName("DEGRADED when a provider budget is spent")
    void quotaExhausted() {
        when(allocator.snapshot()).thenReturn(snapshot(2, 0, List.of()));
        assertEquals("DEGRADED", indicator.health().getStatus().getCode());
    }

    @Test
    @DisplayName("DEGRADED when no registered domain can send")
    void noActiveDomain() {
        var cooling = new DomainRecord("mail-a.example", DomainTier.CUSTOM, 0.6, 14, DomainStatus.COOLING_DOWN,
                null, 1, 0);
        when(allocator.snapshot()).thenReturn(snapshot(2, 800, List.of(cooling)));
        assertEquals("DEGRADED", indicator.health().getStatus().getCode());
    }

    @Test
    @DisplayName("DOWN when the scheduler is stopped")
    void down() {
        when(scheduler.isRunning()).thenReturn(false);

        var health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        verifyNoInteractions(allocator);
    }
}
