package com.rekindle.rex.core.crew;

import com.rekindle.rex.core.model.MissionType;
import com.rekindle.rex.core.resource.ApiProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CrewRouterTest {

    private final CrewRouter router = new CrewRouter();

    @Test
    @DisplayName("routes every mission type to a crew")
    void routes() {
        assertEquals(CrewRouter.DEAD_LEAD_CREW, router.crewFor(MissionType.LEAD_REACTIVATION));
        assertEquals(CrewRouter.CAMPAIGN_CREW, router.crewFor(MissionType.CAMPAIGN_EXECUTION));
        assertEquals(CrewRouter.AUTO_ICP_CREW, router.crewFor(MissionType.ICP_EXTRACTION));
        assertEquals(CrewRouter.DOMAIN_HEALTH_MONITOR, router.crewFor(MissionType.DOMAIN_ROTATION));
        assertEquals(CrewRouter.SPECIAL_FORCES_COORDINATOR, router.crewFor(MissionType.PERFORMANCE_OPTIMIZATION));
        assertEquals(CrewRouter.SPECIAL_FORCES_COORDINATOR, router.crewFor(MissionType.ERROR_RECOVERY));
    }

    @Test
    @DisplayName("only outreach missions need a sending domain")
    void domains() {
        assertTrue(router.requiresDomain(MissionType.LEAD_REACTIVATION));
        assertTrue(router.requiresDomain(MissionType.CAMPAIGN_EXECUTION));
        assertFalse(router.requiresDomain(MissionType.ICP_EXTRACTION));
        assertFalse(router.requiresDomain(MissionType.DOMAIN_ROTATION));
    }

    @Test
    @DisplayName("API estimates omit providers a mission does not use")
    void estimates() {
        assertEquals(Map.of(ApiProvider.LLM, 200L, ApiProvider.EMAIL, 100L, ApiProvider.SMS, 20L),
                router.apiEstimates(MissionType.CAMPAIGN_EXECUTION));
        assertEquals(Map.of(ApiProvider.LLM, 50L), router.apiEstimates(MissionType.ICP_EXTRACTION));
        assertTrue(router.apiEstimates(MissionType.DOMAIN_ROTATION).isEmpty());
    }
}
