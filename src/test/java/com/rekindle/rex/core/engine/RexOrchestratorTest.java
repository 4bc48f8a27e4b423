package com.rekindle.rex.core.engine;

import com.rekindle.rex.core.model.MissionState;
import com.rekindle.rex.core.model.MissionType;
import com.rekindle.rex.core.resource.DeliveryOutcome;
import com.rekindle.rex.core.resource.DomainRecord;
import com.rekindle.rex.core.resource.DomainStatus;
import com.rekindle.rex.core.resource.DomainTier;
import com.rekindle.rex.core.resource.ResourceProperties;
import com.rekindle.rex.core.scheduler.UnknownMissionException;
import com.rekindle.rex.core.testing.RexFixture;
import com.rekindle.rex.core.testing.ScriptedReasoner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks through the inbound interface.
 */
class RexOrchestratorTest {

    private RexFixture rex;
    private RexOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        var props = new ResourceProperties();
        props.setWarmupDays(1);
        rex = new RexFixture(ScriptedReasoner.answering("RETRY", 0.8), props);
        orchestrator = new RexOrchestrator(rex.scheduler, rex.allocator, rex.decisionEngine);
    }

    @AfterEach
    void tearDown() {
        rex.close();
    }

    @Test
    @DisplayName("a campaign mission runs on its dedicated domain and completes")
    void campaignLifecycle() {
        orchestrator.registerDomain(DomainRecord.active("shared.example", DomainTier.PRE_WARMED, 0.9));
        orchestrator.registerDomain(DomainRecord.active("acme.example", DomainTier.CUSTOM, 0.8).dedicatedTo("C-acme"));

        String id = orchestrator.submitMission(MissionType.CAMPAIGN_EXECUTION, 60,
                Map.of("budgetRemaining", 500), "C-acme", 40.0);
        rex.scheduler.tickDispatch();

        assertEquals(MissionState.RUNNING, orchestrator.getMissionStatus(id).state());
        var snapshot = orchestrator.getResourceSnapshot();
        assertEquals(1, snapshot.domains().stream()
                .filter(d -> d.name().equals("acme.example")).findFirst().orElseThrow().activeLeases());

        orchestrator.reportProgress(id, 0.5);
        orchestrator.reportCompletion(id, Map.of("sent", 120));

        var status = orchestrator.getMissionStatus(id);
        assertEquals(MissionState.COMPLETED, status.state());
        assertEquals(120, status.result().get("sent"));
        assertEquals(0, orchestrator.getResourceSnapshot().liveLeases());
    }

    @Test
    @DisplayName("delivery feedback and warmup flow through to the domain record")
    void domainFeedback() {
        orchestrator.registerDomain(DomainRecord.warming("new.example", DomainTier.CUSTOM, 0.75));

        assertEquals(DomainStatus.ACTIVE, orchestrator.advanceWarmup("new.example").orElseThrow().status());
        var updated = orchestrator.recordDeliveryOutcome("new.example", DeliveryOutcome.DELIVERED).orElseThrow();
        assertEquals(0.775, updated.reputation(), 1e-9);
    }

    @Test
    @DisplayName("decision stats and audit trail are exposed")
    void decisions() {
        String id = orchestrator.submitMission(MissionType.ICP_EXTRACTION, 50, Map.of());
        rex.scheduler.tickDispatch();
        orchestrator.reportFailure(id, "CARRIER_QUIRK", "odd reply", null);
        rex.scheduler.tickRecovery();

        assertEquals(MissionState.RETRY_PENDING, orchestrator.getMissionStatus(id).state());
        var stats = orchestrator.decisionStats();
        assertTrue(stats.totalDecisions() > 0);
        assertEquals(1L, stats.byLayer().get("llm"));
        var latest = orchestrator.recentDecisions(5);
        assertFalse(latest.isEmpty());
        assertTrue(latest.stream().anyMatch(r -> r.layer().equals("llm") && r.output().equals("RETRY")));
    }

    @Test
    @DisplayName("cancel and unknown ids")
    void cancel() {
        String id = orchestrator.submitMission(MissionType.DOMAIN_ROTATION, 10, Map.of());

        assertTrue(orchestrator.cancelMission(id));
        assertEquals(MissionState.CANCELLED, orchestrator.getMissionStatus(id).state());
        assertThrows(UnknownMissionException.class, () -> orchestrator.getMissionStatus("missing"));
    }
}
