package com.rekindle.rex.core.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MissionTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private Mission mission;

    @BeforeEach
    void setUp() {
        mission = new Mission("M-1", MissionType.LEAD_REACTIVATION, 70,
                Map.of("leadIds", "L1,L2"), "C-1", 12.5, 2, T0, 1);
    }

    // -- Lifecycle ------------------------------------------------------------

    @Nested
    @DisplayName("MissionState")
    class StateTests {

        @ParameterizedTest
        @EnumSource(value = MissionState.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
        @DisplayName("terminal states admit no successor")
        void terminalStatesAreClosed(MissionState terminal) {
            assertTrue(terminal.isTerminal());
            for (MissionState target : MissionState.values()) {
                assertFalse(terminal.canTransitionTo(target));
            }
        }

        @Test
        @DisplayName("RETRY_PENDING only re-enters the queue, fails or is cancelled")
        void retryPendingSuccessors() {
            assertTrue(MissionState.RETRY_PENDING.canTransitionTo(MissionState.QUEUED));
            assertFalse(MissionState.RETRY_PENDING.canTransitionTo(MissionState.RUNNING));
            assertFalse(MissionState.QUEUED.canTransitionTo(MissionState.RUNNING));
        }
    }

    @Nested
    @DisplayName("moveTo")
    class MoveToTests {

        @Test
        @DisplayName("starts the progress clock on RUNNING and stamps completion")
        void stampsTimes() {
            Instant started = T0.plusSeconds(5);
            mission.moveTo(MissionState.ASSIGNED, T0.plusSeconds(1));
            mission.moveTo(MissionState.RUNNING, started);

            assertEquals(started, mission.startedAt());
            assertEquals(started, mission.lastProgressAt());

            mission.moveTo(MissionState.COMPLETED, T0.plusSeconds(60));
            assertEquals(T0.plusSeconds(60), mission.completedAt());
        }

        @Test
        @DisplayName("rejects a transition the lifecycle forbids")
        void rejectsIllegalTransition() {
            var ex = assertThrows(IllegalStateException.class,
                    () -> mission.moveTo(MissionState.COMPLETED, T0));
            assertTrue(ex.getMessage().contains("QUEUED -> COMPLETED"));
            assertEquals(MissionState.QUEUED, mission.state());
        }
    }

    // -- Counters and leases --------------------------------------------------

    @Test
    @DisplayName("retry count never exceeds max retries")
    void retryBudget() {
        mission.incrementRetryCount();
        mission.incrementRetryCount();
        assertFalse(mission.hasRetryBudget());
        assertThrows(IllegalStateException.class, mission::incrementRetryCount);
        assertEquals(2, mission.retryCount());
    }

    @Test
    @DisplayName("progress is clamped to 0..1")
    void progressClamped() {
        mission.recordProgress(1.7, T0);
        assertEquals(1.0, mission.progress());
        mission.recordProgress(-0.2, T0);
        assertEquals(0.0, mission.progress());
    }

    @Test
    @DisplayName("drainLeases hands back held ids and clears them")
    void drainLeases() {
        mission.holdLease("AGENT_SLOT", "L-1");
        mission.holdLease("API_QUOTA:EMAIL", "L-2");

        assertTrue(mission.holdsLease("AGENT_SLOT"));
        var drained = mission.drainLeases();

        assertEquals(Map.of("AGENT_SLOT", "L-1", "API_QUOTA:EMAIL", "L-2"), drained);
        assertTrue(mission.leaseIds().isEmpty());
    }

    @Test
    @DisplayName("status carries the public view of the mission")
    void toStatus() {
        mission.assignCrew("dead_lead_crew");
        mission.fail(new MissionError("PROVIDER_TIMEOUT", "sendgrid timed out", true));

        MissionStatus status = mission.toStatus();

        assertEquals("M-1", status.missionId());
        assertEquals(MissionState.QUEUED, status.state());
        assertEquals("dead_lead_crew", status.assignedCrew());
        assertEquals("PROVIDER_TIMEOUT", status.error().code());
        assertEquals(2, status.maxRetries());
    }

    // -- Priority boost -------------------------------------------------------

    @Test
    @DisplayName("boosting raises priority and restarts the wait, only while queued")
    void boostPriority() {
        Instant later = T0.plusSeconds(90_000);
        mission.boostPriority(90, later);
        assertEquals(90, mission.priority());
        assertEquals(later, mission.waitingSince());

        assertThrows(IllegalArgumentException.class, () -> mission.boostPriority(80, later));
        mission.moveTo(MissionState.ASSIGNED, later);
        assertThrows(IllegalStateException.class, () -> mission.boostPriority(95, later));
    }

    @Test
    @DisplayName("re-entering the queue restarts the wait")
    void requeueRestartsWait() {
        assertEquals(T0, mission.waitingSince());
        Instant retried = T0.plusSeconds(3600);
        mission.moveTo(MissionState.ASSIGNED, T0);
        mission.moveTo(MissionState.RUNNING, T0);
        mission.moveTo(MissionState.RETRY_PENDING, T0);
        mission.moveTo(MissionState.QUEUED, retried);
        assertEquals(retried, mission.waitingSince());
    }
}
