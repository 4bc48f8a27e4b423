package com.rekindle.rex.core.scheduler;

import com.rekindle.rex.core.logging.MdcContext;
import com.rekindle.rex.core.metrics.RexMetrics;
import com.rekindle.rex.core.model.Mission;
import com.rekindle.rex.core.model.MissionError;
import com.rekindle.rex.core.model.MissionEvent;
import com.rekindle.rex.core.model.MissionState;
import com.rekindle.rex.core.resource.ResourceAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Progress-monitor loop: RUNNING missions silent for longer than the progress timeout go back
 * for retry (or fail when out of budget), and overdue leases are reaped.
 */
class ProgressMonitor {

    private static final Logger log = LoggerFactory.getLogger(ProgressMonitor.class);

    static final String PROGRESS_TIMEOUT = "PROGRESS_TIMEOUT";

    private final MissionStore store;
    private final MissionTransitions transitions;
    private final ErrorRecoveryLoop recovery;
    private final ResourceAllocator allocator;
    private final RexMetrics metrics;
    private final Clock clock;
    private final Duration timeout;

    ProgressMonitor(MissionStore store, MissionTransitions transitions, ErrorRecoveryLoop recovery,
                    ResourceAllocator allocator, RexMetrics metrics, Clock clock, Duration timeout) {
        this.store = store;
        this.transitions = transitions;
        this.recovery = recovery;
        this.allocator = allocator;
        this.metrics = metrics;
        this.clock = clock;
        this.timeout = timeout;
    }

    /**
     * @return number of missions timed out in this pass
     */
    int tick() {
        int timedOut = 0;
        for (Mission mission : store.inState(MissionState.RUNNING)) {
            if (checkMission(mission)) {
                timedOut++;
            }
        }
        int reaped = allocator.reapExpired();
        if (timedOut > 0 || reaped > 0) {
            log.info("Progress monitor: {} mission(s) timed out, {} lease(s) reaped", timedOut, reaped);
        }
        return timedOut;
    }

    private boolean checkMission(Mission mission) {
        mission.lock().lock();
        try {
            MdcContext.setMission(mission.id(), mission.assignedCrew());
            Instant now = clock.instant();
            if (mission.state() != MissionState.RUNNING
                    || Duration.between(mission.lastProgressAt(), now).compareTo(timeout) <= 0) {
                return false;
            }
            log.warn("Mission {} made no progress since {} (timeout {})", mission.id(), mission.lastProgressAt(), timeout);
            metrics.recordProgressTimeout();
            mission.fail(new MissionError(PROGRESS_TIMEOUT, "No progress reported for " + timeout, true));
            MissionState next = transitions.apply(mission, MissionEvent.PROGRESS_TIMEOUT);
            if (next == MissionState.RETRY_PENDING) {
                recovery.scheduleRetry(mission);
            } else if (next == null) {
                throw new InvariantViolationException("TIMEOUT_REJECTED",
                        "Progress timeout rejected for running mission " + mission.id());
            }
            return true;
        } catch (InvariantViolationException e) {
            transitions.forceFail(mission, e);
            return true;
        } finally {
            mission.lock().unlock();
            MdcContext.clear();
        }
    }
}
