package com.rekindle.rex.core.engine;

import com.rekindle.rex.core.decision.DecisionEngine;
import com.rekindle.rex.core.decision.DecisionRecord;
import com.rekindle.rex.core.decision.DecisionStats;
import com.rekindle.rex.core.model.MissionStatus;
import com.rekindle.rex.core.model.MissionType;
import com.rekindle.rex.core.resource.DeliveryOutcome;
import com.rekindle.rex.core.resource.DomainRecord;
import com.rekindle.rex.core.resource.ResourceAllocator;
import com.rekindle.rex.core.resource.ResourceSnapshot;
import com.rekindle.rex.core.scheduler.MissionScheduler;
import com.rekindle.rex.core.scheduler.UnknownMissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Inbound interface of the orchestration core.
 * <p>
 * Owns the scheduler, allocator and decision engine for one Rex instance. Called by the API
 * layer, the command parser, delivery adapters and worker crews.
 */
@Service
public class RexOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RexOrchestrator.class);

    private final MissionScheduler scheduler;
    private final ResourceAllocator allocator;
    private final DecisionEngine decisionEngine;

    public RexOrchestrator(MissionScheduler scheduler, ResourceAllocator allocator, DecisionEngine decisionEngine) {
        this.scheduler = scheduler;
        this.allocator = allocator;
        this.decisionEngine = decisionEngine;
    }

    public String submitMission(MissionType type, int priority, Map<String, Object> payload) {
        return scheduler.submit(type, priority, payload);
    }

    /**
     * @param campaignId    campaign the mission belongs to; enables its dedicated domain
     * @param estimatedCost checked against {@code budgetRemaining} in the payload before dispatch
     */
    public String submitMission(MissionType type, int priority, Map<String, Object> payload,
                                String campaignId, Double estimatedCost) {
        return scheduler.submit(type, priority, payload, campaignId, estimatedCost);
    }

    /**
     * @return true if cancelled now, false if the mission had already finished
     * @throws UnknownMissionException if no such mission exists
     */
    public boolean cancelMission(String missionId) {
        log.info("Cancel requested for mission {}", missionId);
        return scheduler.cancel(missionId);
    }

    /**
     * @throws UnknownMissionException if no such mission exists
     */
    public MissionStatus getMissionStatus(String missionId) {
        return scheduler.status(missionId);
    }

    public ResourceSnapshot getResourceSnapshot() {
        return allocator.snapshot();
    }

    public Optional<DomainRecord> recordDeliveryOutcome(String domain, DeliveryOutcome outcome) {
        return allocator.recordDeliveryOutcome(domain, outcome);
    }

    public DomainRecord registerDomain(DomainRecord domain) {
        return allocator.registerDomain(domain);
    }

    public Optional<DomainRecord> advanceWarmup(String domain) {
        return allocator.advanceWarmup(domain);
    }

    public void reportProgress(String missionId, double fraction) {
        scheduler.reportProgress(missionId, fraction);
    }

    public void reportCompletion(String missionId, Map<String, Object> result) {
        scheduler.reportCompletion(missionId, result);
    }

    public void reportFailure(String missionId, String code, String message, Boolean recoverable) {
        scheduler.reportFailure(missionId, code, message, recoverable);
    }

    public DecisionStats decisionStats() {
        return decisionEngine.stats();
    }

    public List<DecisionRecord> recentDecisions(int limit) {
        return decisionEngine.recentDecisions(limit);
    }
}
