package com.rekindle.rex.core.scheduler;

import com.rekindle.rex.core.crew.CrewDispatcher;
import com.rekindle.rex.core.crew.CrewRouter;
import com.rekindle.rex.core.crew.MissionAssignment;
import com.rekindle.rex.core.decision.Decision;
import com.rekindle.rex.core.decision.DecisionEngine;
import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.DomainSelectionContext;
import com.rekindle.rex.core.decision.EligibilityContext;
import com.rekindle.rex.core.decision.LeaseCheckContext;
import com.rekindle.rex.core.logging.MdcContext;
import com.rekindle.rex.core.model.Mission;
import com.rekindle.rex.core.model.MissionError;
import com.rekindle.rex.core.model.MissionEvent;
import com.rekindle.rex.core.model.MissionState;
import com.rekindle.rex.core.resource.AcquireResult;
import com.rekindle.rex.core.resource.ApiProvider;
import com.rekindle.rex.core.resource.DomainRecord;
import com.rekindle.rex.core.resource.Lease;
import com.rekindle.rex.core.resource.LeaseConstraints;
import com.rekindle.rex.core.resource.LeaseKind;
import com.rekindle.rex.core.resource.ResourceAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Scheduling loop: walks QUEUED missions in priority order and dispatches those whose
 * resources can all be leased.
 * <p>
 * For one mission, leasing every resource, handing it to its crew and moving it
 * QUEUED → ASSIGNED → RUNNING happen under the mission lock as one step. A partial grant is
 * rolled back and the mission stays QUEUED for the next tick.
 * <p>
 * A crew that reports back from inside the hand-off call sees the mission still QUEUED. Such
 * reports are held and replayed once the mission is RUNNING, or dropped if the hand-off fails.
 */
class DispatchLoop {

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private final MissionStore store;
    private final MissionTransitions transitions;
    private final DecisionEngine decisionEngine;
    private final ResourceAllocator allocator;
    private final CrewRouter router;
    private final CrewDispatcher dispatcher;
    private final int batchSize;
    private final Semaphore wakeSignal = new Semaphore(0);
    /** missionId → worker reports received during the hand-off */
    private final Map<String, List<Runnable>> handOffs = new ConcurrentHashMap<>();

    DispatchLoop(MissionStore store, MissionTransitions transitions, DecisionEngine decisionEngine,
                 ResourceAllocator allocator, CrewRouter router, CrewDispatcher dispatcher, int batchSize) {
        this.store = store;
        this.transitions = transitions;
        this.decisionEngine = decisionEngine;
        this.allocator = allocator;
        this.router = router;
        this.dispatcher = dispatcher;
        this.batchSize = batchSize;
    }

    /**
     * One pass over the head of the queue.
     *
     * @return number of missions dispatched
     */
    int tick() {
        int dispatched = 0;
        for (Mission mission : store.queued(batchSize)) {
            if (tryDispatch(mission)) {
                dispatched++;
            }
        }
        if (dispatched > 0) {
            log.debug("Dispatched {} mission(s), {} still queued", dispatched, store.queuedCount());
        }
        return dispatched;
    }

    /** Wakes the loop before its next scheduled tick. */
    void wake() {
        wakeSignal.release();
    }

    /**
     * Sleeps until the interval elapses or {@link #wake()} is called.
     */
    void awaitNextTick(Duration interval) throws InterruptedException {
        wakeSignal.tryAcquire(interval.toMillis(), TimeUnit.MILLISECONDS);
        wakeSignal.drainPermits();
    }

    /**
     * Holds a worker report that arrived while {@code mission} is being handed to its crew.
     * Must be called with the mission lock held.
     *
     * @return false if the mission is not in a hand-off
     */
    boolean deferDuringHandOff(Mission mission, Runnable report) {
        List<Runnable> pending = handOffs.get(mission.id());
        if (pending == null || !mission.lock().isHeldByCurrentThread()) {
            return false;
        }
        pending.add(report);
        return true;
    }

    boolean tryDispatch(Mission mission) {
        String crew = router.crewFor(mission.type());
        mission.lock().lock();
        List<Lease> granted = new ArrayList<>();
        try {
            MdcContext.setMission(mission.id(), crew);
            if (mission.state() != MissionState.QUEUED) {
                return false;
            }
            if (!mission.leaseIds().isEmpty()) {
                throw new InvariantViolationException("QUEUED_WITH_LEASES",
                        "Queued mission " + mission.id() + " still holds leases " + mission.leaseIds().keySet());
            }

            Decision eligibility = decisionEngine.resolve(eligibilityContext(mission));
            if (eligibility.is(DecisionValues.INELIGIBLE)) {
                transitions.fail(mission, MissionError.terminal("INELIGIBLE",
                        "Mission is not eligible to run (" + eligibility.rationale() + ")"));
                return false;
            }
            if (!eligibility.is(DecisionValues.ELIGIBLE)) {
                log.debug("Mission {} deferred: {}", mission.id(), eligibility.rationale());
                return false;
            }

            Decision domainChoice = decisionEngine.resolve(domainContext(mission));
            boolean needsDomain = !domainChoice.is(DecisionValues.NOT_REQUIRED);
            boolean preferDedicated = domainChoice.is(DecisionValues.DEDICATED);

            if (!lease(mission, LeaseKind.AGENT_SLOT, null, LeaseConstraints.agentSlot(crew), granted)) {
                return rollback(mission, granted);
            }
            if (needsDomain && !lease(mission, LeaseKind.DOMAIN, null,
                    LeaseConstraints.domain(mission.campaignId(), preferDedicated), granted)) {
                return rollback(mission, granted);
            }
            for (Map.Entry<ApiProvider, Long> estimate : router.apiEstimates(mission.type()).entrySet()) {
                if (!lease(mission, LeaseKind.API_QUOTA, estimate.getKey(),
                        LeaseConstraints.apiQuota(estimate.getKey(), estimate.getValue()), granted)) {
                    return rollback(mission, granted);
                }
            }

            String domain = granted.stream()
                    .filter(l -> l.kind() == LeaseKind.DOMAIN)
                    .map(Lease::resourceId)
                    .findFirst()
                    .orElse(null);
            handOffs.put(mission.id(), new ArrayList<>());
            try {
                dispatcher.dispatch(new MissionAssignment(mission.id(), mission.type(), crew, mission.payload(),
                        domain, mission.retryCount()));
            } catch (RuntimeException e) {
                List<Runnable> dropped = handOffs.remove(mission.id());
                log.warn("Dispatch of mission {} to {} failed, leaving it queued ({} worker report(s) dropped): {}",
                        mission.id(), crew, dropped == null ? 0 : dropped.size(), e.getMessage(), e);
                return rollback(mission, granted);
            }

            for (Lease lease : granted) {
                mission.holdLease(lease.kindKey(), lease.leaseId());
            }
            mission.assignCrew(crew);
            if (transitions.apply(mission, MissionEvent.DISPATCHED) == null
                    || transitions.apply(mission, MissionEvent.STARTED) == null) {
                throw new InvariantViolationException("DISPATCH_REJECTED",
                        "Lifecycle rejected dispatch of mission " + mission.id());
            }
            List<Runnable> pending = handOffs.remove(mission.id());
            if (pending != null && !pending.isEmpty()) {
                log.debug("Replaying {} report(s) received during hand-off of mission {}", pending.size(), mission.id());
                pending.forEach(Runnable::run);
            }
            return true;
        } catch (InvariantViolationException e) {
            rollback(mission, granted);
            transitions.forceFail(mission, e);
            return false;
        } catch (RuntimeException e) {
            log.error("Scheduling error for mission {}, leaving it queued: {}", mission.id(), e.getMessage(), e);
            rollback(mission, granted);
            return false;
        } finally {
            handOffs.remove(mission.id());
            mission.lock().unlock();
            MdcContext.clear();
        }
    }

    private boolean lease(Mission mission, LeaseKind kind, ApiProvider provider, LeaseConstraints constraints,
                          List<Lease> granted) {
        String kindKey = Lease.kindKey(kind, provider);
        Set<String> held = new HashSet<>(mission.leaseIds().keySet());
        granted.forEach(l -> held.add(l.kindKey()));
        Decision check = decisionEngine.resolve(new LeaseCheckContext(mission.id(), kindKey, held));
        if (!check.is(DecisionValues.ATTEMPT)) {
            if (held.contains(kindKey)) {
                throw new InvariantViolationException("LEASE_DOUBLE_ACQUIRE",
                        "Mission " + mission.id() + " asked twice for " + kindKey);
            }
            log.debug("Lease check denied {} for mission {}", kindKey, mission.id());
            return false;
        }
        AcquireResult result = allocator.acquire(kind, mission.id(), constraints);
        if (result instanceof AcquireResult.Granted g) {
            granted.add(g.lease());
            return true;
        }
        log.debug("Mission {} stays queued: {}", mission.id(), ((AcquireResult.Denied) result).reason());
        return false;
    }

    private boolean rollback(Mission mission, List<Lease> granted) {
        for (Lease lease : granted) {
            allocator.release(lease.leaseId());
        }
        if (!granted.isEmpty()) {
            log.debug("Rolled back {} lease(s) for mission {}", granted.size(), mission.id());
        }
        granted.clear();
        return false;
    }

    private EligibilityContext eligibilityContext(Mission mission) {
        Map<String, Double> utilization = allocator.providerUtilization();
        var needed = new LinkedHashMap<String, Double>();
        for (ApiProvider provider : router.apiEstimates(mission.type()).keySet()) {
            needed.put(provider.name(), utilization.getOrDefault(provider.name(), 0.0));
        }
        return new EligibilityContext(mission.id(), mission.type(), mission.priority(), mission.estimatedCost(),
                budgetRemaining(mission), needed);
    }

    private DomainSelectionContext domainContext(Mission mission) {
        Optional<DomainRecord> dedicated = allocator.dedicatedDomain(mission.campaignId());
        return new DomainSelectionContext(mission.id(), mission.type(), router.requiresDomain(mission.type()),
                mission.campaignId(),
                dedicated.map(DomainRecord::name).orElse(null),
                dedicated.map(DomainRecord::reputation).orElse(null),
                dedicated.map(d -> allocator.floorFor(d.tier())).orElse(null));
    }

    private static Double budgetRemaining(Mission mission) {
        Object value = mission.payload().get("budgetRemaining");
        return value instanceof Number n ? n.doubleValue() : null;
    }
}
