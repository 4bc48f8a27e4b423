package com.rekindle.rex.core.scheduler;

import com.rekindle.rex.core.crew.CrewDispatcher;
import com.rekindle.rex.core.crew.CrewRouter;
import com.rekindle.rex.core.decision.DecisionEngine;
import com.rekindle.rex.core.events.EventBus;
import com.rekindle.rex.core.events.RexEventTypes;
import com.rekindle.rex.core.logging.MdcContext;
import com.rekindle.rex.core.metrics.RexMetrics;
import com.rekindle.rex.core.model.Mission;
import com.rekindle.rex.core.model.MissionError;
import com.rekindle.rex.core.model.MissionEvent;
import com.rekindle.rex.core.model.MissionState;
import com.rekindle.rex.core.model.MissionStatus;
import com.rekindle.rex.core.model.MissionType;
import com.rekindle.rex.core.resource.ResourceAllocator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the mission lifecycle and runs the three scheduler loops, each on its own thread:
 * <ul>
 *   <li>scheduling: dispatches QUEUED missions, waking early whenever a lease is released</li>
 *   <li>progress monitor: times out silent RUNNING missions, reaps expired leases and boosts
 *       QUEUED missions that have waited too long</li>
 *   <li>error recovery: classifies worker failures and re-enqueues retries after backoff</li>
 * </ul>
 * The loops coordinate only through mission records (under per-mission locks) and internal
 * queues. With {@code rex.scheduler.autostart=false} no thread is started and the loops can be
 * stepped with {@link #tickDispatch()}, {@link #tickMonitor()}, {@link #tickPriorityBoost()} and
 * {@link #tickRecovery()}.
 */
@Service
public class MissionScheduler {

    private static final Logger log = LoggerFactory.getLogger(MissionScheduler.class);

    private final SchedulerProperties properties;
    private final ResourceAllocator allocator;
    private final Clock clock;

    private final MissionStore store = new MissionStore();
    private final MissionTransitions transitions;
    private final DispatchLoop dispatchLoop;
    private final ProgressMonitor progressMonitor;
    private final PriorityBooster priorityBooster;
    private final ErrorRecoveryLoop recoveryLoop;
    private final AtomicLong sequence = new AtomicLong();

    private volatile boolean running;
    private ExecutorService dispatchThread;
    private ScheduledExecutorService monitorThread;
    private ScheduledExecutorService recoveryThread;

    public MissionScheduler(SchedulerProperties properties, DecisionEngine decisionEngine, ResourceAllocator allocator,
                            CrewRouter router, CrewDispatcher dispatcher, EventBus eventBus, RexMetrics metrics,
                            Clock clock) {
        this.properties = properties;
        this.allocator = allocator;
        this.clock = clock;
        this.transitions = new MissionTransitions(decisionEngine, allocator, store, eventBus, metrics, clock);
        this.dispatchLoop = new DispatchLoop(store, transitions, decisionEngine, allocator, router, dispatcher,
                properties.getBatchSize());
        this.recoveryLoop = new ErrorRecoveryLoop(store, transitions, decisionEngine, metrics, clock,
                new BackoffPolicy(properties.getBackoffBase(), properties.getBackoffCap()), dispatchLoop::wake);
        this.progressMonitor = new ProgressMonitor(store, transitions, recoveryLoop, allocator, metrics, clock,
                properties.getProgressTimeout());
        this.priorityBooster = new PriorityBooster(store, transitions, decisionEngine, metrics, clock, properties);
        allocator.onRelease(lease -> dispatchLoop.wake());
    }

    @PostConstruct
    void autostart() {
        if (properties.isAutostart()) {
            start();
        }
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dispatchThread = Executors.newSingleThreadExecutor(daemon("rex-dispatch"));
        monitorThread = Executors.newSingleThreadScheduledExecutor(daemon("rex-monitor"));
        recoveryThread = Executors.newSingleThreadScheduledExecutor(daemon("rex-recovery"));

        dispatchThread.execute(this::runDispatchLoop);
        long monitorMs = properties.getMonitorInterval().toMillis();
        monitorThread.scheduleWithFixedDelay(() -> {
                    guarded("progress monitor", progressMonitor::tick);
                    guarded("priority boost", priorityBooster::tick);
                }, monitorMs, monitorMs, TimeUnit.MILLISECONDS);
        long recoveryMs = properties.getRecoveryInterval().toMillis();
        recoveryThread.scheduleWithFixedDelay(() -> guarded("error recovery", recoveryLoop::tick),
                recoveryMs, recoveryMs, TimeUnit.MILLISECONDS);
        log.info("Mission scheduler started (tick={}, monitor={}, recovery={}, progress timeout={})",
                properties.getTickInterval(), properties.getMonitorInterval(), properties.getRecoveryInterval(),
                properties.getProgressTimeout());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        dispatchLoop.wake();
        for (ExecutorService executor : new ExecutorService[]{dispatchThread, monitorThread, recoveryThread}) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Mission scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Creates a QUEUED mission.
     *
     * @return the new mission id
     */
    public String submit(MissionType type, int priority, Map<String, Object> payload) {
        return submit(type, priority, payload, null, null);
    }

    public String submit(MissionType type, int priority, Map<String, Object> payload,
                         String campaignId, Double estimatedCost) {
        Objects.requireNonNull(type, "type");
        String id = UUID.randomUUID().toString();
        var mission = new Mission(id, type, priority, payload, campaignId, estimatedCost,
                properties.getMaxRetries(), clock.instant(), sequence.incrementAndGet());
        store.add(mission);

        var eventPayload = new LinkedHashMap<String, Object>();
        eventPayload.put("type", type.name());
        eventPayload.put("priority", priority);
        if (campaignId != null) {
            eventPayload.put("campaignId", campaignId);
        }
        transitions.publish(RexEventTypes.MISSION_CREATED, mission, eventPayload);
        log.info("Mission {} submitted: {} (priority {})", id, type, priority);
        dispatchLoop.wake();
        return id;
    }

    /**
     * Cancels a non-terminal mission immediately and releases its leases. Sends already
     * handed to a delivery provider are not undone.
     *
     * @return true if the mission was cancelled by this call, false if it was already terminal
     * @throws UnknownMissionException if no such mission exists
     */
    public boolean cancel(String missionId) {
        Mission mission = require(missionId);
        mission.lock().lock();
        try {
            MdcContext.setMission(mission.id(), mission.assignedCrew());
            if (mission.state().isTerminal()) {
                log.debug("Cancel of mission {} ignored, already {}", missionId, mission.state());
                return false;
            }
            return transitions.apply(mission, MissionEvent.CANCELLED) == MissionState.CANCELLED;
        } catch (InvariantViolationException e) {
            transitions.forceFail(mission, e);
            return false;
        } finally {
            mission.lock().unlock();
            MdcContext.clear();
        }
    }

    /**
     * @throws UnknownMissionException if no such mission exists
     */
    public MissionStatus status(String missionId) {
        Mission mission = require(missionId);
        mission.lock().lock();
        try {
            return mission.toStatus();
        } finally {
            mission.lock().unlock();
        }
    }

    public void reportProgress(String missionId, double fraction) {
        Mission mission = store.find(missionId).orElse(null);
        if (mission == null) {
            log.debug("Progress for unknown mission {} ignored", missionId);
            return;
        }
        mission.lock().lock();
        try {
            if (mission.state() != MissionState.RUNNING) {
                if (!dispatchLoop.deferDuringHandOff(mission, () -> reportProgress(missionId, fraction))) {
                    log.debug("Progress for mission {} in {} ignored", missionId, mission.state());
                }
                return;
            }
            mission.recordProgress(fraction, clock.instant());
            allocator.renew(missionId);
        } finally {
            mission.lock().unlock();
        }
    }

    public void reportCompletion(String missionId, Map<String, Object> result) {
        Mission mission = store.find(missionId).orElse(null);
        if (mission == null) {
            log.debug("Completion for unknown mission {} ignored", missionId);
            return;
        }
        mission.lock().lock();
        try {
            MdcContext.setMission(mission.id(), mission.assignedCrew());
            if (mission.state() != MissionState.RUNNING) {
                if (!dispatchLoop.deferDuringHandOff(mission, () -> reportCompletion(missionId, result))) {
                    log.debug("Completion for mission {} in {} ignored", missionId, mission.state());
                }
                return;
            }
            mission.complete(result);
            if (transitions.apply(mission, MissionEvent.COMPLETED) == null) {
                throw new InvariantViolationException("COMPLETE_REJECTED",
                        "Completion rejected for running mission " + missionId);
            }
        } catch (InvariantViolationException e) {
            transitions.forceFail(mission, e);
        } finally {
            mission.lock().unlock();
            MdcContext.clear();
        }
    }

    /**
     * Queues a worker failure for the error-recovery loop.
     *
     * @param recoverable the worker's own classification, or {@code null} if it cannot tell
     */
    public void reportFailure(String missionId, String code, String message, Boolean recoverable) {
        if (store.find(missionId).isEmpty()) {
            log.debug("Failure for unknown mission {} ignored", missionId);
            return;
        }
        recoveryLoop.submit(new FailureReport(missionId, new MissionError(code, message, recoverable), clock.instant()));
    }

    /** Runs one scheduling pass on the calling thread. */
    public int tickDispatch() {
        return dispatchLoop.tick();
    }

    /** Runs one progress-monitor pass on the calling thread. */
    public int tickMonitor() {
        return progressMonitor.tick();
    }

    /** Runs one priority-boost pass on the calling thread. */
    public int tickPriorityBoost() {
        return priorityBooster.tick();
    }

    /** Runs one error-recovery pass on the calling thread. */
    public int tickRecovery() {
        return recoveryLoop.tick();
    }

    public int queuedCount() {
        return store.queuedCount();
    }

    public int pendingRetries() {
        return recoveryLoop.pendingRetries();
    }

    private void runDispatchLoop() {
        while (running) {
            guarded("scheduling", dispatchLoop::tick);
            try {
                dispatchLoop.awaitNextTick(properties.getTickInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private Mission require(String missionId) {
        return store.find(missionId).orElseThrow(() -> new UnknownMissionException(missionId));
    }

    private static void guarded(String loop, Runnable pass) {
        try {
            pass.run();
        } catch (RuntimeException e) {
            log.error("Unexpected error in {} loop: {}", loop, e.getMessage(), e);
        }
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }
}
