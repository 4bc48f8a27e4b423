package com.rekindle.rex.core.scheduler;

import com.rekindle.rex.core.decision.Decision;
import com.rekindle.rex.core.decision.DecisionEngine;
import com.rekindle.rex.core.decision.DecisionValues;
import com.rekindle.rex.core.decision.RetryContext;
import com.rekindle.rex.core.events.RexEventTypes;
import com.rekindle.rex.core.logging.MdcContext;
import com.rekindle.rex.core.metrics.RexMetrics;
import com.rekindle.rex.core.model.Mission;
import com.rekindle.rex.core.model.MissionError;
import com.rekindle.rex.core.model.MissionEvent;
import com.rekindle.rex.core.model.MissionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.PriorityBlockingQueue;

/**
 * Error-recovery loop: classifies failure reports from its inbox and re-enqueues retried
 * missions once their backoff has elapsed.
 */
class ErrorRecoveryLoop {

    private static final Logger log = LoggerFactory.getLogger(ErrorRecoveryLoop.class);

    private final MissionStore store;
    private final MissionTransitions transitions;
    private final DecisionEngine decisionEngine;
    private final RexMetrics metrics;
    private final Clock clock;
    private final BackoffPolicy backoff;
    private final Runnable onRequeue;

    private final BlockingQueue<FailureReport> inbox = new LinkedBlockingQueue<>();
    private final PriorityBlockingQueue<RetryTicket> retries = new PriorityBlockingQueue<>();

    ErrorRecoveryLoop(MissionStore store, MissionTransitions transitions, DecisionEngine decisionEngine,
                      RexMetrics metrics, Clock clock, BackoffPolicy backoff, Runnable onRequeue) {
        this.store = store;
        this.transitions = transitions;
        this.decisionEngine = decisionEngine;
        this.metrics = metrics;
        this.clock = clock;
        this.backoff = backoff;
        this.onRequeue = onRequeue;
    }

    void submit(FailureReport report) {
        inbox.add(report);
    }

    /**
     * Queues a re-enqueue ticket for a mission that just entered RETRY_PENDING. Lock held by caller.
     */
    void scheduleRetry(Mission mission) {
        Duration delay = backoff.delayFor(mission.retryCount());
        Instant dueAt = clock.instant().plus(delay);
        retries.add(new RetryTicket(mission.id(), dueAt));
        metrics.recordRetry(mission.type().name());
        log.info("Mission {} will be retried in {} (attempt {} of {})", mission.id(), delay,
                mission.retryCount() + 1, mission.maxRetries());
    }

    /**
     * Handles every pending failure report, then every retry ticket that is due.
     *
     * @return number of missions re-enqueued
     */
    int tick() {
        FailureReport report;
        while ((report = inbox.poll()) != null) {
            handleFailure(report);
        }

        int requeued = 0;
        Instant now = clock.instant();
        RetryTicket ticket;
        while ((ticket = pollDue(now)) != null) {
            if (requeue(ticket)) {
                requeued++;
            }
        }
        if (requeued > 0) {
            onRequeue.run();
        }
        return requeued;
    }

    int pendingRetries() {
        return retries.size();
    }

    private RetryTicket pollDue(Instant now) {
        RetryTicket head = retries.peek();
        if (head == null || head.dueAt().isAfter(now)) {
            return null;
        }
        return retries.poll();
    }

    private void handleFailure(FailureReport report) {
        Mission mission = store.find(report.missionId()).orElse(null);
        if (mission == null) {
            log.debug("Failure report for unknown mission {} ignored", report.missionId());
            return;
        }
        mission.lock().lock();
        try {
            MdcContext.setMission(mission.id(), mission.assignedCrew());
            if (mission.state() != MissionState.RUNNING) {
                log.debug("Failure report for mission {} in {} ignored", mission.id(), mission.state());
                return;
            }
            MissionError error = report.error();
            mission.fail(error);
            Decision decision = decisionEngine.resolve(new RetryContext(mission.id(), mission.type(),
                    mission.priority(), mission.retryCount(), mission.maxRetries(), error.code(), error.message(),
                    error.recoverable()));

            if (decision.is(DecisionValues.RETRY) && mission.hasRetryBudget()) {
                if (transitions.apply(mission, MissionEvent.RETRY_SCHEDULED) != MissionState.RETRY_PENDING) {
                    throw new InvariantViolationException("RETRY_REJECTED",
                            "Retry transition rejected for running mission " + mission.id());
                }
                scheduleRetry(mission);
                return;
            }
            transitions.fail(mission, error);
            if (decision.is(DecisionValues.ESCALATE)) {
                metrics.incrementEscalations(error.code() != null ? error.code() : "UNKNOWN");
                var payload = new LinkedHashMap<String, Object>();
                payload.put("code", error.code());
                payload.put("message", error.message());
                payload.put("retryCount", mission.retryCount());
                payload.put("layer", decision.layer().label());
                transitions.publish(RexEventTypes.MISSION_ESCALATED, mission, payload);
                log.warn("Mission {} escalated after {} retries: {}", mission.id(), mission.retryCount(), error.code());
            }
        } catch (InvariantViolationException e) {
            transitions.forceFail(mission, e);
        } finally {
            mission.lock().unlock();
            MdcContext.clear();
        }
    }

    private boolean requeue(RetryTicket ticket) {
        Mission mission = store.find(ticket.missionId()).orElse(null);
        if (mission == null) {
            return false;
        }
        mission.lock().lock();
        try {
            MdcContext.setMission(mission.id());
            if (mission.state() != MissionState.RETRY_PENDING) {
                log.debug("Retry ticket for mission {} in {} dropped", mission.id(), mission.state());
                return false;
            }
            if (!mission.hasRetryBudget()) {
                throw new InvariantViolationException("RETRY_BUDGET",
                        "Mission " + mission.id() + " pending retry with no budget left");
            }
            mission.incrementRetryCount();
            return transitions.apply(mission, MissionEvent.BACKOFF_ELAPSED) == MissionState.QUEUED;
        } catch (InvariantViolationException e) {
            transitions.forceFail(mission, e);
            return false;
        } finally {
            mission.lock().unlock();
            MdcContext.clear();
        }
    }
}
