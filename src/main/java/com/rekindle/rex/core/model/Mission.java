package com.rekindle.rex.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A unit of orchestrated work.
 * <p>
 * Mutable fields are written only by the scheduler while holding {@link #lock()}; unrelated
 * missions never contend on the same lock. Identity, type and creation data are immutable.
 */
public final class Mission {

    private final String id;
    private final MissionType type;
    private volatile int priority;
    private final Map<String, Object> payload;
    private final String campaignId;
    private final Double estimatedCost;
    private final int maxRetries;
    private final Instant createdAt;
    private final long sequence;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile MissionState state = MissionState.QUEUED;
    private String assignedCrew;
    private int retryCount;
    private Instant startedAt;
    private Instant completedAt;
    private Instant lastProgressAt;
    private Instant waitingSince;
    private double progress;
    private Map<String, Object> result;
    private MissionError error;
    private final Map<String, String> leaseIds = new LinkedHashMap<>();

    public Mission(String id, MissionType type, int priority, Map<String, Object> payload,
                   String campaignId, Double estimatedCost, int maxRetries,
                   Instant createdAt, long sequence) {
        this.id = id;
        this.type = type;
        this.priority = priority;
        this.payload = payload != null ? Map.copyOf(payload) : Map.of();
        this.campaignId = campaignId;
        this.estimatedCost = estimatedCost;
        this.maxRetries = maxRetries;
        this.createdAt = createdAt;
        this.sequence = sequence;
        this.waitingSince = createdAt;
    }

    public ReentrantLock lock() { return lock; }

    public String id() { return id; }
    public MissionType type() { return type; }
    public int priority() { return priority; }
    public Map<String, Object> payload() { return payload; }
    public String campaignId() { return campaignId; }
    public Double estimatedCost() { return estimatedCost; }
    public int maxRetries() { return maxRetries; }
    public Instant createdAt() { return createdAt; }
    public long sequence() { return sequence; }

    public MissionState state() { return state; }
    public String assignedCrew() { return assignedCrew; }
    public int retryCount() { return retryCount; }
    public Instant startedAt() { return startedAt; }
    public Instant completedAt() { return completedAt; }
    public Instant lastProgressAt() { return lastProgressAt; }
    /** When the mission last entered the queue or was last boosted. */
    public Instant waitingSince() { return waitingSince; }
    public double progress() { return progress; }
    public MissionError error() { return error; }

    public boolean hasRetryBudget() {
        return retryCount < maxRetries;
    }

    /**
     * Writes the new state. Callers resolve the target through the decision engine first;
     * this only enforces the structural lifecycle.
     *
     * @throws IllegalStateException if the lifecycle forbids the transition
     */
    public void moveTo(MissionState target, Instant at) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + target + " for mission " + id);
        }
        state = target;
        switch (target) {
            case RUNNING -> {
                startedAt = at;
                lastProgressAt = at;
            }
            case QUEUED -> waitingSince = at;
            case COMPLETED, FAILED, CANCELLED -> completedAt = at;
            default -> { }
        }
    }

    /**
     * Raises the priority of a QUEUED mission and restarts its wait. The caller re-keys the
     * mission's queue entry around this call.
     */
    public void boostPriority(int newPriority, Instant at) {
        if (state != MissionState.QUEUED) {
            throw new IllegalStateException("Only queued missions are reprioritised, mission " + id + " is " + state);
        }
        if (newPriority <= priority) {
            throw new IllegalArgumentException("Boost must raise priority " + priority + ", got " + newPriority);
        }
        this.priority = newPriority;
        this.waitingSince = at;
    }

    public void assignCrew(String crew) {
        this.assignedCrew = crew;
    }

    public void incrementRetryCount() {
        if (retryCount >= maxRetries) {
            throw new IllegalStateException("Retry budget exhausted for mission " + id);
        }
        retryCount++;
    }

    public void recordProgress(double fraction, Instant at) {
        this.progress = Math.max(0.0, Math.min(1.0, fraction));
        this.lastProgressAt = at;
    }

    public void complete(Map<String, Object> result) {
        this.result = result != null ? new LinkedHashMap<>(result) : Map.of();
        this.progress = 1.0;
    }

    public void fail(MissionError error) {
        this.error = error;
    }

    public void holdLease(String kindKey, String leaseId) {
        leaseIds.put(kindKey, leaseId);
    }

    public boolean holdsLease(String kindKey) {
        return leaseIds.containsKey(kindKey);
    }

    public Map<String, String> leaseIds() {
        return Collections.unmodifiableMap(leaseIds);
    }

    /**
     * Clears lease bookkeeping and returns the ids that were held, for release by the caller.
     */
    public Map<String, String> drainLeases() {
        var held = Map.copyOf(leaseIds);
        leaseIds.clear();
        return held;
    }

    public MissionStatus toStatus() {
        return new MissionStatus(id, type, state, priority, progress, assignedCrew,
                retryCount, maxRetries, result, error, createdAt, startedAt, completedAt);
    }
}
