package com.rekindle.rex.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Rex orchestration.
 */
@Service
public class RexMetrics {

    private final MeterRegistry registry;

    public RexMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(String requestType, String layer, long latencyMs) {
        Timer.builder("rex.decision.duration")
                .tag("requestType", requestType)
                .tag("layer", layer)
                .register(registry)
                .record(Duration.ofMillis(latencyMs));
    }

    public void recordLlmCacheLookup(boolean hit) {
        Counter.builder("rex.decision.llm_cache")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordMissionResult(String state) {
        Counter.builder("rex.missions.total")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordRetry(String missionType) {
        Counter.builder("rex.missions.retries")
                .tag("type", missionType)
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String reason) {
        Counter.builder("rex.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPriorityBoost(String missionType) {
        Counter.builder("rex.missions.priority_boosts")
                .description("QUEUED missions moved up after waiting too long")
                .tag("type", missionType)
                .register(registry)
                .increment();
    }

    public void recordProgressTimeout() {
        Counter.builder("rex.missions.progress_timeouts")
                .description("RUNNING missions force-transitioned for lack of progress")
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of a lease request.
     *
     * @param kind    lease kind ("AGENT_SLOT", "DOMAIN", "API_QUOTA")
     * @param granted whether the lease was granted
     */
    public void recordLeaseRequest(String kind, boolean granted) {
        Counter.builder("rex.leases.requests")
                .tag("kind", kind)
                .tag("result", granted ? "granted" : "denied")
                .register(registry)
                .increment();
    }

    public void recordPoolExhausted(String pool) {
        Counter.builder("rex.pools.exhausted")
                .description("Transitions of a resource pool into the exhausted state")
                .tag("pool", pool)
                .register(registry)
                .increment();
    }

    public void recordInvariantViolation(String kind) {
        Counter.builder("rex.invariant_violations")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
