package com.rekindle.rex.core.decision;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rekindle.rex.core.logging.MdcContext;
import com.rekindle.rex.core.metrics.RexMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Resolves orchestration questions through three ordered layers:
 * <ol>
 *   <li>{@link StateMachineLayer}: unambiguous table lookups</li>
 *   <li>{@link RuleEngine}: ordered business rules</li>
 *   <li>{@link LlmReasonerLayer}: only for questions the rules deferred</li>
 * </ol>
 * A later layer runs only when every earlier one declined. Every resolution is audited,
 * whichever layer answered. This method never throws for a well-formed context.
 */
@Service
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final StateMachineLayer stateMachine;
    private final RuleEngine ruleEngine;
    private final LlmReasonerLayer reasonerLayer;
    private final ContextRedactor redactor;
    private final DecisionAuditLog auditLog;
    private final RexMetrics metrics;
    private final Clock clock;

    private final Map<DecisionLayer, LongAdder> byLayer = new EnumMap<>(DecisionLayer.class);
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final LongAdder high = new LongAdder();
    private final LongAdder medium = new LongAdder();
    private final LongAdder low = new LongAdder();

    public DecisionEngine(StateMachineLayer stateMachine, RuleEngine ruleEngine, LlmReasonerLayer reasonerLayer,
                          ContextRedactor redactor, DecisionAuditLog auditLog, RexMetrics metrics, Clock clock) {
        this.stateMachine = stateMachine;
        this.ruleEngine = ruleEngine;
        this.reasonerLayer = reasonerLayer;
        this.redactor = redactor;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.clock = clock;
        for (DecisionLayer layer : DecisionLayer.values()) {
            byLayer.put(layer, new LongAdder());
        }
    }

    /**
     * @throws IllegalArgumentException if the context variant does not belong to {@code requestType}
     */
    public Decision resolve(RequestType requestType, DecisionContext context) {
        if (context == null || context.requestType() != requestType) {
            throw new IllegalArgumentException("Context " + (context == null ? "null" : context.getClass().getSimpleName())
                    + " does not match request type " + requestType);
        }
        return resolve(context);
    }

    public Decision resolve(DecisionContext context) {
        RequestType requestType = context.requestType();
        MdcContext.setDecision(requestType.name());
        long start = System.nanoTime();
        try {
            ObjectNode redacted = redactor.redact(context);
            boolean cacheHit = false;
            Decision decision;

            Optional<String> tableHit = stateMachine.lookup(context);
            if (tableHit.isPresent()) {
                decision = new Decision(requestType, tableHit.get(), DecisionLayer.STATE_MACHINE, 1.0,
                        context.stateKey() + "/" + context.eventKey());
            } else {
                RuleOutcome outcome = ruleEngine.evaluate(context);
                if (!outcome.deferred()) {
                    decision = new Decision(requestType, outcome.value(), DecisionLayer.RULE_ENGINE, 1.0, outcome.rule());
                } else {
                    ReasonerAnswer answer = reasonerLayer.reason(requestType, redacted, outcome.value());
                    cacheHit = answer.cacheHit();
                    (cacheHit ? cacheHits : cacheMisses).increment();
                    metrics.recordLlmCacheLookup(cacheHit);
                    decision = new Decision(requestType, answer.value(), answer.layer(), answer.confidence(),
                            answer.rationale());
                }
            }

            long latencyMs = (System.nanoTime() - start) / 1_000_000;
            record(context, redacted, decision, latencyMs, cacheHit);
            log.debug("Resolved {} → {} via {}", requestType, decision.value(), decision.layer().label());
            return decision;
        } finally {
            MdcContext.clearDecision();
        }
    }

    public DecisionStats stats() {
        var layers = new LinkedHashMap<String, Long>();
        long total = 0;
        for (var entry : byLayer.entrySet()) {
            long count = entry.getValue().sum();
            layers.put(entry.getKey().label(), count);
            total += count;
        }
        return new DecisionStats(total, Map.copyOf(layers), cacheHits.sum(), cacheMisses.sum(),
                byLayer.get(DecisionLayer.LLM_FALLBACK).sum(), high.sum(), medium.sum(), low.sum());
    }

    public List<DecisionRecord> recentDecisions(int limit) {
        return auditLog.recent(limit);
    }

    private void record(DecisionContext context, ObjectNode redacted, Decision decision, long latencyMs,
                        boolean cacheHit) {
        byLayer.get(decision.layer()).increment();
        if (decision.confidence() >= 0.9) {
            high.increment();
        } else if (decision.confidence() >= 0.7) {
            medium.increment();
        } else {
            low.increment();
        }
        metrics.recordDecision(decision.requestType().name(), decision.layer().label(), latencyMs);
        auditLog.append(new DecisionRecord(clock.instant(), decision.requestType(), context.missionId(),
                decision.layer().label(), redacted.toString(), decision.value(), decision.confidence(),
                latencyMs, cacheHit));
    }
}
