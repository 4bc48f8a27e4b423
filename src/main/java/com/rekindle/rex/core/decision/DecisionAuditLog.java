package com.rekindle.rex.core.decision;

import com.rekindle.rex.core.events.EventBus;
import com.rekindle.rex.core.events.RexEvent;
import com.rekindle.rex.core.events.RexEventTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only trail of {@link DecisionRecord}s.
 * <p>
 * Every record goes to the {@code rex.audit.decisions} logger and onto the bus as
 * {@code decision.resolved}; the most recent records are also retained in memory for inspection.
 */
public class DecisionAuditLog {

    private static final Logger audit = LoggerFactory.getLogger("rex.audit.decisions");

    private final int capacity;
    private final EventBus eventBus;
    private final Deque<DecisionRecord> retained = new ArrayDeque<>();
    private final AtomicLong appended = new AtomicLong();

    public DecisionAuditLog(int capacity, EventBus eventBus) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.eventBus = eventBus;
    }

    public void append(DecisionRecord record) {
        synchronized (retained) {
            if (retained.size() >= capacity) {
                retained.removeFirst();
            }
            retained.addLast(record);
        }
        appended.incrementAndGet();

        audit.info("decision requestType={} missionId={} layer={} output={} confidence={} latencyMs={} cacheHit={} inputs={}",
                record.requestType(), record.missionId(), record.layer(), record.output(),
                String.format("%.2f", record.confidence()), record.latencyMs(), record.cacheHit(), record.inputs());

        var payload = new LinkedHashMap<String, Object>();
        payload.put("requestType", record.requestType().name());
        payload.put("layer", record.layer());
        payload.put("output", record.output());
        payload.put("confidence", record.confidence());
        payload.put("latencyMs", record.latencyMs());
        payload.put("cacheHit", record.cacheHit());
        eventBus.publish(new RexEvent(RexEventTypes.DECISION_RESOLVED, record.missionId(), payload, record.at()));
    }

    /**
     * @return up to {@code limit} retained records, newest first
     */
    public List<DecisionRecord> recent(int limit) {
        var result = new ArrayList<DecisionRecord>();
        synchronized (retained) {
            Iterator<DecisionRecord> it = retained.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
        }
        return result;
    }

    public long totalAppended() {
        return appended.get();
    }
}
