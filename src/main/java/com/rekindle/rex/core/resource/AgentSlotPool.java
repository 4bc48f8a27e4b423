package com.rekindle.rex.core.resource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Non-blocking counting semaphore per crew.
 */
final class AgentSlotPool {

    private final ResourceProperties properties;
    private final Map<String, Semaphore> slots = new ConcurrentHashMap<>();

    AgentSlotPool(ResourceProperties properties, Iterable<String> knownCrews) {
        this.properties = properties;
        for (String crew : knownCrews) {
            semaphore(crew);
        }
    }

    boolean tryAcquire(String crew) {
        return semaphore(crew).tryAcquire();
    }

    void release(String crew) {
        semaphore(crew).release();
    }

    int available(String crew) {
        return semaphore(crew).availablePermits();
    }

    int max(String crew) {
        return properties.slotsFor(crew);
    }

    Map<String, ResourceSnapshot.CrewSlots> states() {
        var result = new LinkedHashMap<String, ResourceSnapshot.CrewSlots>();
        slots.keySet().stream().sorted().forEach(crew -> {
            int max = max(crew);
            int available = available(crew);
            result.put(crew, new ResourceSnapshot.CrewSlots(max, max - available, available));
        });
        return result;
    }

    private Semaphore semaphore(String crew) {
        return slots.computeIfAbsent(crew, c -> new Semaphore(properties.slotsFor(c)));
    }
}
