package com.rekindle.rex.core.scheduler;

import com.rekindle.rex.core.model.Mission;
import com.rekindle.rex.core.model.MissionState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * In-memory mission registry plus the priority-ordered queue of QUEUED missions.
 */
class MissionStore {

    private final Map<String, Mission> missions = new ConcurrentHashMap<>();
    private final ConcurrentSkipListSet<QueueEntry> queue = new ConcurrentSkipListSet<>();

    void add(Mission mission) {
        if (missions.putIfAbsent(mission.id(), mission) != null) {
            throw new IllegalArgumentException("Duplicate mission id " + mission.id());
        }
        enqueue(mission);
    }

    Optional<Mission> find(String missionId) {
        return Optional.ofNullable(missions.get(missionId));
    }

    void enqueue(Mission mission) {
        queue.add(entryFor(mission));
    }

    void dequeue(Mission mission) {
        queue.remove(entryFor(mission));
    }

    /**
     * Moves a queued mission to its boosted position. Must be called with the mission lock held.
     */
    void reprioritize(Mission mission, int newPriority, Instant at) {
        dequeue(mission);
        try {
            mission.boostPriority(newPriority, at);
        } finally {
            enqueue(mission);
        }
    }

    /**
     * Up to {@code limit} queued missions in dispatch order.
     */
    List<Mission> queued(int limit) {
        var result = new ArrayList<Mission>(Math.min(limit, queue.size()));
        for (QueueEntry entry : queue) {
            if (result.size() >= limit) {
                break;
            }
            Mission mission = missions.get(entry.missionId());
            if (mission != null) {
                result.add(mission);
            }
        }
        return result;
    }

    List<Mission> inState(MissionState state) {
        return missions.values().stream().filter(m -> m.state() == state).toList();
    }

    Collection<Mission> all() {
        return missions.values();
    }

    int queuedCount() {
        return queue.size();
    }

    private static QueueEntry entryFor(Mission mission) {
        return new QueueEntry(mission.id(), mission.priority(), mission.createdAt(), mission.sequence());
    }
}
