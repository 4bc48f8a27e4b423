package com.rekindle.rex.core.scheduler;

import java.time.Instant;
import java.util.Comparator;

/**
 * Position of a QUEUED mission: higher priority first, then older, then earlier submitted.
 */
record QueueEntry(String missionId, int priority, Instant createdAt, long sequence) implements Comparable<QueueEntry> {

    private static final Comparator<QueueEntry> ORDER = Comparator
            .comparingInt(QueueEntry::priority).reversed()
            .thenComparing(QueueEntry::createdAt)
            .thenComparingLong(QueueEntry::sequence);

    @Override
    public int compareTo(QueueEntry other) {
        return ORDER.compare(this, other);
    }
}
