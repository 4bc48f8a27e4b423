package com.rekindle.rex.core.scheduler;

import java.time.Instant;

/**
 * Re-enqueue a RETRY_PENDING mission once {@code dueAt} has passed.
 */
record RetryTicket(String missionId, Instant dueAt) implements Comparable<RetryTicket> {

    @Override
    public int compareTo(RetryTicket other) {
        return dueAt.compareTo(other.dueAt);
    }
}
