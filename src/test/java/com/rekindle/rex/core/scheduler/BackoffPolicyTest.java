package com.rekindle.rex.core.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(30), Duration.ofMinutes(15));

    @Test
    @DisplayName("doubles from the base per retry")
    void doubles() {
        assertEquals(Duration.ofSeconds(30), policy.delayFor(0));
        assertEquals(Duration.ofSeconds(60), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(120), policy.delayFor(2));
    }

    @Test
    @DisplayName("never exceeds the cap, even for huge retry counts")
    void capped() {
        assertEquals(Duration.ofMinutes(15), policy.delayFor(5));
        assertEquals(Duration.ofMinutes(15), policy.delayFor(61));
        assertEquals(Duration.ofMinutes(15), policy.delayFor(Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("rejects negative durations")
    void rejectsNegative() {
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(-1), Duration.ofMinutes(1)));
    }
}
