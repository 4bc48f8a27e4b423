package com.rekindle.rex.core.events;

import java.time.Instant;

/**
 * An event a subscriber failed to process.
 */
public record DeadLetter(RexEvent event, String error, Instant failedAt) {}
