package com.rekindle.rex.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a mission, returned by status queries.
 */
public record MissionStatus(
    String missionId,
    MissionType type,
    MissionState state,
    int priority,
    double progress,
    String assignedCrew,
    int retryCount,
    int maxRetries,
    Map<String, Object> result,
    MissionError error,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) implements Serializable {}
