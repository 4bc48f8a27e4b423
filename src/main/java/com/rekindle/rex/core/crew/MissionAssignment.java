package com.rekindle.rex.core.crew;

import com.rekindle.rex.core.model.MissionType;

import java.io.Serializable;
import java.util.Map;

/**
 * Work handed to a crew when a mission starts running.
 *
 * @param domain  sending domain leased for the mission, or {@code null}
 * @param attempt 0 for the first run, then the retry count
 */
public record MissionAssignment(
    String missionId,
    MissionType type,
    String crew,
    Map<String, Object> payload,
    String domain,
    int attempt
) implements Serializable {}
