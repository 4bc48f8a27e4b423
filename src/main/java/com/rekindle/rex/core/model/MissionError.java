package com.rekindle.rex.core.model;

import java.io.Serializable;

/**
 * Error detail attached to a mission.
 *
 * @param code        machine-readable error code (e.g. "PROVIDER_TIMEOUT", "VALIDATION_ERROR")
 * @param message     human-readable summary, surfaced in mission status
 * @param recoverable worker's own classification; {@code null} when the worker could not tell
 */
public record MissionError(
    String code,
    String message,
    Boolean recoverable
) implements Serializable {

    public static MissionError terminal(String code, String message) {
        return new MissionError(code, message, false);
    }
}
