package com.rekindle.rex.core.scheduler;

/**
 * An internal consistency check failed for one mission. The mission is force-failed; nothing else is affected.
 */
public class InvariantViolationException extends RuntimeException {

    private final String kind;

    public InvariantViolationException(String kind, String message) {
        super(message);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
