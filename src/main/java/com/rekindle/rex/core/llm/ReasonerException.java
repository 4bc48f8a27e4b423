package com.rekindle.rex.core.llm;

/**
 * Thrown when the reasoning provider cannot produce an answer.
 */
public class ReasonerException extends Exception {
    public ReasonerException(String message) {
        super(message);
    }

    public ReasonerException(String message, Throwable cause) {
        super(message, cause);
    }
}
