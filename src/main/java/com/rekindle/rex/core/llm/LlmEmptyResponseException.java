package com.rekindle.rex.core.llm;

/**
 * Thrown when the LLM returns no content at all.
 */
public class LlmEmptyResponseException extends RuntimeException {
    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
