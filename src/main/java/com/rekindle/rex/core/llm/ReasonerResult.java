package com.rekindle.rex.core.llm;

/**
 * Response contract of the reasoning provider: {@code {"decision": ..., "confidence": 0..1}}.
 * Both fields are nullable so a malformed answer can be detected by the caller.
 */
public record ReasonerResult(
    String decision,
    Double confidence
) {}
