package com.rekindle.rex.core.llm;

import java.util.Set;

/**
 * @param requestType   the orchestration question, e.g. "RETRY_DECISION"
 * @param contextJson   redacted, normalised context
 * @param allowedValues answers the caller will accept
 */
public record ReasonerRequest(
    String requestType,
    String contextJson,
    Set<String> allowedValues
) {}
