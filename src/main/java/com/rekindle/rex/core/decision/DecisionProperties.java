package com.rekindle.rex.core.decision;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "rex.decision")
public class DecisionProperties {

    private Duration ruleBudget = Duration.ofMillis(50);
    private Duration llmTimeout = Duration.ofSeconds(5);
    private Duration cacheTtl = Duration.ofHours(1);
    private long cacheMaxEntries = 10_000;
    private int auditCapacity = 1000;
    private int reasonerThreads = 4;
    private int escalationPriorityThreshold = 80;
    private double rateLimitUtilization = 0.9;
    private List<String> terminalErrorCodes = new ArrayList<>(List.of(
            "VALIDATION_ERROR", "INVALID_PAYLOAD", "AUTH_ERROR", "UNSUBSCRIBED", "COMPLIANCE_BLOCK"));
    private List<String> transientErrorCodes = new ArrayList<>(List.of(
            "PROVIDER_TIMEOUT", "PROVIDER_5XX", "RATE_LIMITED", "WORKER_CRASH", "PROGRESS_TIMEOUT",
            "DISPATCH_FAILED"));

    public Duration getRuleBudget() { return ruleBudget; }
    public void setRuleBudget(Duration ruleBudget) { this.ruleBudget = ruleBudget; }
    public Duration getLlmTimeout() { return llmTimeout; }
    public void setLlmTimeout(Duration llmTimeout) { this.llmTimeout = llmTimeout; }
    public Duration getCacheTtl() { return cacheTtl; }
    public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
    public long getCacheMaxEntries() { return cacheMaxEntries; }
    public void setCacheMaxEntries(long cacheMaxEntries) { this.cacheMaxEntries = cacheMaxEntries; }
    public int getAuditCapacity() { return auditCapacity; }
    public void setAuditCapacity(int auditCapacity) { this.auditCapacity = auditCapacity; }
    public int getReasonerThreads() { return reasonerThreads; }
    public void setReasonerThreads(int reasonerThreads) { this.reasonerThreads = reasonerThreads; }
    public int getEscalationPriorityThreshold() { return escalationPriorityThreshold; }
    public void setEscalationPriorityThreshold(int escalationPriorityThreshold) {
        this.escalationPriorityThreshold = escalationPriorityThreshold;
    }
    public double getRateLimitUtilization() { return rateLimitUtilization; }
    public void setRateLimitUtilization(double rateLimitUtilization) { this.rateLimitUtilization = rateLimitUtilization; }
    public List<String> getTerminalErrorCodes() { return terminalErrorCodes; }
    public void setTerminalErrorCodes(List<String> terminalErrorCodes) { this.terminalErrorCodes = terminalErrorCodes; }
    public List<String> getTransientErrorCodes() { return transientErrorCodes; }
    public void setTransientErrorCodes(List<String> transientErrorCodes) { this.transientErrorCodes = transientErrorCodes; }
}
