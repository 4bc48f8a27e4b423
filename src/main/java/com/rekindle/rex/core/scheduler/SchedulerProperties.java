package com.rekindle.rex.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "rex.scheduler")
public class SchedulerProperties {

    private boolean autostart = true;
    private Duration tickInterval = Duration.ofSeconds(1);
    private Duration monitorInterval = Duration.ofSeconds(30);
    private Duration recoveryInterval = Duration.ofSeconds(1);
    private Duration progressTimeout = Duration.ofHours(2);
    private int maxRetries = 3;
    private Duration backoffBase = Duration.ofSeconds(30);
    private Duration backoffCap = Duration.ofMinutes(15);
    private int batchSize = 10;
    private Duration priorityBoostAfter = Duration.ofHours(24);
    private int priorityBoostStep = 20;
    private int maxPriority = 100;

    public boolean isAutostart() { return autostart; }
    public void setAutostart(boolean autostart) { this.autostart = autostart; }
    public Duration getTickInterval() { return tickInterval; }
    public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }
    public Duration getMonitorInterval() { return monitorInterval; }
    public void setMonitorInterval(Duration monitorInterval) { this.monitorInterval = monitorInterval; }
    public Duration getRecoveryInterval() { return recoveryInterval; }
    public void setRecoveryInterval(Duration recoveryInterval) { this.recoveryInterval = recoveryInterval; }
    public Duration getProgressTimeout() { return progressTimeout; }
    public void setProgressTimeout(Duration progressTimeout) { this.progressTimeout = progressTimeout; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public Duration getBackoffBase() { return backoffBase; }
    public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
    public Duration getBackoffCap() { return backoffCap; }
    public void setBackoffCap(Duration backoffCap) { this.backoffCap = backoffCap; }
    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    public Duration getPriorityBoostAfter() { return priorityBoostAfter; }
    public void setPriorityBoostAfter(Duration priorityBoostAfter) { this.priorityBoostAfter = priorityBoostAfter; }
    public int getPriorityBoostStep() { return priorityBoostStep; }
    public void setPriorityBoostStep(int priorityBoostStep) { this.priorityBoostStep = priorityBoostStep; }
    public int getMaxPriority() { return maxPriority; }
    public void setMaxPriority(int maxPriority) { this.maxPriority = maxPriority; }
}
