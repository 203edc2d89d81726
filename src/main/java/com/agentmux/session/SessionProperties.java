package com.agentmux.session;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agentmux.session")
public class SessionProperties {

    private int maxConcurrentSessions = 20;
    private int bufferCapacity = 1000;
    private long bufferMaxBytes = 1024L * 1024L;
    private int maxTurnsCeiling = 1000;
    private int defaultMaxTurns = 10;
    private int retentionSeconds = 60;
    private int cleanupIntervalSeconds = 60;
    private long workingThresholdMs = 2000;
    private int lastOutputLines = 3;

    public int getMaxConcurrentSessions() { return maxConcurrentSessions; }
    public void setMaxConcurrentSessions(int maxConcurrentSessions) { this.maxConcurrentSessions = maxConcurrentSessions; }
    public int getBufferCapacity() { return bufferCapacity; }
    public void setBufferCapacity(int bufferCapacity) { this.bufferCapacity = bufferCapacity; }
    public long getBufferMaxBytes() { return bufferMaxBytes; }
    public void setBufferMaxBytes(long bufferMaxBytes) { this.bufferMaxBytes = bufferMaxBytes; }
    public int getMaxTurnsCeiling() { return maxTurnsCeiling; }
    public void setMaxTurnsCeiling(int maxTurnsCeiling) { this.maxTurnsCeiling = maxTurnsCeiling; }
    public int getDefaultMaxTurns() { return defaultMaxTurns; }
    public void setDefaultMaxTurns(int defaultMaxTurns) { this.defaultMaxTurns = defaultMaxTurns; }

    /** How long a finished session stays queryable before cleanup evicts it. */
    public int getRetentionSeconds() { return retentionSeconds; }
    public void setRetentionSeconds(int retentionSeconds) { this.retentionSeconds = retentionSeconds; }
    public int getCleanupIntervalSeconds() { return cleanupIntervalSeconds; }
    public void setCleanupIntervalSeconds(int cleanupIntervalSeconds) { this.cleanupIntervalSeconds = cleanupIntervalSeconds; }

    /** A session counts as working if it had activity within this window. */
    public long getWorkingThresholdMs() { return workingThresholdMs; }
    public void setWorkingThresholdMs(long workingThresholdMs) { this.workingThresholdMs = workingThresholdMs; }
    public int getLastOutputLines() { return lastOutputLines; }
    public void setLastOutputLines(int lastOutputLines) { this.lastOutputLines = lastOutputLines; }
}
