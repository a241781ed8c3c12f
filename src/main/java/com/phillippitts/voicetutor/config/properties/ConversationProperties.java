package com.phillippitts.voicetutor.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retention bounds for per-session dialog contexts.
 */
@ConfigurationProperties(prefix = "conversation")
@Validated
public class ConversationProperties {

    /** Contexts idle for longer than this are dropped by the cleanup sweep. */
    @Positive
    private long contextIdleTtlMinutes = 1440;

    /** Hard cap on retained contexts; the least recently active are dropped beyond it. */
    @Positive
    private int maxContexts = 50_000;

    /** Interval of the scheduled cleanup sweep. */
    @Positive
    private long cleanupIntervalMs = 300_000;

    public long getContextIdleTtlMinutes() {
        return contextIdleTtlMinutes;
    }

    public void setContextIdleTtlMinutes(long contextIdleTtlMinutes) {
        this.contextIdleTtlMinutes = contextIdleTtlMinutes;
    }

    public int getMaxContexts() {
        return maxContexts;
    }

    public void setMaxContexts(int maxContexts) {
        this.maxContexts = maxContexts;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        this.cleanupIntervalMs = cleanupIntervalMs;
    }
}
