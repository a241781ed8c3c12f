package com.phillippitts.voicetutor.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sizing for the semantic response cache ({@code CACHE_MAX_ENTRIES}, {@code CACHE_TTL_MIN}).
 */
@ConfigurationProperties(prefix = "cache")
@Validated
public class SemanticCacheProperties {

    private boolean enabled = true;

    @Positive(message = "Cache capacity must be positive")
    private int maxEntries = 10_000;

    /** Idle lifetime; every hit restarts it. Default 24 hours. */
    @Positive(message = "Cache TTL must be positive")
    private long ttlMinutes = 1440;

    /** Near-duplicate scan runs only while the cache holds fewer entries than this. */
    @Min(0)
    private int similarityScanLimit = 1000;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.7;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public long getTtlMinutes() {
        return ttlMinutes;
    }

    public void setTtlMinutes(long ttlMinutes) {
        this.ttlMinutes = ttlMinutes;
    }

    public int getSimilarityScanLimit() {
        return similarityScanLimit;
    }

    public void setSimilarityScanLimit(int similarityScanLimit) {
        this.similarityScanLimit = similarityScanLimit;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }
}
