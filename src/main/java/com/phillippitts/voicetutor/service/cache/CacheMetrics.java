package com.phillippitts.voicetutor.service.cache;

/**
 * Cache counters. {@code memoryUsageKb} is a rough estimate of 0.5 KB per entry.
 */
public record CacheMetrics(
        long hits,
        long misses,
        double hitRate,
        long totalEntries,
        double memoryUsageKb
) {
}
