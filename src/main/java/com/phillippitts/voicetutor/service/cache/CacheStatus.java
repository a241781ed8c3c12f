package com.phillippitts.voicetutor.service.cache;

public record CacheStatus(long size, long maxSize, CacheMetrics metrics, boolean enabled) {
}
