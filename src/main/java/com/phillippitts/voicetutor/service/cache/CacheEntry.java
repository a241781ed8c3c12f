package com.phillippitts.voicetutor.service.cache;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of a cached response as returned by {@link SemanticCache#get(String, String)}.
 *
 * @param content   cached tutor response
 * @param topic     topic (lesson) the response belongs to
 * @param subject   subject area used for citations
 * @param createdAt when the response was cached
 * @param hits      hits including the lookup that produced this view
 * @param citations citations derived from topic and subject metadata
 */
public record CacheEntry(
        String content,
        String topic,
        String subject,
        Instant createdAt,
        int hits,
        List<String> citations
) {
    public CacheEntry {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
