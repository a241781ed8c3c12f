package com.phillippitts.voicetutor.service.cache;

/**
 * A question/response pair used to pre-populate the cache for a topic.
 */
public record WarmUpEntry(String question, String response, String subject) {
}
