package com.phillippitts.voicetutor.service.orchestration;

/**
 * Canned tutor response used when generation is unavailable.
 *
 * @param content utterance to speak
 * @param banner  status line for the client
 */
public record FallbackResponse(String content, String banner) {
}
