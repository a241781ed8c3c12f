package com.phillippitts.voicetutor.service.resilience;

import com.phillippitts.voicetutor.exception.BackendException;
import com.phillippitts.voicetutor.exception.BackendTimeoutException;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Recognises backend failure signatures.
 *
 * <p>A "distress" failure is one that signals the backend itself is overloaded or down: status 429 or
 * 5xx anywhere in the cause chain, or a message mentioning 429, quota or rate limiting. Such failures
 * open the circuit without waiting for the failure rate to become significant.
 */
public final class FailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    private FailureClassifier() {
    }

    public static boolean isDistress(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof BackendException backend && isDistressStatus(backend.getStatus())) {
                return true;
            }
            String message = lowerMessage(current);
            if (message.contains("429") || message.contains("quota") || message.contains("rate limit")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    public static boolean isTimeout(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof BackendTimeoutException
                    || current instanceof TimeoutException
                    || lowerMessage(current).contains("timeout")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    static boolean isDistressStatus(Integer status) {
        return status != null && (status == 429 || (status >= 500 && status < 600));
    }

    private static String lowerMessage(Throwable t) {
        String message = t.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
