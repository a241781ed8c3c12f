package com.phillippitts.voicetutor.util;

/** Utility for privacy-safe logging of learner text previews. */
public final class LogSanitizer {

    /** Default preview length for utterances and questions in log lines. */
    public static final int DEFAULT_PREVIEW_CHARS = 50;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: line breaks flattened, cut at {@link #DEFAULT_PREVIEW_CHARS} with a trailing
     * ellipsis when something was dropped.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        if (flat.length() <= DEFAULT_PREVIEW_CHARS) {
            return flat;
        }
        return truncate(flat, DEFAULT_PREVIEW_CHARS) + "...";
    }
}
