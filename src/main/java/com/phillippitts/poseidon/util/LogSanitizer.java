package com.phillippitts.poseidon.util;

/** Utility for privacy-safe logging of model replies and user captions. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Collapses line breaks and truncates, so user-supplied text cannot forge log lines.
     */
    public static String singleLine(String s, int max) {
        if (s == null) {
            return "";
        }
        return truncate(s.replaceAll("[\\r\\n\\t]+", " ").strip(), max);
    }
}
